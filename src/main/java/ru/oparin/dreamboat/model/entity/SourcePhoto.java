package ru.oparin.dreamboat.model.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.dreamboat.model.enums.ValidationStatus;
import ru.oparin.dreamboat.model.enums.ValidationWarning;
import ru.oparin.dreamboat.util.JsonUtils;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Сущность исходной фотографии пользователя.
 * Создается после подтверждения загрузки, статус проверки меняет PhotoValidator
 * или явный пропуск проверки.
 */
@Table(value = "source_photo", schema = "dreamboat")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourcePhoto {

    @Id
    private Long id;

    private Long userId;

    /**
     * Имя файла на устройстве пользователя.
     */
    private String originalFileName;

    /**
     * Путь к фотографии в хранилище.
     */
    private String storageLocator;

    /**
     * MIME тип фотографии.
     */
    private String contentType;

    @Builder.Default
    private ValidationStatus validationStatus = ValidationStatus.PENDING;

    /**
     * Замечания проверки в формате JSON массива имен полей.
     */
    @Column("warnings")
    private String warningsJson;

    private LocalDateTime validatedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * Получить замечания проверки.
     */
    @Transient
    public Set<ValidationWarning> getWarnings() {
        Set<ValidationWarning> warnings = EnumSet.noneOf(ValidationWarning.class);
        for (String fieldName : JsonUtils.parseJsonToList(warningsJson)) {
            ValidationWarning warning = ValidationWarning.fromFieldName(fieldName);
            if (warning != null) {
                warnings.add(warning);
            }
        }
        return warnings;
    }

    /**
     * Установить замечания проверки, сериализовав в JSON.
     */
    @Transient
    public void setWarnings(Set<ValidationWarning> warnings) {
        List<String> fieldNames = warnings.stream()
                .sorted()
                .map(ValidationWarning::getFieldName)
                .toList();
        this.warningsJson = JsonUtils.convertListToJson(fieldNames);
    }

    /**
     * Фотографию можно использовать для генерации после успешной проверки или явного пропуска.
     */
    @Transient
    public boolean isEligibleForGeneration() {
        return ValidationStatus.isTerminal(validationStatus);
    }
}
