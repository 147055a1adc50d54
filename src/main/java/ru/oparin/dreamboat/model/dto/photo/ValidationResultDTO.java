package ru.oparin.dreamboat.model.dto.photo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.dreamboat.model.enums.ValidationStatus;
import ru.oparin.dreamboat.model.enums.ValidationWarning;

import java.util.Set;

/**
 * Результат проверки фотографии.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResultDTO {

    private Long photoId;

    /**
     * Фотография пригодна для генерации.
     */
    private Boolean isValid;

    private ValidationStatus status;

    private Set<ValidationWarning> warnings;

    /**
     * Результат взят из сохраненной проверки без обращения к сервису анализа.
     */
    private Boolean cached;
}
