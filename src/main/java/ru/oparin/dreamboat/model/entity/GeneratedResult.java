package ru.oparin.dreamboat.model.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Сущность сгенерированного изображения.
 * Создается для каждой успешно выполненной задачи. Порядок в профиле (profileOrder)
 * уникален в пределах владельца и принимает значения 1..6.
 */
@Table(value = "generated_result", schema = "dreamboat")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedResult {

    @Id
    private Long id;

    private Long userId;

    /**
     * Задание, в рамках которого получен результат. null для пробных изображений.
     */
    private Long generationJobId;

    /**
     * Исходная фотография.
     */
    private Long sourcePhotoId;

    /**
     * Имя сценария.
     */
    private String scenario;

    /**
     * Итоговый промпт, отправленный в сервис синтеза.
     */
    private String prompt;

    /**
     * Путь к изображению в хранилище.
     */
    private String storageLocator;

    /**
     * Идентификатор запроса у провайдера синтеза.
     */
    private String providerRequestId;

    /**
     * Позиция в профиле (1..6) или null, если изображение не выбрано.
     */
    private Integer profileOrder;

    /**
     * Пробное изображение, полученное без оплаты.
     */
    @Builder.Default
    private Boolean isSample = false;

    private LocalDateTime createdAt;
}
