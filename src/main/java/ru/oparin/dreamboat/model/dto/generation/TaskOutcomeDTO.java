package ru.oparin.dreamboat.model.dto.generation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Результат одной задачи генерации.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskOutcomeDTO {

    private Integer position;

    private Long photoId;

    private String scenario;

    private Boolean success;

    /**
     * Идентификатор сгенерированного изображения (при успехе).
     */
    private Long resultId;

    private String storageLocator;

    /**
     * Текст ошибки (при неудаче).
     */
    private String error;
}
