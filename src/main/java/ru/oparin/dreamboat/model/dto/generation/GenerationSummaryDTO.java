package ru.oparin.dreamboat.model.dto.generation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.dreamboat.model.enums.GenerationStatus;

import java.util.List;

/**
 * Итог выполнения задания генерации.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationSummaryDTO {

    private Long jobId;

    private GenerationStatus status;

    /**
     * Количество обработанных задач.
     */
    private Integer processed;

    private Integer successful;

    private Integer failed;

    /**
     * Было ли выполнено автоматическое заполнение профиля.
     */
    private Boolean profileAutoSelected;

    private List<TaskOutcomeDTO> results;
}
