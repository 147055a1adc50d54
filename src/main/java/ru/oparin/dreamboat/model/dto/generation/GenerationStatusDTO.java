package ru.oparin.dreamboat.model.dto.generation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.dreamboat.model.enums.GenerationStatus;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Состояние последнего задания генерации пользователя.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationStatusDTO {

    /**
     * Есть ли задание в статусе IN_PROGRESS.
     */
    private Boolean active;

    private Long jobId;

    private GenerationStatus status;

    private Integer totalTasks;

    private Integer completedTasks;

    private List<String> scenarios;

    private LocalDateTime createdAt;

    private LocalDateTime completedAt;
}
