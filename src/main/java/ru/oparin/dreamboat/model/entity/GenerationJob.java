package ru.oparin.dreamboat.model.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.dreamboat.model.enums.GenerationStatus;
import ru.oparin.dreamboat.util.JsonUtils;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Сущность задания генерации.
 * Создается до запуска первой задачи и финализируется ровно один раз.
 * Пока задание выполняется, heartbeatAt обновляется после каждого пакета задач.
 * Задание, оставшееся в IN_PROGRESS после сбоя, находит планировщик обслуживания по heartbeatAt.
 */
@Table(value = "generation_job", schema = "dreamboat")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationJob {

    @Id
    private Long id;

    /**
     * Идентификатор владельца задания.
     */
    private Long userId;

    /**
     * Идентификатор использованного платежного кредита.
     */
    private Long paymentCreditId;

    /**
     * Текущий статус задания.
     */
    @Builder.Default
    private GenerationStatus status = GenerationStatus.IN_PROGRESS;

    /**
     * Общее количество задач (фотографии x сценарии).
     */
    private Integer totalTasks;

    /**
     * Количество успешно выполненных задач. Заполняется при финализации.
     */
    @Builder.Default
    private Integer completedTasks = 0;

    /**
     * Список сценариев задания в формате JSON массива.
     */
    @Column("scenarios")
    private String scenariosJson;

    private LocalDateTime createdAt;

    /**
     * Время последнего признака жизни задания: создание или завершение очередного пакета.
     */
    private LocalDateTime heartbeatAt;

    /**
     * Время финализации. После установки запись не изменяется.
     */
    private LocalDateTime completedAt;

    @Transient
    public List<String> getScenarios() {
        return JsonUtils.parseJsonToList(scenariosJson);
    }

    @Transient
    public void setScenarios(List<String> scenarios) {
        this.scenariosJson = JsonUtils.convertListToJson(scenarios);
    }
}
