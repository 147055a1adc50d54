package ru.oparin.dreamboat.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.model.entity.GenerationJob;

import java.time.LocalDateTime;

@Repository
public interface GenerationJobRepository extends ReactiveCrudRepository<GenerationJob, Long> {

    @Query("SELECT * FROM dreamboat.generation_job WHERE user_id = :userId AND status = 'IN_PROGRESS' " +
            "ORDER BY created_at DESC LIMIT 1")
    Mono<GenerationJob> findActiveByUserId(Long userId);

    /**
     * Задания в статусе IN_PROGRESS без признаков жизни с указанного момента.
     * Для записей без heartbeat_at используется время создания.
     */
    @Query("SELECT * FROM dreamboat.generation_job WHERE status = 'IN_PROGRESS' " +
            "AND COALESCE(heartbeat_at, created_at) < :silentSince")
    Flux<GenerationJob> findInProgressSilentSince(LocalDateTime silentSince);

    /**
     * Отметить, что задание еще выполняется. Финализированные задания не изменяются.
     *
     * @return количество измененных строк: 0, если задание уже финализировано или не существует
     */
    @Modifying
    @Query("UPDATE dreamboat.generation_job SET heartbeat_at = :heartbeatAt WHERE id = :id AND status = 'IN_PROGRESS'")
    Mono<Integer> touchHeartbeat(Long id, LocalDateTime heartbeatAt);

    @Query("SELECT * FROM dreamboat.generation_job WHERE user_id = :userId ORDER BY created_at DESC")
    Flux<GenerationJob> findByUserIdOrderByCreatedAtDesc(Long userId);

    /**
     * Финализировать задание. Обновляет только задания в статусе IN_PROGRESS.
     *
     * @return количество измененных строк: 0, если задание уже финализировано или не существует
     */
    @Modifying
    @Query("UPDATE dreamboat.generation_job SET status = :status, completed_tasks = :completedTasks, " +
            "completed_at = :completedAt WHERE id = :id AND status = 'IN_PROGRESS'")
    Mono<Integer> finalizeJob(Long id, String status, Integer completedTasks, LocalDateTime completedAt);
}
