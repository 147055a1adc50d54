package ru.oparin.dreamboat.service.generation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.model.entity.GenerationJob;
import ru.oparin.dreamboat.model.enums.GenerationStatus;
import ru.oparin.dreamboat.repository.GenerationJobRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Учет заданий генерации.
 * Задание создается в статусе IN_PROGRESS до запуска задач и финализируется ровно один раз.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationTracker {

    private final GenerationJobRepository generationJobRepository;
    private final Clock clock;

    /**
     * Создать задание в статусе IN_PROGRESS.
     */
    public Mono<GenerationJob> open(Long userId, Long paymentCreditId, int totalTasks, List<String> scenarios) {
        if (totalTasks < 1) {
            return Mono.error(new IllegalArgumentException("Задание должно содержать хотя бы одну задачу"));
        }
        LocalDateTime now = LocalDateTime.now(clock);
        GenerationJob job = GenerationJob.builder()
                .userId(userId)
                .paymentCreditId(paymentCreditId)
                .status(GenerationStatus.IN_PROGRESS)
                .totalTasks(totalTasks)
                .completedTasks(0)
                .createdAt(now)
                .heartbeatAt(now)
                .build();
        job.setScenarios(scenarios);

        return generationJobRepository.save(job)
                .doOnNext(saved -> log.info("Создано задание генерации {} для пользователя {}: {} задач",
                        saved.getId(), userId, totalTasks));
    }

    /**
     * Финализировать задание: COMPLETED, если выполнены все задачи, иначе FAILED.
     *
     * @throws IllegalStateException если задание уже финализировано
     */
    public Mono<GenerationStatus> close(Long jobId, int successCount, int totalTasks) {
        if (successCount < 0 || successCount > totalTasks) {
            return Mono.error(new IllegalArgumentException(
                    "Некорректное количество выполненных задач: " + successCount + " из " + totalTasks));
        }
        GenerationStatus status = resolveStatus(successCount, totalTasks);

        return generationJobRepository.finalizeJob(jobId, status.name(), successCount, LocalDateTime.now(clock))
                .flatMap(updated -> {
                    if (updated == 0) {
                        return Mono.error(new IllegalStateException("Задание " + jobId + " уже финализировано или не найдено"));
                    }
                    log.info("Задание {} завершено со статусом {}: выполнено {} из {}",
                            jobId, status, successCount, totalTasks);
                    return Mono.just(status);
                });
    }

    /**
     * Отметить, что задание еще выполняется.
     * Для уже финализированного задания ничего не меняет.
     */
    public Mono<Void> heartbeat(Long jobId) {
        return generationJobRepository.touchHeartbeat(jobId, LocalDateTime.now(clock))
                .doOnNext(updated -> {
                    if (updated == 0) {
                        log.warn("Задание {} уже финализировано, отметка выполнения пропущена", jobId);
                    }
                })
                .then();
    }

    public Mono<GenerationJob> findActive(Long userId) {
        return generationJobRepository.findActiveByUserId(userId);
    }

    /**
     * Задания в статусе IN_PROGRESS, не подававшие признаков жизни с момента silentSince.
     */
    public Flux<GenerationJob> findOrphans(LocalDateTime silentSince) {
        return generationJobRepository.findInProgressSilentSince(silentSince);
    }

    static GenerationStatus resolveStatus(int successCount, int totalTasks) {
        return successCount == totalTasks ? GenerationStatus.COMPLETED : GenerationStatus.FAILED;
    }
}
