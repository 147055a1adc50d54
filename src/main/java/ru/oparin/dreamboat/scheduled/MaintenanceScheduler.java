package ru.oparin.dreamboat.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.config.properties.GenerationProperties;
import ru.oparin.dreamboat.model.entity.GenerationJob;
import ru.oparin.dreamboat.repository.GeneratedResultRepository;
import ru.oparin.dreamboat.service.generation.GenerationTracker;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Планировщик обслуживания заданий генерации.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaintenanceScheduler {

    private final GenerationTracker generationTracker;
    private final GeneratedResultRepository generatedResultRepository;
    private final GenerationProperties generationProperties;
    private final Clock clock;

    /**
     * Финализация заданий, зависших в статусе IN_PROGRESS (например, после перезапуска сервиса).
     */
    @Scheduled(fixedDelayString = "${app.generation.orphan-sweep.interval-ms:300000}")
    public void finalizeOrphanedJobs() {
        GenerationProperties.OrphanSweep orphanSweep = generationProperties.getOrphanSweep();
        if (orphanSweep == null || !orphanSweep.isEnabled()) {
            log.debug("Финализация зависших заданий отключена");
            return;
        }

        try {
            sweepOrphans()
                    .doOnNext(count -> {
                        if (count > 0) {
                            log.info("Финализировано зависших заданий: {}", count);
                        }
                    })
                    .doOnError(error -> log.error("Ошибка при финализации зависших заданий: {}", error.getMessage()))
                    .subscribe();
        } catch (Exception e) {
            log.error("Ошибка при поиске зависших заданий", e);
        }
    }

    /**
     * Финализировать задания, не подававшие признаков жизни дольше orphanTimeout.
     * Выполняющееся задание обновляет отметку после каждого пакета и не попадает в выборку.
     * Количество выполненных задач берется по сохраненным результатам задания, поэтому
     * задание получает FAILED, если результатов меньше, чем задач.
     *
     * @return количество финализированных заданий
     */
    public Mono<Long> sweepOrphans() {
        LocalDateTime silentSince = LocalDateTime.now(clock).minus(generationProperties.getOrphanTimeout());

        return generationTracker.findOrphans(silentSince)
                .concatMap(this::finalizeOrphan)
                .count();
    }

    private Mono<GenerationJob> finalizeOrphan(GenerationJob job) {
        return generatedResultRepository.countByGenerationJobId(job.getId())
                .defaultIfEmpty(0L)
                .flatMap(completed -> {
                    int successCount = (int) Math.min(completed, job.getTotalTasks());
                    log.warn("Задание {} пользователя {} не отвечает с {}, выполнено {} из {}",
                            job.getId(), job.getUserId(), job.getHeartbeatAt() != null ? job.getHeartbeatAt() : job.getCreatedAt(),
                            successCount, job.getTotalTasks());
                    return generationTracker.close(job.getId(), successCount, job.getTotalTasks());
                })
                .thenReturn(job)
                .onErrorResume(IllegalStateException.class, e -> {
                    log.info("Задание {} уже финализировано: {}", job.getId(), e.getMessage());
                    return Mono.empty();
                });
    }
}
