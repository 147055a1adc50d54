package ru.oparin.dreamboat.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Запуск фоновых задач, не связанных с HTTP запросом.
 * Ошибки задач не возвращаются вызывающему: они логируются и учитываются в счетчике.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DetachedTaskRunner {

    private final Scheduler detachedTaskScheduler;

    private final AtomicLong completedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    /**
     * Запустить задачу, не дожидаясь ее завершения.
     *
     * @param taskName имя задачи для логов
     * @param task     задача
     */
    public Disposable submit(String taskName, Mono<?> task) {
        log.info("Фоновая задача {} запущена", taskName);
        return Mono.defer(() -> task)
                .subscribeOn(detachedTaskScheduler)
                .subscribe(
                        result -> {
                            completedCount.incrementAndGet();
                            log.info("Фоновая задача {} завершена", taskName);
                        },
                        error -> {
                            failedCount.incrementAndGet();
                            log.error("Фоновая задача {} завершилась ошибкой: {}", taskName, error.getMessage(), error);
                        });
    }

    public long getCompletedCount() {
        return completedCount.get();
    }

    public long getFailedCount() {
        return failedCount.get();
    }
}
