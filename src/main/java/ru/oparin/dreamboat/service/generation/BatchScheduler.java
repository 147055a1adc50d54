package ru.oparin.dreamboat.service.generation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.config.properties.GenerationProperties;

import java.util.List;
import java.util.function.Function;

/**
 * Выполнение задач пакетами фиксированного размера.
 * Задачи внутри пакета выполняются параллельно, следующий пакет запускается после
 * завершения всех задач текущего. Ошибка одной задачи не влияет на остальные.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchScheduler {

    private final GenerationProperties generationProperties;

    public <T, R> Mono<List<TaskOutcome<T, R>>> run(List<T> tasks, Function<T, Mono<R>> worker) {
        return run(tasks, generationProperties.getBatchSize(), worker);
    }

    public <T, R> Mono<List<TaskOutcome<T, R>>> run(List<T> tasks, Function<T, Mono<R>> worker,
                                                    Function<List<TaskOutcome<T, R>>, Mono<Void>> onBatchSettled) {
        return run(tasks, generationProperties.getBatchSize(), worker, onBatchSettled);
    }

    public <T, R> Mono<List<TaskOutcome<T, R>>> run(List<T> tasks, int batchSize, Function<T, Mono<R>> worker) {
        return run(tasks, batchSize, worker, outcomes -> Mono.empty());
    }

    /**
     * Выполнить задачи.
     *
     * @param tasks          задачи
     * @param batchSize      размер пакета
     * @param worker         обработчик одной задачи
     * @param onBatchSettled вызывается после завершения всех задач пакета, до запуска следующего
     * @return результаты в порядке исходных задач
     */
    public <T, R> Mono<List<TaskOutcome<T, R>>> run(List<T> tasks, int batchSize, Function<T, Mono<R>> worker,
                                                    Function<List<TaskOutcome<T, R>>, Mono<Void>> onBatchSettled) {
        if (batchSize < 1) {
            return Mono.error(new IllegalArgumentException("Размер пакета должен быть положительным"));
        }
        if (tasks.isEmpty()) {
            return Mono.just(List.of());
        }

        int batchCount = (tasks.size() + batchSize - 1) / batchSize;
        log.info("Запуск {} задач в {} пакетах по {}", tasks.size(), batchCount, batchSize);

        return Flux.fromIterable(tasks)
                .buffer(batchSize)
                .index()
                .concatMap(indexedBatch -> {
                    List<T> batch = indexedBatch.getT2();
                    log.debug("Пакет {}/{}: {} задач", indexedBatch.getT1() + 1, batchCount, batch.size());
                    return Flux.fromIterable(batch)
                            .flatMapSequential(task -> settle(task, worker), batch.size())
                            .collectList()
                            .flatMap(outcomes -> onBatchSettled.apply(outcomes).thenReturn(outcomes))
                            .flatMapIterable(outcomes -> outcomes);
                })
                .collectList();
    }

    private <T, R> Mono<TaskOutcome<T, R>> settle(T task, Function<T, Mono<R>> worker) {
        return Mono.defer(() -> worker.apply(task))
                .map(value -> TaskOutcome.<T, R>success(task, value))
                .switchIfEmpty(Mono.fromSupplier(() ->
                        TaskOutcome.failure(task, new IllegalStateException("Задача не вернула результат"))))
                .onErrorResume(error -> Mono.just(TaskOutcome.failure(task, error)));
    }
}
