package ru.oparin.dreamboat.service.resilience;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import ru.oparin.dreamboat.exception.ExhaustedRetriesException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Повторное выполнение операций с экспоненциальной задержкой.
 * Используется для вызовов внешних сервисов синтеза и анализа.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetryExecutor {

    private final BackoffSleeper backoffSleeper;

    /**
     * Выполнить операцию с повторами.
     * Каждая попытка заново вызывает supplier. После maxAttempts неудач возвращается
     * ExhaustedRetriesException с последней ошибкой. Ошибки, не проходящие фильтр политики,
     * пробрасываются сразу и без обертки.
     *
     * @param operationName имя операции для логов
     * @param policy        политика повторов
     * @param operation     операция
     * @return результат первой успешной попытки
     */
    public <T> Mono<T> execute(String operationName, RetryPolicy policy, Supplier<Mono<T>> operation) {
        if (policy.getMaxAttempts() < 1) {
            return Mono.error(new IllegalArgumentException("maxAttempts должен быть не меньше 1"));
        }
        return Mono.defer(operation)
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> nextAttempt(operationName, policy, signal))));
    }

    /**
     * Решение по очередной ошибке: ожидание перед повтором либо завершение ошибкой.
     * Номер неудачной попытки считается с 1.
     */
    private Mono<Long> nextAttempt(String operationName, RetryPolicy policy, Retry.RetrySignal signal) {
        Throwable error = signal.failure();
        int attempt = (int) signal.totalRetries() + 1;

        if (!policy.isRetryable(error)) {
            log.warn("Операция {}: ошибка не подлежит повтору: {}", operationName, error.getMessage());
            return Mono.error(error);
        }
        if (attempt >= policy.getMaxAttempts()) {
            log.error("Операция {}: исчерпаны все {} попытки, последняя ошибка: {}",
                    operationName, attempt, error.getMessage());
            return Mono.error(new ExhaustedRetriesException(operationName, attempt, error));
        }
        Duration delay = resolveDelay(policy, attempt, error);
        log.warn("Операция {}: попытка {}/{} не удалась ({}), повтор через {} мс",
                operationName, attempt, policy.getMaxAttempts(), error.getMessage(), delay.toMillis());
        return backoffSleeper.sleep(delay).thenReturn((long) attempt);
    }

    private Duration resolveDelay(RetryPolicy policy, int attempt, Throwable error) {
        if (error instanceof RetryAfterAware retryAfterAware) {
            return retryAfterAware.getRetryAfter()
                    .filter(delay -> !delay.isNegative())
                    .orElseGet(() -> policy.backoffAfter(attempt));
        }
        return policy.backoffAfter(attempt);
    }
}
