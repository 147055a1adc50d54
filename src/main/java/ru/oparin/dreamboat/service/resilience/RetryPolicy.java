package ru.oparin.dreamboat.service.resilience;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Параметры повторов: количество попыток, базовая задержка и фильтр повторяемых ошибок.
 */
@Getter
@Builder(toBuilder = true)
public class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

    @Builder.Default
    private final int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    @Builder.Default
    private final Duration baseDelay = DEFAULT_BASE_DELAY;

    /**
     * Ошибки, для которых предикат возвращает false, пробрасываются без повторов.
     */
    @Builder.Default
    private final Predicate<Throwable> retryOn = error -> true;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay) {
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .build();
    }

    /**
     * Задержка после неудачной попытки с номером attempt (нумерация с 1): baseDelay * 2^(attempt-1).
     */
    public Duration backoffAfter(int attempt) {
        return baseDelay.multipliedBy(1L << (attempt - 1));
    }

    /**
     * Копия политики, не повторяющая ошибки указанного типа.
     */
    public RetryPolicy notRetrying(Class<? extends Throwable> errorType) {
        Predicate<Throwable> current = retryOn;
        return toBuilder()
                .retryOn(error -> !errorType.isInstance(error) && current.test(error))
                .build();
    }

    public boolean isRetryable(Throwable error) {
        return retryOn.test(error);
    }
}
