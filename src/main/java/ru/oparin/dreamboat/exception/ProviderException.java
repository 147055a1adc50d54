package ru.oparin.dreamboat.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import ru.oparin.dreamboat.service.resilience.RetryAfterAware;

import java.time.Duration;
import java.util.Optional;

/**
 * Ошибка внешнего сервиса (синтез изображений, анализ фотографий).
 * Может содержать рекомендуемую задержку перед повтором.
 */
public class ProviderException extends RuntimeException implements RetryAfterAware {

    @Getter
    private final HttpStatus status;

    private final Duration retryAfter;

    public ProviderException(HttpStatus status, String message) {
        this(status, message, null, null);
    }

    public ProviderException(HttpStatus status, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.retryAfter = retryAfter;
    }

    @Override
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
