package ru.oparin.dreamboat.service.resilience;

import java.time.Duration;
import java.util.Optional;

/**
 * Ошибка, содержащая рекомендуемую сервисом задержку перед повтором.
 */
public interface RetryAfterAware {

    Optional<Duration> getRetryAfter();
}
