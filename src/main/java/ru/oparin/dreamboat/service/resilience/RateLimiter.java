package ru.oparin.dreamboat.service.resilience;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Ограничение частоты вызовов внешних сервисов.
 * Между началами двух вызовов одного сервиса проходит не меньше заданного интервала.
 * Каждый вызов резервирует следующий свободный слот и ждет его наступления.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimiter {

    private final Cache<String, AtomicReference<Instant>> rateLimiterSlots;
    private final BackoffSleeper backoffSleeper;
    private final Clock clock;

    /**
     * Выполнить операцию не раньше, чем через minInterval после предыдущего вызова того же сервиса.
     *
     * @param dependencyKey имя внешнего сервиса
     * @param minInterval   минимальный интервал между вызовами
     * @param operation     операция
     */
    public <T> Mono<T> throttle(String dependencyKey, Duration minInterval, Supplier<Mono<T>> operation) {
        return Mono.defer(() -> {
            Duration wait = reserveSlot(dependencyKey, minInterval);
            if (wait.isZero()) {
                return Mono.defer(operation);
            }
            log.debug("Ожидание {} мс перед вызовом {}", wait.toMillis(), dependencyKey);
            return backoffSleeper.sleep(wait).then(Mono.defer(operation));
        });
    }

    /**
     * Зарезервировать слот и вернуть время ожидания до него.
     */
    Duration reserveSlot(String dependencyKey, Duration minInterval) {
        AtomicReference<Instant> nextSlot = rateLimiterSlots.get(dependencyKey, key -> new AtomicReference<>(Instant.EPOCH));
        while (true) {
            Instant now = clock.instant();
            Instant current = nextSlot.get();
            Instant start = current.isAfter(now) ? current : now;
            if (nextSlot.compareAndSet(current, start.plus(minInterval))) {
                return Duration.between(now, start);
            }
        }
    }
}
