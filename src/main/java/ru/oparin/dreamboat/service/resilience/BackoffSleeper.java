package ru.oparin.dreamboat.service.resilience;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Неблокирующее ожидание перед повтором или очередным вызовом.
 */
@FunctionalInterface
public interface BackoffSleeper {

    Mono<Void> sleep(Duration delay);
}
