package ru.oparin.dreamboat.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import ru.oparin.dreamboat.service.resilience.BackoffSleeper;

import java.time.Clock;
import java.time.Instant;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Общие компоненты оркестрации: время, случайность, ожидания и фоновые задачи.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Источник случайности для автоматического выбора изображений профиля.
     */
    @Bean
    public Random profileShuffleRandom() {
        return new Random();
    }

    /**
     * Неблокирующие ожидания между попытками на таймере Reactor.
     */
    @Bean
    public BackoffSleeper backoffSleeper() {
        return delay -> Mono.delay(delay).then();
    }

    /**
     * Планировщик для фоновых задач, не привязанных к HTTP запросу.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler detachedTaskScheduler() {
        return Schedulers.newBoundedElastic(8, 1000, "detached-task");
    }

    /**
     * Ближайшее свободное время вызова для каждого внешнего сервиса.
     * Запись удаляется, если к сервису давно не обращались.
     */
    @Bean
    public Cache<String, AtomicReference<Instant>> rateLimiterSlots() {
        return Caffeine.newBuilder()
                .maximumSize(100)
                .expireAfterAccess(1, TimeUnit.HOURS)
                .build();
    }
}
