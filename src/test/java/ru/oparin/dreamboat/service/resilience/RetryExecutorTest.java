package ru.oparin.dreamboat.service.resilience;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.dreamboat.exception.AnalysisResponseException;
import ru.oparin.dreamboat.exception.ExhaustedRetriesException;
import ru.oparin.dreamboat.exception.ProviderException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit test для RetryExecutor.
 * Ожидания записываются вместо реальной задержки, чтобы проверить расписание повторов.
 */
class RetryExecutorTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private RetryExecutor retryExecutor;

    @BeforeEach
    void setUp() {
        sleeps.clear();
        retryExecutor = new RetryExecutor(delay -> {
            sleeps.add(delay);
            return Mono.empty();
        });
    }

    @Test
    void execute_shouldReturnValue_whenFirstAttemptSucceeds() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(retryExecutor.execute("op", RetryPolicy.defaults(),
                        () -> Mono.fromSupplier(() -> "ok-" + calls.incrementAndGet())))
                .expectNext("ok-1")
                .verifyComplete();

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void execute_shouldBackOffExponentially_whenAttemptsFailThenSucceed() {
        // Given - fail, fail, succeed
        AtomicInteger calls = new AtomicInteger();

        // When
        Mono<String> result = retryExecutor.execute("op", RetryPolicy.of(3, Duration.ofSeconds(1)),
                () -> Mono.defer(() -> calls.incrementAndGet() < 3
                        ? Mono.<String>error(new IllegalStateException("attempt " + calls.get()))
                        : Mono.just("done")));

        // Then
        StepVerifier.create(result)
                .expectNext("done")
                .verifyComplete();
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void execute_shouldFailWithLastError_whenAllAttemptsFail() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        Mono<String> result = retryExecutor.execute("op", RetryPolicy.of(3, Duration.ofMillis(100)),
                () -> Mono.error(new IllegalStateException("failure " + calls.incrementAndGet())));

        // Then
        StepVerifier.create(result)
                .expectErrorSatisfies(error -> {
                    ExhaustedRetriesException exhausted = assertInstanceOf(ExhaustedRetriesException.class, error);
                    assertEquals("failure 3", exhausted.getMessage());
                    assertEquals(3, exhausted.getAttempts());
                    assertInstanceOf(IllegalStateException.class, exhausted.getCause());
                })
                .verify();
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void execute_shouldCountAttemptsPerSubscription() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        Mono<String> result = retryExecutor.execute("op", RetryPolicy.of(2, Duration.ofMillis(10)),
                () -> Mono.error(new IllegalStateException("failure " + calls.incrementAndGet())));

        // When / Then - each subscription gets its own two attempts
        StepVerifier.create(result)
                .expectErrorMatches(error -> error instanceof ExhaustedRetriesException exhausted
                        && exhausted.getAttempts() == 2)
                .verify();
        StepVerifier.create(result)
                .expectErrorMatches(error -> error instanceof ExhaustedRetriesException exhausted
                        && exhausted.getAttempts() == 2 && "failure 4".equals(exhausted.getMessage()))
                .verify();
        assertEquals(4, calls.get());
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(10)), sleeps);
    }

    @Test
    void execute_shouldNotRetry_whenErrorExcludedByPolicy() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.defaults().notRetrying(AnalysisResponseException.class);

        StepVerifier.create(retryExecutor.execute("op", policy, () -> {
                    calls.incrementAndGet();
                    return Mono.error(new AnalysisResponseException("bad json"));
                }))
                .expectError(AnalysisResponseException.class)
                .verify();

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void execute_shouldUseProviderRetryAfter_whenPresent() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(retryExecutor.execute("op", RetryPolicy.defaults(),
                        () -> Mono.defer(() -> calls.incrementAndGet() == 1
                                ? Mono.<String>error(new ProviderException(HttpStatus.TOO_MANY_REQUESTS, "quota",
                                Duration.ofSeconds(13), null))
                                : Mono.just("ok"))))
                .expectNext("ok")
                .verifyComplete();

        assertEquals(List.of(Duration.ofSeconds(13)), sleeps);
    }

    @Test
    void execute_shouldCallOnce_whenSingleAttemptAllowed() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(retryExecutor.execute("op", RetryPolicy.of(1, Duration.ofSeconds(1)),
                        () -> Mono.error(new IllegalStateException("failure " + calls.incrementAndGet()))))
                .expectError(ExhaustedRetriesException.class)
                .verify();

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void execute_shouldReject_whenMaxAttemptsNotPositive() {
        StepVerifier.create(retryExecutor.execute("op", RetryPolicy.of(0, Duration.ofSeconds(1)), () -> Mono.just(1)))
                .expectError(IllegalArgumentException.class)
                .verify();
    }
}
