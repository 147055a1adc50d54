package ru.oparin.dreamboat.service.resilience;

import org.junit.jupiter.api.Test;
import ru.oparin.dreamboat.exception.AnalysisResponseException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaults_shouldUseThreeAttemptsAndOneSecond() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(3, policy.getMaxAttempts());
        assertEquals(Duration.ofSeconds(1), policy.getBaseDelay());
        assertTrue(policy.isRetryable(new IllegalStateException()));
    }

    @Test
    void backoffAfter_shouldDoubleDelay() {
        RetryPolicy policy = RetryPolicy.of(4, Duration.ofMillis(250));

        assertEquals(Duration.ofMillis(250), policy.backoffAfter(1));
        assertEquals(Duration.ofMillis(500), policy.backoffAfter(2));
        assertEquals(Duration.ofMillis(1000), policy.backoffAfter(3));
    }

    @Test
    void notRetrying_shouldExcludeOnlyGivenType() {
        RetryPolicy policy = RetryPolicy.defaults().notRetrying(AnalysisResponseException.class);

        assertFalse(policy.isRetryable(new AnalysisResponseException("bad")));
        assertTrue(policy.isRetryable(new IllegalStateException("timeout")));
    }
}
