package ru.oparin.dreamboat.service.provider;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import ru.oparin.dreamboat.exception.ProviderException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ProviderErrorHandlerTest {

    private final ProviderErrorHandler handler = new ProviderErrorHandler();

    @Test
    void extractRetryAfter_shouldPreferHeaderSeconds() {
        assertEquals(Duration.ofSeconds(30), handler.extractRetryAfter("30", "{\"retryDelay\": \"5s\"}"));
    }

    @Test
    void extractRetryAfter_shouldReadRetryDelayFromBody() {
        String body = "{\"error\": {\"code\": 429, \"details\": [{\"retryDelay\": \"13s\"}]}}";

        assertEquals(Duration.ofSeconds(13), handler.extractRetryAfter(null, body));
    }

    @Test
    void extractRetryAfter_shouldReadRetryInFromMessage() {
        assertEquals(Duration.ofMillis(13520),
                handler.extractRetryAfter("Wed, 21 Oct 2026 07:28:00 GMT", "Quota exceeded. Please retry in 13.52s."));
    }

    @Test
    void extractRetryAfter_shouldReturnNull_whenNotSpecified() {
        assertNull(handler.extractRetryAfter(null, "Internal error"));
        assertNull(handler.extractRetryAfter(null, null));
    }

    @Test
    void toProviderException_shouldKeepStatusAndRetryAfter_whenResponseError() {
        // Given
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.RETRY_AFTER, "7");
        WebClientResponseException error = WebClientResponseException.create(429, "Too Many Requests", headers,
                "{}".getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);

        // When
        ProviderException result = handler.toProviderException("synthesis", error);

        // Then
        assertEquals(HttpStatus.TOO_MANY_REQUESTS, result.getStatus());
        assertEquals(Duration.ofSeconds(7), result.getRetryAfter().orElseThrow());
        assertSame(error, result.getCause());
    }

    @Test
    void toProviderException_shouldMapTimeoutToGatewayTimeout() {
        ProviderException result = handler.toProviderException("analysis", new TimeoutException("read timed out"));

        assertEquals(HttpStatus.GATEWAY_TIMEOUT, result.getStatus());
        assertTrue(result.getRetryAfter().isEmpty());
    }

    @Test
    void toProviderException_shouldReturnSameInstance_whenAlreadyProviderException() {
        ProviderException original = new ProviderException(HttpStatus.BAD_GATEWAY, "no image");

        assertSame(original, handler.toProviderException("synthesis", original));
    }
}
