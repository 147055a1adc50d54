package ru.oparin.dreamboat.service.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import ru.oparin.dreamboat.exception.ProviderException;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Обработчик ошибок внешних сервисов.
 * Приводит ошибки WebClient к ProviderException с HTTP статусом и рекомендуемой задержкой повтора.
 */
@Slf4j
@Component
public class ProviderErrorHandler {

    /**
     * "Please retry in 13.52s." в тексте ошибки квоты Gemini.
     */
    private static final Pattern RETRY_IN_PATTERN = Pattern.compile("retry in ([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    /**
     * "retryDelay": "13s" в деталях ошибки Gemini.
     */
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile("\"retryDelay\"\\s*:\\s*\"([0-9]+(?:\\.[0-9]+)?)s\"");

    /**
     * Преобразовать ошибку вызова в ProviderException.
     *
     * @param operation имя операции для логов
     * @param error     исходная ошибка
     * @return ProviderException
     */
    public ProviderException toProviderException(String operation, Throwable error) {
        if (error instanceof ProviderException providerException) {
            return providerException;
        }

        if (isTimeoutError(error)) {
            log.warn("{}: таймаут ответа сервиса", operation);
            return new ProviderException(HttpStatus.GATEWAY_TIMEOUT,
                    ProviderConstants.ErrorMessages.TIMEOUT_MESSAGE, null, error);
        }

        if (error instanceof WebClientRequestException) {
            log.warn("{}: ошибка подключения: {}", operation, error.getMessage());
            return new ProviderException(HttpStatus.SERVICE_UNAVAILABLE,
                    ProviderConstants.ErrorMessages.CONNECTION_ERROR, null, error);
        }

        if (error instanceof WebClientResponseException webError) {
            HttpStatus status = HttpStatus.resolve(webError.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.BAD_GATEWAY;
            }
            String responseBody = webError.getResponseBodyAsString();
            Duration retryAfter = extractRetryAfter(webError.getHeaders().getFirst(HttpHeaders.RETRY_AFTER), responseBody);
            log.warn("{}: сервис вернул ошибку {}, retryAfter={}, тело ответа: {}",
                    operation, status.value(), retryAfter, responseBody);
            String message = String.format(ProviderConstants.ErrorMessages.PROVIDER_ERROR_TEMPLATE,
                    status.value(), status.getReasonPhrase());
            return new ProviderException(status, message, retryAfter, error);
        }

        log.error("{}: неизвестная ошибка сервиса: {}", operation, error.getMessage(), error);
        return new ProviderException(HttpStatus.BAD_GATEWAY,
                String.format(ProviderConstants.ErrorMessages.UNKNOWN_ERROR_TEMPLATE, error.getMessage()), null, error);
    }

    /**
     * Извлечь рекомендуемую задержку из заголовка Retry-After (секунды) или текста ошибки.
     *
     * @return задержка или null, если сервис ее не указал
     */
    Duration extractRetryAfter(String retryAfterHeader, String responseBody) {
        if (retryAfterHeader != null && !retryAfterHeader.isBlank()) {
            try {
                return Duration.ofSeconds(Long.parseLong(retryAfterHeader.trim()));
            } catch (NumberFormatException e) {
                log.debug("Заголовок Retry-After не в секундах: {}", retryAfterHeader);
            }
        }
        if (responseBody == null || responseBody.isEmpty()) {
            return null;
        }
        Matcher matcher = RETRY_DELAY_PATTERN.matcher(responseBody);
        if (!matcher.find()) {
            matcher = RETRY_IN_PATTERN.matcher(responseBody);
            if (!matcher.find()) {
                return null;
            }
        }
        double seconds = Double.parseDouble(matcher.group(1));
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    private boolean isTimeoutError(Throwable error) {
        return error instanceof TimeoutException
                || (error.getCause() != null && error.getCause() instanceof TimeoutException);
    }
}
