package ru.oparin.dreamboat.service.provider;

import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import ru.oparin.dreamboat.config.properties.GeminiProperties;
import ru.oparin.dreamboat.exception.ProviderException;
import ru.oparin.dreamboat.model.dto.gemini.GeminiRequestDTO;
import ru.oparin.dreamboat.model.dto.gemini.GeminiResponseDTO;

import java.time.Duration;

/**
 * HTTP клиент Gemini API. Общий для синтеза и анализа изображений.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiClient {

    private final WebClient.Builder webClientBuilder;
    private final GeminiProperties geminiProperties;
    private final ProviderErrorHandler errorHandler;

    private WebClient webClient;

    /**
     * Отправить запрос generateContent.
     * Ошибки HTTP и сети приводятся к ProviderException.
     *
     * @param model   имя модели
     * @param request тело запроса
     */
    public Mono<GeminiResponseDTO> generateContent(String model, GeminiRequestDTO request) {
        String endpoint = String.format(ProviderConstants.Gemini.ENDPOINT_TEMPLATE, model);
        return getWebClient().post()
                .uri(endpoint)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(GeminiResponseDTO.class)
                .timeout(resolveTimeout())
                .switchIfEmpty(Mono.error(() -> new ProviderException(HttpStatus.BAD_GATEWAY,
                        ProviderConstants.ErrorMessages.EMPTY_RESPONSE)))
                .flatMap(response -> checkBlocked(model, response))
                .onErrorMap(error -> errorHandler.toProviderException("Gemini " + model, error));
    }

    private Mono<GeminiResponseDTO> checkBlocked(String model, GeminiResponseDTO response) {
        if (response.getPromptFeedback() != null && response.getPromptFeedback().getBlockReason() != null) {
            String blockReason = response.getPromptFeedback().getBlockReason();
            log.warn("Gemini {} отклонил запрос: {}", model, blockReason);
            return Mono.error(new ProviderException(HttpStatus.UNPROCESSABLE_ENTITY,
                    String.format(ProviderConstants.ErrorMessages.PROMPT_BLOCKED_TEMPLATE, blockReason)));
        }
        return Mono.just(response);
    }

    private Duration resolveTimeout() {
        Duration timeout = geminiProperties.getTimeout();
        return timeout != null ? timeout : ProviderConstants.DEFAULT_TIMEOUT;
    }

    private WebClient getWebClient() {
        if (webClient == null) {
            String baseUrl = geminiProperties.getApi().getUrl();
            String apiKey = geminiProperties.getApi().getKey();

            if (apiKey == null || apiKey.isEmpty()) {
                log.warn("Gemini API ключ не настроен");
            }

            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(resolveTimeout())
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, ProviderConstants.Gemini.CONNECT_TIMEOUT_MS);

            webClient = webClientBuilder
                    .baseUrl(baseUrl)
                    .clientConnector(new ReactorClientHttpConnector(httpClient))
                    .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
                    .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .defaultHeader(ProviderConstants.Gemini.API_KEY_HEADER, apiKey != null ? apiKey : "")
                    .build();
        }
        return webClient;
    }
}
