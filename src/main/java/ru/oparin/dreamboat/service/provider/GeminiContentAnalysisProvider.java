package ru.oparin.dreamboat.service.provider;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.config.properties.GeminiProperties;
import ru.oparin.dreamboat.exception.ProviderException;
import ru.oparin.dreamboat.model.dto.gemini.GeminiRequestDTO;
import ru.oparin.dreamboat.model.dto.gemini.GeminiResponseDTO;

import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Анализ фотографий через Gemini API. Ответ запрашивается в формате JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiContentAnalysisProvider implements ContentAnalysisProvider {

    private final GeminiClient geminiClient;
    private final GeminiProperties geminiProperties;

    @Override
    public Mono<String> analyze(byte[] imageBytes, String mimeType, String criteriaPrompt) {
        GeminiRequestDTO request = GeminiRequestDTO.builder()
                .contents(List.of(GeminiRequestDTO.Content.builder()
                        .role(ProviderConstants.Gemini.ROLE_USER)
                        .parts(List.of(
                                GeminiRequestDTO.Part.builder()
                                        .inlineData(new GeminiRequestDTO.InlineData(mimeType,
                                                Base64.getEncoder().encodeToString(imageBytes)))
                                        .build(),
                                GeminiRequestDTO.Part.builder()
                                        .text(criteriaPrompt)
                                        .build()))
                        .build()))
                .generationConfig(GeminiRequestDTO.GenerationConfig.builder()
                        .responseMimeType(ProviderConstants.Gemini.JSON_MIME_TYPE)
                        .build())
                .build();

        return geminiClient.generateContent(geminiProperties.getAnalysisModel(), request)
                .flatMap(this::extractText);
    }

    private Mono<String> extractText(GeminiResponseDTO response) {
        if (response.getCandidates() == null || response.getCandidates().isEmpty()) {
            return Mono.error(new ProviderException(HttpStatus.UNPROCESSABLE_ENTITY,
                    ProviderConstants.ErrorMessages.EMPTY_RESPONSE));
        }
        GeminiResponseDTO.Content content = response.getCandidates().get(0).getContent();
        if (content == null || content.getParts() == null) {
            return Mono.error(new ProviderException(HttpStatus.UNPROCESSABLE_ENTITY,
                    ProviderConstants.ErrorMessages.EMPTY_RESPONSE));
        }
        String text = content.getParts().stream()
                .map(GeminiResponseDTO.Part::getText)
                .filter(Objects::nonNull)
                .collect(Collectors.joining());
        if (text.isBlank()) {
            return Mono.error(new ProviderException(HttpStatus.UNPROCESSABLE_ENTITY,
                    ProviderConstants.ErrorMessages.EMPTY_RESPONSE));
        }
        return Mono.just(text);
    }

    @Override
    public String getProviderName() {
        return ProviderConstants.Dependencies.CONTENT_ANALYSIS;
    }
}
