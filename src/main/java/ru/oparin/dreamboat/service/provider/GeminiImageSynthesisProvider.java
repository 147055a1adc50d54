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
import ru.oparin.dreamboat.service.storage.ImageStorage;
import ru.oparin.dreamboat.util.ImageFormatUtils;

import java.util.Base64;
import java.util.List;

/**
 * Синтез изображений через Gemini API.
 * Исходная фотография передается в запросе как встроенные данные, результат сохраняется в ImageStorage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiImageSynthesisProvider implements ImageSynthesisProvider {

    private final GeminiClient geminiClient;
    private final GeminiProperties geminiProperties;
    private final ImageStorage imageStorage;

    @Override
    public Mono<SynthesisResult> generate(Long ownerId, String sourceLocator, String prompt) {
        log.debug("Синтез изображения для пользователя {} по фотографии {}", ownerId, sourceLocator);

        return imageStorage.read(sourceLocator)
                .map(sourceBytes -> createRequest(sourceBytes, ImageFormatUtils.mimeTypeOf(sourceLocator), prompt))
                .flatMap(request -> geminiClient.generateContent(geminiProperties.getImageModel(), request))
                .flatMap(response -> extractImage(response)
                        .flatMap(inlineData -> imageStorage.store(
                                Base64.getDecoder().decode(inlineData.getData()),
                                ownerId,
                                ProviderConstants.Gemini.IMAGE_SUBDIRECTORY,
                                ImageFormatUtils.extensionOf(inlineData.getMimeType())))
                        .map(locator -> new SynthesisResult(locator, response.getResponseId())))
                .doOnNext(result -> log.info("Изображение для пользователя {} сгенерировано: {}",
                        ownerId, result.storageLocator()));
    }

    private GeminiRequestDTO createRequest(byte[] sourceBytes, String mimeType, String prompt) {
        GeminiRequestDTO.Part textPart = GeminiRequestDTO.Part.builder()
                .text(prompt)
                .build();
        GeminiRequestDTO.Part imagePart = GeminiRequestDTO.Part.builder()
                .inlineData(new GeminiRequestDTO.InlineData(mimeType, Base64.getEncoder().encodeToString(sourceBytes)))
                .build();

        return GeminiRequestDTO.builder()
                .contents(List.of(GeminiRequestDTO.Content.builder()
                        .role(ProviderConstants.Gemini.ROLE_USER)
                        .parts(List.of(textPart, imagePart))
                        .build()))
                .generationConfig(GeminiRequestDTO.GenerationConfig.builder()
                        .responseModalities(List.of(ProviderConstants.Gemini.MODALITY_TEXT,
                                ProviderConstants.Gemini.MODALITY_IMAGE))
                        .build())
                .build();
    }

    private Mono<GeminiResponseDTO.InlineData> extractImage(GeminiResponseDTO response) {
        if (response.getCandidates() == null || response.getCandidates().isEmpty()) {
            return Mono.error(new ProviderException(HttpStatus.UNPROCESSABLE_ENTITY,
                    ProviderConstants.ErrorMessages.EMPTY_RESPONSE));
        }

        for (GeminiResponseDTO.Candidate candidate : response.getCandidates()) {
            if (candidate.getContent() == null || candidate.getContent().getParts() == null) {
                continue;
            }
            for (GeminiResponseDTO.Part part : candidate.getContent().getParts()) {
                if (part.getInlineData() != null && part.getInlineData().getData() != null) {
                    return Mono.just(part.getInlineData());
                }
            }
        }

        log.warn("В ответе Gemini нет изображения, finishReason={}", response.getCandidates().get(0).getFinishReason());
        return Mono.error(new ProviderException(HttpStatus.UNPROCESSABLE_ENTITY,
                ProviderConstants.ErrorMessages.NO_IMAGES_IN_RESPONSE));
    }

    @Override
    public String getProviderName() {
        return ProviderConstants.Dependencies.IMAGE_SYNTHESIS;
    }
}
