package ru.oparin.dreamboat.service.validation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.config.properties.ValidationProperties;
import ru.oparin.dreamboat.exception.AnalysisResponseException;
import ru.oparin.dreamboat.exception.PhotoNotFoundException;
import ru.oparin.dreamboat.model.dto.photo.SourcePhotoDTO;
import ru.oparin.dreamboat.model.dto.photo.ValidationResultDTO;
import ru.oparin.dreamboat.model.entity.SourcePhoto;
import ru.oparin.dreamboat.model.enums.ValidationStatus;
import ru.oparin.dreamboat.model.enums.ValidationWarning;
import ru.oparin.dreamboat.repository.SourcePhotoRepository;
import ru.oparin.dreamboat.service.provider.ContentAnalysisProvider;
import ru.oparin.dreamboat.service.resilience.RateLimiter;
import ru.oparin.dreamboat.service.resilience.RetryExecutor;
import ru.oparin.dreamboat.service.resilience.RetryPolicy;
import ru.oparin.dreamboat.service.storage.ImageStorage;
import ru.oparin.dreamboat.util.ImageFormatUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Проверка исходных фотографий на пригодность для профиля знакомств.
 * Вызовы сервиса анализа разнесены во времени (RateLimiter) и повторяются при ошибках (RetryExecutor).
 * Фотография, уже прошедшая проверку или пропущенная пользователем, повторно не анализируется.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PhotoValidator {

    static final String CRITERIA_PROMPT = """
            Analyze this photo for dating profile suitability. Evaluate the following criteria:

            1. MULTIPLE_PEOPLE: Is there more than one person clearly visible in this photo? (Look for multiple distinct faces or bodies)
            2. FACE_VISIBILITY: Is the main subject's face completely covered, obscured, or significantly blurred? (Sunglasses are OK, but masks, heavy blur, or turned away are not)
            3. LIGHTING: Is the lighting so dark that the main subject's face is not clearly visible?
            4. SCREENSHOT: Is this a screenshot of another photo, social media post, or screen capture? (Look for UI elements, status bars, app interfaces, photo-of-a-screen artifacts, watermarks from other apps, or visible device bezels)
            5. FACE_PARTIALLY_COVERED: Are key facial features (eyes, nose, mouth, chin, or most of the hair/forehead) partially covered or hidden? (e.g., hand covering mouth, hair covering eyes, cropped forehead, chin cut off, face cut off at edges - sunglasses alone are OK)

            Respond with ONLY a valid JSON object in this exact format, no additional text:
            {"multiple_people": true or false, "face_covered_or_blurred": true or false, "poor_lighting": true or false, "is_screenshot": true or false, "face_partially_covered": true or false}""";

    private final SourcePhotoRepository sourcePhotoRepository;
    private final ImageStorage imageStorage;
    private final ContentAnalysisProvider contentAnalysisProvider;
    private final AnalysisResponseParser analysisResponseParser;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final ValidationProperties validationProperties;
    private final Clock clock;

    /**
     * Проверить фотографию пользователя.
     */
    public Mono<ValidationResultDTO> validate(Long userId, Long photoId) {
        return sourcePhotoRepository.findByIdAndUserId(photoId, userId)
                .switchIfEmpty(Mono.error(() -> new PhotoNotFoundException(photoId)))
                .flatMap(this::validate);
    }

    /**
     * Проверить фотографию.
     * Ошибка анализа не пробрасывается: фотография получает статус FAILED без замечаний.
     */
    public Mono<ValidationResultDTO> validate(SourcePhoto photo) {
        if (ValidationStatus.isTerminal(photo.getValidationStatus())) {
            log.debug("Фотография {} уже проверена ({}), анализ пропущен", photo.getId(), photo.getValidationStatus());
            return Mono.just(toResult(photo, true, true));
        }

        log.info("Проверка фотографии {} ({})", photo.getId(), photo.getStorageLocator());
        return analyze(photo)
                .map(Optional::of)
                .onErrorResume(error -> {
                    log.error("Ошибка проверки фотографии {}: {}", photo.getId(), error.getMessage());
                    return Mono.just(Optional.<Set<ValidationWarning>>empty());
                })
                .flatMap(analysis -> {
                    if (analysis.isEmpty()) {
                        return saveStatus(photo, ValidationStatus.FAILED, EnumSet.noneOf(ValidationWarning.class))
                                .map(saved -> toResult(saved, false, false));
                    }
                    Set<ValidationWarning> warnings = analysis.get();
                    ValidationStatus status = warnings.isEmpty() ? ValidationStatus.VALIDATED : ValidationStatus.FAILED;
                    log.info("Фотография {} проверена: статус {}, замечания {}", photo.getId(), status, warnings);
                    return saveStatus(photo, status, warnings)
                            .map(saved -> toResult(saved, warnings.isEmpty(), false));
                });
    }

    /**
     * Проверить фотографии последовательно, чтобы не превышать ограничение частоты запросов.
     */
    public Mono<List<ValidationResultDTO>> validateBatch(Long userId, List<Long> photoIds) {
        log.info("Пакетная проверка {} фотографий пользователя {}", photoIds.size(), userId);
        return Flux.fromIterable(photoIds)
                .concatMap(photoId -> validate(userId, photoId))
                .collectList()
                .doOnNext(results -> log.info("Пакетная проверка завершена: {} из {} фотографий пригодны",
                        results.stream().filter(ValidationResultDTO::getIsValid).count(), results.size()));
    }

    /**
     * Разрешить использование фотографии без проверки.
     */
    public Mono<SourcePhotoDTO> bypass(Long userId, Long photoId) {
        return sourcePhotoRepository.findByIdAndUserId(photoId, userId)
                .switchIfEmpty(Mono.error(() -> new PhotoNotFoundException(photoId)))
                .flatMap(photo -> {
                    log.info("Пользователь {} пропустил проверку фотографии {}", userId, photoId);
                    return saveStatus(photo, ValidationStatus.BYPASSED, photo.getWarnings());
                })
                .map(SourcePhotoDTO::fromEntity);
    }

    private Mono<Set<ValidationWarning>> analyze(SourcePhoto photo) {
        RetryPolicy policy = RetryPolicy.of(validationProperties.getMaxAttempts(), validationProperties.getBaseDelay())
                .notRetrying(AnalysisResponseException.class);
        String mimeType = photo.getContentType() != null
                ? photo.getContentType()
                : ImageFormatUtils.mimeTypeOf(photo.getStorageLocator());

        return retryExecutor.execute("validation[photo=" + photo.getId() + "]", policy,
                () -> imageStorage.read(photo.getStorageLocator())
                        .flatMap(imageBytes -> rateLimiter.throttle(contentAnalysisProvider.getProviderName(),
                                validationProperties.getMinRequestInterval(),
                                () -> contentAnalysisProvider.analyze(imageBytes, mimeType, CRITERIA_PROMPT)))
                        .map(analysisResponseParser::parse));
    }

    private Mono<SourcePhoto> saveStatus(SourcePhoto photo, ValidationStatus status, Set<ValidationWarning> warnings) {
        LocalDateTime now = LocalDateTime.now(clock);
        photo.setValidationStatus(status);
        photo.setWarnings(warnings);
        photo.setValidatedAt(now);
        photo.setUpdatedAt(now);
        return sourcePhotoRepository.save(photo);
    }

    private ValidationResultDTO toResult(SourcePhoto photo, boolean valid, boolean cached) {
        boolean isValid = cached ? ValidationStatus.isTerminal(photo.getValidationStatus()) : valid;
        return ValidationResultDTO.builder()
                .photoId(photo.getId())
                .isValid(isValid)
                .status(photo.getValidationStatus())
                .warnings(photo.getWarnings())
                .cached(cached)
                .build();
    }
}
