package ru.oparin.dreamboat.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.config.properties.GenerationProperties;
import ru.oparin.dreamboat.model.entity.GeneratedResult;
import ru.oparin.dreamboat.model.entity.SourcePhoto;
import ru.oparin.dreamboat.repository.GeneratedResultRepository;
import ru.oparin.dreamboat.repository.SampleRequestRepository;
import ru.oparin.dreamboat.service.generation.GenerationWorker;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Бесплатная пробная генерация: одно изображение на пользователя, без оплаты и задания.
 * Запрос регистрируется до запуска генерации, поэтому параллельные запросы одного
 * пользователя запускают не больше одной генерации.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SampleGenerationService {

    private final SourcePhotoService sourcePhotoService;
    private final GeneratedResultRepository generatedResultRepository;
    private final SampleRequestRepository sampleRequestRepository;
    private final GenerationWorker generationWorker;
    private final DetachedTaskRunner detachedTaskRunner;
    private final GenerationProperties generationProperties;
    private final Clock clock;

    /**
     * Запросить пробное изображение. Генерация выполняется в фоне.
     *
     * @return true, если генерация запущена; false, если у пользователя уже есть пробное изображение
     * или оно уже запрошено
     */
    public Mono<Boolean> requestSample(Long userId, Long photoId) {
        return sourcePhotoService.getEligiblePhotos(userId, List.of(photoId))
                .map(photos -> photos.get(0))
                .flatMap(photo -> generatedResultRepository.countSamples(userId)
                        .defaultIfEmpty(0L)
                        .flatMap(samples -> {
                            if (samples > 0) {
                                log.info("У пользователя {} уже есть пробное изображение", userId);
                                return Mono.just(false);
                            }
                            return register(userId, photo);
                        }));
    }

    private Mono<Boolean> register(Long userId, SourcePhoto photo) {
        return sampleRequestRepository.register(userId, photo.getId(), LocalDateTime.now(clock))
                .map(inserted -> {
                    String scenario = generationProperties.getSampleScenario();
                    detachedTaskRunner.submit("sample[user=" + userId + ", photo=" + photo.getId() + "]",
                            releaseOnFailure(userId, generationWorker.executeSample(userId, photo, scenario)));
                    return true;
                })
                .onErrorResume(DataIntegrityViolationException.class, e -> {
                    log.info("Пробное изображение для пользователя {} уже запрошено", userId);
                    return Mono.just(false);
                });
    }

    /**
     * При ошибке генерации снять регистрацию запроса, чтобы пользователь мог запросить пробное изображение снова.
     */
    private Mono<GeneratedResult> releaseOnFailure(Long userId, Mono<GeneratedResult> sample) {
        return sample.onErrorResume(error -> sampleRequestRepository.deleteById(userId)
                .doOnSuccess(ignored -> log.info("Запрос пробного изображения пользователя {} снят после ошибки", userId))
                .then(Mono.<GeneratedResult>error(error)));
    }
}
