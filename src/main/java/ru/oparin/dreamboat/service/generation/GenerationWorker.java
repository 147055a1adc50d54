package ru.oparin.dreamboat.service.generation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.config.properties.GenerationProperties;
import ru.oparin.dreamboat.exception.TaskException;
import ru.oparin.dreamboat.model.entity.GeneratedResult;
import ru.oparin.dreamboat.model.entity.SourcePhoto;
import ru.oparin.dreamboat.repository.GeneratedResultRepository;
import ru.oparin.dreamboat.service.provider.ImageSynthesisProvider;
import ru.oparin.dreamboat.service.resilience.RetryExecutor;
import ru.oparin.dreamboat.service.resilience.RetryPolicy;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Выполнение одной задачи генерации: промпт, синтез с повторами, сохранение результата.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationWorker {

    private final ImageSynthesisProvider imageSynthesisProvider;
    private final RetryExecutor retryExecutor;
    private final ScenarioPromptResolver scenarioPromptResolver;
    private final GeneratedResultRepository generatedResultRepository;
    private final GenerationProperties generationProperties;
    private final Clock clock;

    /**
     * Выполнить задачу задания.
     * Любая ошибка возвращается как TaskException.
     *
     * @param userId        владелец задания
     * @param jobId         задание
     * @param task          задача
     * @param customPrompts пользовательские промпты по сценариям (может быть null)
     */
    public Mono<GeneratedResult> execute(Long userId, Long jobId, GenerationTask task, Map<String, String> customPrompts) {
        String customPrompt = customPrompts != null ? customPrompts.get(task.scenario()) : null;
        String prompt = scenarioPromptResolver.resolve(task.scenario(), customPrompt);

        return synthesizeAndSave(userId, jobId, task.photo(), task.scenario(), prompt, false)
                .doOnNext(result -> log.info("Задача #{} задания {} выполнена: фото {}, сценарий {}, результат {}",
                        task.position(), jobId, task.photo().getId(), task.scenario(), result.getId()))
                .onErrorMap(error -> !(error instanceof TaskException),
                        error -> new TaskException(task.position(), task.photo().getId(), task.scenario(), error))
                .doOnError(error -> log.warn(error.getMessage()));
    }

    /**
     * Сгенерировать пробное изображение без задания и оплаты.
     */
    public Mono<GeneratedResult> executeSample(Long userId, SourcePhoto photo, String scenario) {
        String prompt = scenarioPromptResolver.resolve(scenario, null);
        return synthesizeAndSave(userId, null, photo, scenario, prompt, true)
                .doOnNext(result -> log.info("Пробное изображение {} для пользователя {} сгенерировано", result.getId(), userId));
    }

    private Mono<GeneratedResult> synthesizeAndSave(Long userId, Long jobId, SourcePhoto photo, String scenario,
                                                    String prompt, boolean sample) {
        String operationName = "synthesis[photo=" + photo.getId() + ", scenario=" + scenario + "]";

        return retryExecutor.execute(operationName, retryPolicy(),
                        () -> imageSynthesisProvider.generate(userId, photo.getStorageLocator(), prompt))
                .flatMap(synthesis -> generatedResultRepository.save(GeneratedResult.builder()
                        .userId(userId)
                        .generationJobId(jobId)
                        .sourcePhotoId(photo.getId())
                        .scenario(scenario)
                        .prompt(prompt)
                        .storageLocator(synthesis.storageLocator())
                        .providerRequestId(synthesis.providerRequestId())
                        .isSample(sample)
                        .createdAt(LocalDateTime.now(clock))
                        .build()));
    }

    private RetryPolicy retryPolicy() {
        GenerationProperties.Retry retry = generationProperties.getRetry();
        return RetryPolicy.of(retry.getMaxAttempts(), retry.getBaseDelay());
    }
}
