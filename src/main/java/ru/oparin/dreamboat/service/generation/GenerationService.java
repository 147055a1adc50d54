package ru.oparin.dreamboat.service.generation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.model.dto.generation.GenerationRequestDTO;
import ru.oparin.dreamboat.model.dto.generation.GenerationStatusDTO;
import ru.oparin.dreamboat.model.dto.generation.GenerationSummaryDTO;
import ru.oparin.dreamboat.model.dto.generation.TaskOutcomeDTO;
import ru.oparin.dreamboat.model.entity.GeneratedResult;
import ru.oparin.dreamboat.model.entity.GenerationJob;
import ru.oparin.dreamboat.model.enums.GenerationStatus;
import ru.oparin.dreamboat.repository.GenerationJobRepository;
import ru.oparin.dreamboat.service.PaymentGate;
import ru.oparin.dreamboat.service.ProfileAutoSelector;
import ru.oparin.dreamboat.service.ProfileSelectionService;
import ru.oparin.dreamboat.service.SourcePhotoService;

import java.util.List;
import java.util.Map;

/**
 * Оркестрация задания генерации.
 * <p>
 * Порядок выполнения:
 * <ol>
 *   <li>проверка фотографий (принадлежат пользователю, прошли проверку или пропущены)</li>
 *   <li>разворачивание в задачи (фото x сценарии)</li>
 *   <li>резервирование оплаты</li>
 *   <li>создание задания в статусе IN_PROGRESS</li>
 *   <li>выполнение задач пакетами с отметкой выполнения после каждого пакета</li>
 *   <li>финализация задания</li>
 *   <li>автоматическое заполнение профиля, если у пользователя нет выбранных изображений</li>
 * </ol>
 * Ошибки отдельных задач не прерывают задание: оно завершается со статусом FAILED,
 * а оплата остается использованной.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationService {

    private final SourcePhotoService sourcePhotoService;
    private final TaskFanout taskFanout;
    private final PaymentGate paymentGate;
    private final GenerationTracker generationTracker;
    private final BatchScheduler batchScheduler;
    private final GenerationWorker generationWorker;
    private final ProfileSelectionService profileSelectionService;
    private final ProfileAutoSelector profileAutoSelector;
    private final GenerationJobRepository generationJobRepository;

    public Mono<GenerationSummaryDTO> generate(Long userId, GenerationRequestDTO request) {
        List<String> scenarios = request.getScenarios();
        Map<String, String> customPrompts = request.getCustomPrompts();

        return sourcePhotoService.getEligiblePhotos(userId, request.getPhotoIds())
                .map(photos -> taskFanout.expand(photos, scenarios))
                .flatMap(tasks -> {
                    log.info("Запуск генерации для пользователя {}: {} задач ({} сценариев)",
                            userId, tasks.size(), scenarios.size());
                    return paymentGate.reserve(userId, request.getPaymentReference())
                            .flatMap(credit -> generationTracker.open(userId, credit.getId(), tasks.size(), scenarios))
                            .flatMap(job -> batchScheduler.<GenerationTask, GeneratedResult>run(tasks,
                                            task -> generationWorker.execute(userId, job.getId(), task, customPrompts),
                                            outcomes -> heartbeat(job))
                                    .flatMap(outcomes -> finish(userId, job, outcomes)));
                });
    }

    /**
     * Состояние генерации пользователя: активное задание или последнее завершенное.
     */
    public Mono<GenerationStatusDTO> getStatus(Long userId) {
        return generationTracker.findActive(userId)
                .switchIfEmpty(generationJobRepository.findByUserIdOrderByCreatedAtDesc(userId).next())
                .map(job -> GenerationStatusDTO.builder()
                        .active(job.getStatus() == GenerationStatus.IN_PROGRESS)
                        .jobId(job.getId())
                        .status(job.getStatus())
                        .totalTasks(job.getTotalTasks())
                        .completedTasks(job.getCompletedTasks())
                        .scenarios(job.getScenarios())
                        .createdAt(job.getCreatedAt())
                        .completedAt(job.getCompletedAt())
                        .build())
                .defaultIfEmpty(GenerationStatusDTO.builder().active(false).build());
    }

    private Mono<GenerationSummaryDTO> finish(Long userId, GenerationJob job,
                                              List<TaskOutcome<GenerationTask, GeneratedResult>> outcomes) {
        int successful = (int) outcomes.stream().filter(TaskOutcome::isSuccess).count();
        int total = outcomes.size();

        return generationTracker.close(job.getId(), successful, total)
                .onErrorResume(IllegalStateException.class, e -> finalizedStatus(job))
                .flatMap(status -> autoSelectIfNeeded(userId, successful)
                        .map(autoSelected -> GenerationSummaryDTO.builder()
                                .jobId(job.getId())
                                .status(status)
                                .processed(total)
                                .successful(successful)
                                .failed(total - successful)
                                .profileAutoSelected(autoSelected)
                                .results(outcomes.stream().map(this::toOutcomeDTO).toList())
                                .build()));
    }

    private Mono<Void> heartbeat(GenerationJob job) {
        return generationTracker.heartbeat(job.getId())
                .onErrorResume(error -> {
                    log.warn("Не удалось отметить выполнение задания {}: {}", job.getId(), error.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Статус задания, уже финализированного планировщиком обслуживания.
     * Сохраненный статус не перезаписывается.
     */
    private Mono<GenerationStatus> finalizedStatus(GenerationJob job) {
        return generationJobRepository.findById(job.getId())
                .map(stored -> {
                    log.warn("Задание {} финализировано до завершения запроса со статусом {}, выполнено {} из {}",
                            job.getId(), stored.getStatus(), stored.getCompletedTasks(), stored.getTotalTasks());
                    return stored.getStatus();
                })
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Задание " + job.getId() + " не найдено")));
    }

    private Mono<Boolean> autoSelectIfNeeded(Long userId, int successful) {
        if (successful == 0) {
            return Mono.just(false);
        }
        return profileSelectionService.hasSelection(userId)
                .flatMap(hasSelection -> hasSelection
                        ? Mono.just(false)
                        : profileAutoSelector.autoSelect(userId).map(selected -> selected > 0))
                .onErrorResume(error -> {
                    log.warn("Не удалось автоматически заполнить профиль пользователя {}: {}", userId, error.getMessage());
                    return Mono.just(false);
                });
    }

    private TaskOutcomeDTO toOutcomeDTO(TaskOutcome<GenerationTask, GeneratedResult> outcome) {
        GenerationTask task = outcome.task();
        TaskOutcomeDTO.TaskOutcomeDTOBuilder builder = TaskOutcomeDTO.builder()
                .position(task.position())
                .photoId(task.photo().getId())
                .scenario(task.scenario())
                .success(outcome.isSuccess());
        if (outcome.isSuccess()) {
            builder.resultId(outcome.value().getId())
                    .storageLocator(outcome.value().getStorageLocator());
        } else {
            builder.error(outcome.error().getMessage());
        }
        return builder.build();
    }
}
