package ru.oparin.dreamboat.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.config.properties.GenerationProperties;
import ru.oparin.dreamboat.exception.InvalidSelectionException;
import ru.oparin.dreamboat.exception.ResultNotFoundException;
import ru.oparin.dreamboat.model.dto.profile.ProfileSlotDTO;
import ru.oparin.dreamboat.model.entity.GeneratedResult;
import ru.oparin.dreamboat.repository.GeneratedResultRepository;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Выбор изображений для профиля.
 * Позиции 1..6 уникальны в пределах пользователя: перед назначением позиции
 * она снимается с изображения, которое ее занимало.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileSelectionService {

    private final GeneratedResultRepository generatedResultRepository;
    private final TransactionalOperator transactionalOperator;
    private final GenerationProperties generationProperties;

    /**
     * Изображения профиля в порядке позиций.
     */
    public Flux<GeneratedResult> getSelection(Long userId) {
        return generatedResultRepository.findSelected(userId);
    }

    public Mono<Boolean> hasSelection(Long userId) {
        return generatedResultRepository.countSelected(userId)
                .map(count -> count > 0)
                .defaultIfEmpty(false);
    }

    /**
     * Все сгенерированные изображения пользователя.
     */
    public Flux<GeneratedResult> getResults(Long userId) {
        return generatedResultRepository.findByUserId(userId);
    }

    /**
     * Заменить выбор целиком: снять все позиции и назначить новые в одной транзакции.
     *
     * @throws InvalidSelectionException при повторяющихся позициях или изображениях
     * @throws ResultNotFoundException   если изображение не принадлежит пользователю
     */
    public Mono<List<GeneratedResult>> replaceSelection(Long userId, List<ProfileSlotDTO> selections) {
        try {
            validateSelections(selections);
        } catch (InvalidSelectionException e) {
            return Mono.error(e);
        }

        Mono<Void> replace = generatedResultRepository.clearProfileOrders(userId)
                .thenMany(Flux.fromIterable(selections)
                        .concatMap(slot -> assign(userId, slot.getResultId(), slot.getOrder())))
                .then();

        return transactionalOperator.transactional(replace)
                .doOnSuccess(ignored -> log.info("Пользователь {} выбрал {} изображений для профиля", userId, selections.size()))
                .then(getSelection(userId).collectList());
    }

    /**
     * Назначить позиции 1..N переданным изображениям, предварительно сняв все текущие позиции.
     */
    public Mono<Void> assignInOrder(Long userId, List<Long> resultIds) {
        if (resultIds.size() > generationProperties.getMaxProfilePhotos()) {
            return Mono.error(new InvalidSelectionException(
                    "В профиле может быть не больше " + generationProperties.getMaxProfilePhotos() + " изображений"));
        }
        Mono<Void> replace = generatedResultRepository.clearProfileOrders(userId)
                .thenMany(Flux.range(0, resultIds.size())
                        .concatMap(index -> assign(userId, resultIds.get(index), index + 1)))
                .then();
        return transactionalOperator.transactional(replace);
    }

    /**
     * Установить или снять позицию одного изображения.
     *
     * @param order позиция 1..6 или null, чтобы убрать изображение из профиля
     */
    public Mono<GeneratedResult> toggle(Long userId, Long resultId, Integer order) {
        if (order != null && (order < 1 || order > generationProperties.getMaxProfilePhotos())) {
            return Mono.error(new InvalidSelectionException("Позиция должна быть от 1 до " + generationProperties.getMaxProfilePhotos()));
        }

        Mono<Integer> update = order == null
                ? generatedResultRepository.clearProfileOrder(resultId, userId)
                : generatedResultRepository.clearProfileSlot(userId, order)
                        .then(generatedResultRepository.assignProfileOrder(resultId, userId, order));

        return generatedResultRepository.findByIdAndUserId(resultId, userId)
                .switchIfEmpty(Mono.error(() -> new ResultNotFoundException(resultId)))
                .flatMap(result -> transactionalOperator.transactional(update))
                .then(generatedResultRepository.findByIdAndUserId(resultId, userId))
                .doOnNext(result -> log.info("Позиция изображения {} пользователя {} в профиле: {}", resultId, userId, order));
    }

    private Mono<Integer> assign(Long userId, Long resultId, Integer order) {
        return generatedResultRepository.assignProfileOrder(resultId, userId, order)
                .flatMap(updated -> updated == 0
                        ? Mono.error(new ResultNotFoundException(resultId))
                        : Mono.just(updated));
    }

    private void validateSelections(List<ProfileSlotDTO> selections) {
        int maxPhotos = generationProperties.getMaxProfilePhotos();
        if (selections.size() > maxPhotos) {
            throw new InvalidSelectionException("В профиле может быть не больше " + maxPhotos + " изображений");
        }
        Set<Integer> orders = new HashSet<>();
        Set<Long> resultIds = new HashSet<>();
        for (ProfileSlotDTO slot : selections) {
            if (slot.getOrder() == null || slot.getOrder() < 1 || slot.getOrder() > maxPhotos) {
                throw new InvalidSelectionException("Позиция должна быть от 1 до " + maxPhotos);
            }
            if (!orders.add(slot.getOrder())) {
                throw new InvalidSelectionException("Позиция " + slot.getOrder() + " указана несколько раз");
            }
            if (!resultIds.add(slot.getResultId())) {
                throw new InvalidSelectionException("Изображение " + slot.getResultId() + " указано несколько раз");
            }
        }
    }
}
