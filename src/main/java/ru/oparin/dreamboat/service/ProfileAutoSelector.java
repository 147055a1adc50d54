package ru.oparin.dreamboat.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.config.properties.GenerationProperties;
import ru.oparin.dreamboat.model.entity.GeneratedResult;
import ru.oparin.dreamboat.repository.GeneratedResultRepository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Автоматическое заполнение профиля случайными сгенерированными изображениями.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileAutoSelector {

    private final GeneratedResultRepository generatedResultRepository;
    private final ProfileSelectionService profileSelectionService;
    private final GenerationProperties generationProperties;
    private final Random profileShuffleRandom;

    /**
     * Выбрать до 6 случайных изображений пользователя и назначить им позиции 1..k.
     * Вызывающий проверяет, что у пользователя еще нет выбранных изображений.
     *
     * @return количество выбранных изображений
     */
    public Mono<Integer> autoSelect(Long userId) {
        return generatedResultRepository.findByUserId(userId)
                .map(GeneratedResult::getId)
                .collectList()
                .flatMap(resultIds -> {
                    if (resultIds.isEmpty()) {
                        return Mono.just(0);
                    }
                    List<Long> shuffled = new ArrayList<>(resultIds);
                    Collections.shuffle(shuffled, profileShuffleRandom);
                    List<Long> selected = shuffled.subList(0, Math.min(generationProperties.getMaxProfilePhotos(), shuffled.size()));

                    return profileSelectionService.assignInOrder(userId, selected)
                            .then(Mono.fromSupplier(() -> {
                                log.info("Профиль пользователя {} заполнен автоматически: {} из {} изображений",
                                        userId, selected.size(), resultIds.size());
                                return selected.size();
                            }));
                });
    }
}
