package ru.oparin.dreamboat.service.provider;

import reactor.core.publisher.Mono;

/**
 * Сервис анализа содержимого фотографий.
 */
public interface ContentAnalysisProvider {

    /**
     * Проанализировать изображение по заданным критериям.
     *
     * @param imageBytes     содержимое изображения
     * @param mimeType       MIME тип изображения
     * @param criteriaPrompt критерии анализа
     * @return текстовый ответ сервиса
     */
    Mono<String> analyze(byte[] imageBytes, String mimeType, String criteriaPrompt);

    String getProviderName();
}
