package ru.oparin.dreamboat.service.provider;

import reactor.core.publisher.Mono;

/**
 * Сервис синтеза изображений по исходной фотографии и промпту.
 */
public interface ImageSynthesisProvider {

    /**
     * Сгенерировать изображение и сохранить его в хранилище.
     *
     * @param ownerId       владелец исходной фотографии
     * @param sourceLocator путь к исходной фотографии
     * @param prompt        итоговый промпт
     * @return путь к сохраненному изображению и идентификатор запроса провайдера
     */
    Mono<SynthesisResult> generate(Long ownerId, String sourceLocator, String prompt);

    /**
     * Имя провайдера для логов и ограничения частоты вызовов.
     */
    String getProviderName();
}
