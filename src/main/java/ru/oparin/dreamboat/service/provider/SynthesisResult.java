package ru.oparin.dreamboat.service.provider;

/**
 * Результат синтеза изображения.
 *
 * @param storageLocator    путь к сохраненному изображению
 * @param providerRequestId идентификатор запроса у провайдера (может быть null)
 */
public record SynthesisResult(String storageLocator, String providerRequestId) {
}
