package ru.oparin.dreamboat.service.storage;

import reactor.core.publisher.Mono;

/**
 * Хранилище изображений. Изображение адресуется строковым путем (locator),
 * который сохраняется в базе данных.
 */
public interface ImageStorage {

    /**
     * Поддиректория загруженных пользователем фотографий: uploads/{ownerId}/...
     */
    String UPLOADS_SUBDIRECTORY = "uploads";

    /**
     * Прочитать изображение.
     *
     * @param locator путь к изображению
     * @return содержимое файла
     */
    Mono<byte[]> read(String locator);

    /**
     * Сохранить изображение.
     *
     * @param imageBytes   содержимое
     * @param ownerId      владелец изображения
     * @param subdirectory поддиректория (например, "generated")
     * @param extension    расширение файла без точки
     * @return путь к сохраненному изображению
     */
    Mono<String> store(byte[] imageBytes, Long ownerId, String subdirectory, String extension);

    /**
     * Проверить наличие изображения.
     */
    Mono<Boolean> exists(String locator);
}
