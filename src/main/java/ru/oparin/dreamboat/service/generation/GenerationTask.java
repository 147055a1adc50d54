package ru.oparin.dreamboat.service.generation;

import ru.oparin.dreamboat.model.entity.SourcePhoto;

/**
 * Задача генерации: одна пара (фотография, сценарий).
 *
 * @param position порядковый номер задачи в задании, начиная с 1
 * @param photo    исходная фотография
 * @param scenario имя сценария
 */
public record GenerationTask(int position, SourcePhoto photo, String scenario) {
}
