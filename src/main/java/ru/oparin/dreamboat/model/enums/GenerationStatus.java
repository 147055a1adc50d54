package ru.oparin.dreamboat.model.enums;

/**
 * Статусы задания генерации.
 * Переходы только IN_PROGRESS -> COMPLETED или IN_PROGRESS -> FAILED.
 */
public enum GenerationStatus {

    /**
     * Задание создано, задачи выполняются.
     */
    IN_PROGRESS,

    /**
     * Все задачи задания завершились успешно.
     */
    COMPLETED,

    /**
     * Хотя бы одна задача не выполнена. Успешные результаты при этом сохраняются.
     */
    FAILED;

    /**
     * Проверить, является ли статус конечным.
     *
     * @param status статус для проверки
     * @return true для COMPLETED и FAILED
     */
    public static boolean isTerminal(GenerationStatus status) {
        return status == COMPLETED || status == FAILED;
    }
}
