package ru.oparin.dreamboat.model.enums;

/**
 * Статусы проверки исходной фотографии.
 */
public enum ValidationStatus {

    /**
     * Фотография загружена, проверка еще не выполнялась.
     */
    PENDING,

    /**
     * Проверка пройдена, замечаний нет.
     */
    VALIDATED,

    /**
     * Проверка не пройдена: есть замечания или проверку не удалось выполнить.
     */
    FAILED,

    /**
     * Пользователь явно пропустил проверку.
     */
    BYPASSED;

    /**
     * Повторная проверка для VALIDATED и BYPASSED не выполняется.
     *
     * @param status статус фотографии
     * @return true, если статус конечный
     */
    public static boolean isTerminal(ValidationStatus status) {
        return status == VALIDATED || status == BYPASSED;
    }
}
