package ru.oparin.dreamboat.controller;

/**
 * Заголовки, которые выставляет вышестоящий слой аутентификации.
 */
public final class ApiHeaders {

    private ApiHeaders() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Идентификатор аутентифицированного пользователя.
     */
    public static final String USER_ID = "X-User-Id";
}
