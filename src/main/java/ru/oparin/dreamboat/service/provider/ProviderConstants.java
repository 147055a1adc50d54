package ru.oparin.dreamboat.service.provider;

import java.time.Duration;

/**
 * Константы для внешних сервисов синтеза и анализа изображений.
 */
public final class ProviderConstants {

    private ProviderConstants() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Константы Gemini API.
     */
    public static final class Gemini {
        private Gemini() {
            throw new UnsupportedOperationException("Utility class");
        }

        /**
         * Шаблон endpoint для Google Native Format API.
         */
        public static final String ENDPOINT_TEMPLATE = "/v1beta/models/%s:generateContent";

        /**
         * Заголовок с API ключом.
         */
        public static final String API_KEY_HEADER = "x-goog-api-key";

        /**
         * Таймаут подключения (30 секунд).
         */
        public static final int CONNECT_TIMEOUT_MS = 30_000;

        /**
         * Поддиректория для сохранения сгенерированных изображений.
         */
        public static final String IMAGE_SUBDIRECTORY = "generated";

        public static final String ROLE_USER = "user";
        public static final String MODALITY_TEXT = "TEXT";
        public static final String MODALITY_IMAGE = "IMAGE";
        public static final String JSON_MIME_TYPE = "application/json";
    }

    /**
     * Ключи внешних сервисов для ограничения частоты вызовов.
     */
    public static final class Dependencies {
        private Dependencies() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String IMAGE_SYNTHESIS = "gemini-image-synthesis";
        public static final String CONTENT_ANALYSIS = "gemini-content-analysis";
    }

    /**
     * Сообщения об ошибках для провайдеров.
     */
    public static final class ErrorMessages {
        private ErrorMessages() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String EMPTY_RESPONSE = "Пустой ответ от провайдера";
        public static final String NO_IMAGES_IN_RESPONSE = "Не найдено изображений в ответе от провайдера";
        public static final String PROMPT_BLOCKED_TEMPLATE = "Запрос отклонен фильтрами провайдера: %s";
        public static final String TIMEOUT_MESSAGE = "Превышено время ожидания ответа от сервиса. Попробуйте позже.";
        public static final String CONNECTION_ERROR = "Не удалось подключиться к сервису. Попробуйте позже.";
        public static final String PROVIDER_ERROR_TEMPLATE = "Сервис вернул ошибку. Статус: %s, причина: %s";
        public static final String UNKNOWN_ERROR_TEMPLATE = "Произошла ошибка при работе с сервисом: %s";
    }

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);
}
