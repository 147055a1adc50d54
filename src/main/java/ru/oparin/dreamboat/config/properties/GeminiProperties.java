package ru.oparin.dreamboat.config.properties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Конфигурационные свойства для интеграции с Gemini API.
 * Настройки загружаются из application.yml с префиксом gemini.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gemini")
public class GeminiProperties {

    /**
     * Настройки API Gemini (URL и ключ авторизации).
     */
    private Api api = new Api();

    /**
     * Модель для синтеза изображений.
     */
    private String imageModel = "gemini-2.5-flash-image-preview";

    /**
     * Модель для анализа фотографий.
     */
    private String analysisModel = "gemini-2.0-flash";

    /**
     * Таймаут ответа API.
     */
    private Duration timeout = Duration.ofSeconds(120);

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Api {
        /**
         * Базовый URL API Gemini.
         */
        private String url = "https://generativelanguage.googleapis.com";

        /**
         * API ключ, передается в заголовке x-goog-api-key.
         */
        private String key;
    }
}
