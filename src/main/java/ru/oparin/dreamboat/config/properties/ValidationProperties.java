package ru.oparin.dreamboat.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Настройки проверки исходных фотографий.
 * Загружаются из application.yml с префиксом app.validation.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.validation")
public class ValidationProperties {

    /**
     * Минимальный интервал между запросами к сервису анализа.
     */
    private Duration minRequestInterval = Duration.ofSeconds(1);

    /**
     * Максимальное количество попыток анализа одной фотографии.
     */
    private Integer maxAttempts = 3;

    /**
     * Задержка перед второй попыткой, далее удваивается.
     */
    private Duration baseDelay = Duration.ofSeconds(1);
}
