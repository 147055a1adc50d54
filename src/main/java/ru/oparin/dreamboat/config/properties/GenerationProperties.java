package ru.oparin.dreamboat.config.properties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.generation")
public class GenerationProperties {

    /**
     * Количество задач в одном пакете. Задачи пакета выполняются параллельно,
     * следующий пакет запускается только после завершения текущего.
     */
    private Integer batchSize = 30;

    /**
     * Максимальное количество изображений в профиле.
     */
    private Integer maxProfilePhotos = 6;

    /**
     * Сценарий для пробной генерации.
     */
    private String sampleScenario = "photoshoot";

    /**
     * Через сколько времени без отметки выполнения задание в статусе IN_PROGRESS считается зависшим.
     * Отметка обновляется после каждого пакета, поэтому значение должно превышать время выполнения
     * одного пакета: попытки синтеза, умноженные на таймаут провайдера, плюс задержки между ними.
     */
    private Duration orphanTimeout = Duration.ofMinutes(30);

    /**
     * Повторы вызова сервиса синтеза.
     */
    private Retry retry = new Retry();

    /**
     * Финализация зависших заданий.
     */
    private OrphanSweep orphanSweep = new OrphanSweep();

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Retry {
        /**
         * Максимальное количество попыток, включая первую.
         */
        private Integer maxAttempts = 3;

        /**
         * Задержка перед второй попыткой, далее удваивается.
         */
        private Duration baseDelay = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrphanSweep {
        private boolean enabled = true;

        /**
         * Интервал запуска в миллисекундах.
         */
        private long intervalMs = 300000;
    }
}
