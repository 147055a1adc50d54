package ru.oparin.dreamboat.model.dto.gemini;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO для запроса к Gemini API (Google Native Format, метод generateContent).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GeminiRequestDTO {

    /**
     * Содержимое запроса (текст и изображения).
     */
    private List<Content> contents;

    /**
     * Параметры генерации ответа.
     */
    private GenerationConfig generationConfig;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Content {
        /**
         * Роль отправителя (user).
         */
        private String role;

        private List<Part> parts;
    }

    /**
     * Часть содержимого: текст или встроенное изображение.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Part {
        private String text;

        private InlineData inlineData;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InlineData {
        /**
         * MIME тип изображения.
         */
        private String mimeType;

        /**
         * Base64 данные изображения без префикса data:image/...;base64,
         */
        private String data;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GenerationConfig {
        /**
         * MIME тип ответа (application/json для анализа фотографий).
         */
        private String responseMimeType;

        /**
         * Модальности ответа (TEXT, IMAGE).
         */
        private List<String> responseModalities;
    }
}
