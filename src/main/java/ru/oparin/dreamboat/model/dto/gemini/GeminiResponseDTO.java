package ru.oparin.dreamboat.model.dto.gemini;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO для ответа Gemini API.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GeminiResponseDTO {

    /**
     * Кандидаты с результатами генерации.
     */
    private List<Candidate> candidates;

    /**
     * Сведения о блокировке запроса фильтрами безопасности.
     */
    private PromptFeedback promptFeedback;

    /**
     * Идентификатор ответа.
     */
    private String responseId;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Candidate {
        private Content content;

        /**
         * Причина завершения (STOP, SAFETY и т.д.).
         */
        private String finishReason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Content {
        /**
         * Части содержимого (изображения и/или текст).
         */
        private List<Part> parts;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Part {
        private String text;

        private InlineData inlineData;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InlineData {
        private String mimeType;

        /**
         * Base64 данные изображения.
         */
        private String data;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PromptFeedback {
        private String blockReason;
    }
}
