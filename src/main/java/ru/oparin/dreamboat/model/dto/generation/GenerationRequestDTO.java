package ru.oparin.dreamboat.model.dto.generation;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * DTO для запроса генерации изображений.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Запрос генерации: каждая фотография с каждым сценарием")
public class GenerationRequestDTO {

    @NotEmpty(message = "Выберите хотя бы одну фотографию")
    @Schema(description = "Идентификаторы исходных фотографий", example = "[1, 2]")
    private List<@NotNull Long> photoIds;

    @NotEmpty(message = "Выберите хотя бы один сценарий")
    @Schema(description = "Сценарии генерации", example = "[\"photoshoot\", \"beach\"]")
    private List<@NotNull String> scenarios;

    /**
     * Пользовательские промпты: сценарий -> промпт.
     */
    @Schema(description = "Пользовательские промпты по сценариям")
    private Map<String, String> customPrompts;

    /**
     * Идентификатор кредита или транзакции оплаты. Если не указан, используется последняя оплата.
     */
    @Schema(description = "Ссылка на оплату (id кредита или идентификатор транзакции)")
    private String paymentReference;
}
