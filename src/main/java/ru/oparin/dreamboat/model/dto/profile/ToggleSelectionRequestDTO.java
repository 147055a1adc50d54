package ru.oparin.dreamboat.model.dto.profile;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Установка или снятие позиции изображения в профиле.
 * order == null снимает изображение с профиля.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToggleSelectionRequestDTO {

    @Min(1)
    @Max(6)
    private Integer order;
}
