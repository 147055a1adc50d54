package ru.oparin.dreamboat.model.dto.profile;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Изображение и его позиция в профиле.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileSlotDTO {

    @NotNull
    private Long resultId;

    @NotNull
    @Min(1)
    @Max(6)
    private Integer order;
}
