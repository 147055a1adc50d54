package ru.oparin.dreamboat.model.dto.payment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Доступ пользователя к генерации.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessStatusDTO {

    /**
     * Есть ли хотя бы одна неиспользованная оплата.
     */
    private Boolean hasAccess;

    /**
     * Количество неиспользованных оплат.
     */
    private Long availableCredits;
}
