package ru.oparin.dreamboat.model.dto.payment;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * DTO подтвержденной оплаты от платежной системы.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordPaymentRequestDTO {

    /**
     * Идентификатор транзакции во внешней платежной системе.
     */
    @NotBlank
    private String transactionId;

    @NotNull
    @Positive
    private BigDecimal amount;

    @NotBlank
    private String currency;
}
