package ru.oparin.dreamboat.model.dto.payment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.dreamboat.model.entity.PaymentCredit;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * DTO для истории оплат пользователя.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentCreditDTO {

    private Long id;

    private String transactionId;

    private BigDecimal amount;

    private String currency;

    /**
     * Использована ли оплата для генерации.
     */
    private Boolean redeemed;

    private LocalDateTime paidAt;

    private LocalDateTime redeemedAt;

    public static PaymentCreditDTO fromEntity(PaymentCredit credit) {
        return PaymentCreditDTO.builder()
                .id(credit.getId())
                .transactionId(credit.getTransactionId())
                .amount(credit.getAmount())
                .currency(credit.getCurrency())
                .redeemed(credit.getRedeemed())
                .paidAt(credit.getPaidAt())
                .redeemedAt(credit.getRedeemedAt())
                .build();
    }
}
