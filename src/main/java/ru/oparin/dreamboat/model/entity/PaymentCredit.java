package ru.oparin.dreamboat.model.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Сущность платежного кредита.
 * Одноразовое право на запуск одного задания генерации. Создается по подтверждению оплаты,
 * изменяется только при резервировании, никогда не удаляется.
 */
@Table(value = "payment_credit", schema = "dreamboat")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentCredit {

    /**
     * Уникальный идентификатор кредита.
     * Автоматически генерируется базой данных.
     */
    @Id
    private Long id;

    /**
     * Идентификатор владельца кредита.
     */
    private Long userId;

    /**
     * Идентификатор транзакции во внешней платежной системе.
     * Уникален, используется для идемпотентной записи подтверждений оплаты.
     */
    private String transactionId;

    /**
     * Сумма оплаты.
     */
    private BigDecimal amount;

    /**
     * Код валюты (например, usd).
     */
    private String currency;

    /**
     * Флаг использования кредита.
     * Меняется только false -> true и никогда обратно.
     */
    @Builder.Default
    private Boolean redeemed = false;

    /**
     * Время подтверждения оплаты.
     */
    private LocalDateTime paidAt;

    /**
     * Время использования кредита для генерации.
     */
    private LocalDateTime redeemedAt;

    /**
     * Дата и время создания записи.
     */
    private LocalDateTime createdAt;

    /**
     * Проверить, совпадает ли внешняя ссылка с этим кредитом (по id или идентификатору транзакции).
     *
     * @param reference ссылка, переданная клиентом
     * @return true, если ссылка указывает на этот кредит
     */
    public boolean matchesReference(String reference) {
        if (reference == null) {
            return false;
        }
        return reference.equals(String.valueOf(id)) || reference.equals(transactionId);
    }
}
