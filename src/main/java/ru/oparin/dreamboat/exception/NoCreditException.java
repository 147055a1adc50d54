package ru.oparin.dreamboat.exception;

import org.springframework.http.HttpStatus;

/**
 * У пользователя нет неиспользованного платежного кредита.
 */
public class NoCreditException extends PaymentGateException {

    public NoCreditException(Long userId) {
        super(HttpStatus.PAYMENT_REQUIRED, "Нет неиспользованной оплаты для пользователя " + userId);
    }
}
