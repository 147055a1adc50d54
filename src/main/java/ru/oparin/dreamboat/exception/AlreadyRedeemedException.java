package ru.oparin.dreamboat.exception;

import org.springframework.http.HttpStatus;

/**
 * Кредит уже использован, в том числе параллельным запросом.
 */
public class AlreadyRedeemedException extends PaymentGateException {

    public AlreadyRedeemedException(String reference) {
        super(HttpStatus.CONFLICT, "Оплата " + reference + " уже использована");
    }
}
