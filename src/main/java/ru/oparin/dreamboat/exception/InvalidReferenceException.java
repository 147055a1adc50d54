package ru.oparin.dreamboat.exception;

import org.springframework.http.HttpStatus;

/**
 * Ссылка на оплату не найдена среди кредитов пользователя.
 */
public class InvalidReferenceException extends PaymentGateException {

    public InvalidReferenceException(String reference) {
        super(HttpStatus.NOT_FOUND, "Оплата " + reference + " не найдена");
    }
}
