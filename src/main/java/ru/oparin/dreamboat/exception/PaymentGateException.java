package ru.oparin.dreamboat.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Базовое исключение резервирования платежного кредита.
 * Прерывает запрос генерации до запуска первой задачи.
 */
public abstract class PaymentGateException extends RuntimeException {

    @Getter
    private final HttpStatus status;

    protected PaymentGateException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }
}
