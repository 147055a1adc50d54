package ru.oparin.dreamboat.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Транзакция уже записана как оплата другого пользователя.
 */
public class TransactionConflictException extends RuntimeException {

    @Getter
    private final HttpStatus status = HttpStatus.CONFLICT;

    public TransactionConflictException(String transactionId) {
        super("Транзакция " + transactionId + " уже использована");
    }
}
