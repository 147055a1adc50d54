package ru.oparin.dreamboat.exception;

import lombok.Getter;

/**
 * Все попытки выполнения операции исчерпаны.
 * Сообщение содержит текст последней ошибки, причина - сама последняя ошибка.
 */
@Getter
public class ExhaustedRetriesException extends RuntimeException {

    private final String operationName;
    private final int attempts;

    public ExhaustedRetriesException(String operationName, int attempts, Throwable lastError) {
        super(lastError.getMessage(), lastError);
        this.operationName = operationName;
        this.attempts = attempts;
    }
}
