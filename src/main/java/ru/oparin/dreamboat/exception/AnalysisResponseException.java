package ru.oparin.dreamboat.exception;

/**
 * Ответ сервиса анализа фотографий не соответствует ожидаемому формату.
 */
public class AnalysisResponseException extends RuntimeException {

    public AnalysisResponseException(String message) {
        super(message);
    }

    public AnalysisResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
