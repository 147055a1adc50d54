package ru.oparin.dreamboat.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Некорректный выбор изображений профиля.
 */
public class InvalidSelectionException extends RuntimeException {

    @Getter
    private final HttpStatus status = HttpStatus.BAD_REQUEST;

    public InvalidSelectionException(String message) {
        super(message);
    }
}
