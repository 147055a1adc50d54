package ru.oparin.dreamboat.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

public class ResultNotFoundException extends RuntimeException {

    @Getter
    private final HttpStatus status = HttpStatus.NOT_FOUND;

    public ResultNotFoundException(Long resultId) {
        super("Сгенерированное изображение " + resultId + " не найдено");
    }
}
