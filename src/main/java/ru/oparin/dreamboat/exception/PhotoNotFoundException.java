package ru.oparin.dreamboat.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

public class PhotoNotFoundException extends RuntimeException {

    @Getter
    private final HttpStatus status = HttpStatus.NOT_FOUND;

    public PhotoNotFoundException(Long photoId) {
        super("Фотография " + photoId + " не найдена");
    }
}
