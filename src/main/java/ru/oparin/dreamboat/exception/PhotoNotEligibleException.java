package ru.oparin.dreamboat.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import ru.oparin.dreamboat.model.enums.ValidationStatus;

/**
 * Фотография не прошла проверку и не может использоваться для генерации.
 */
public class PhotoNotEligibleException extends RuntimeException {

    @Getter
    private final HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;

    public PhotoNotEligibleException(Long photoId, ValidationStatus validationStatus) {
        super("Фотография " + photoId + " не может использоваться для генерации, статус проверки: " + validationStatus);
    }
}
