package ru.oparin.dreamboat.exception;

import jakarta.validation.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleAllExceptions(Exception ex) {
        log.error("Неизвестная ошибка: ", ex);

        return Mono.just(ResponseEntity.internalServerError()
                .body(Map.of(
                        "error", "Внутренняя ошибка сервера",
                        "status", 500,
                        "message", ex.getMessage() != null ? ex.getMessage() : "Unknown error"
                )));
    }

    @ExceptionHandler(PaymentGateException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handlePaymentGateException(PaymentGateException ex) {
        log.warn("Оплата не может быть использована: {}", ex.getMessage());
        return Mono.just(errorResponse(ex.getStatus(), ex.getMessage()));
    }

    @ExceptionHandler(PhotoNotFoundException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handlePhotoNotFound(PhotoNotFoundException ex) {
        log.warn(ex.getMessage());
        return Mono.just(errorResponse(ex.getStatus(), ex.getMessage()));
    }

    @ExceptionHandler(PhotoNotEligibleException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handlePhotoNotEligible(PhotoNotEligibleException ex) {
        log.warn(ex.getMessage());
        return Mono.just(errorResponse(ex.getStatus(), ex.getMessage()));
    }

    @ExceptionHandler(ResultNotFoundException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleResultNotFound(ResultNotFoundException ex) {
        log.warn(ex.getMessage());
        return Mono.just(errorResponse(ex.getStatus(), ex.getMessage()));
    }

    @ExceptionHandler(InvalidSelectionException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleInvalidSelection(InvalidSelectionException ex) {
        log.warn("Некорректный выбор изображений профиля: {}", ex.getMessage());
        return Mono.just(errorResponse(ex.getStatus(), ex.getMessage()));
    }

    @ExceptionHandler(TransactionConflictException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleTransactionConflict(TransactionConflictException ex) {
        log.warn(ex.getMessage());
        return Mono.just(errorResponse(ex.getStatus(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Некорректный запрос: {}", ex.getMessage());
        return Mono.just(errorResponse(HttpStatus.BAD_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler(ProviderException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleProviderException(ProviderException ex) {
        log.error("Ошибка внешнего сервиса: {}", ex.getMessage());

        if (ex.getCause() != null) {
            log.error("Cause: {}", ex.getCause().getMessage());
        }

        return Mono.just(errorResponse(HttpStatus.BAD_GATEWAY, ex.getMessage()));
    }

    @ExceptionHandler(ValidationException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleValidationException(ValidationException ex) {
        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Ошибка валидации",
                        "status", 400,
                        "details", ex.getMessage()
                )));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleValidationException(WebExchangeBindException ex) {
        Map<String, String> errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null ?
                                fieldError.getDefaultMessage() : "Invalid value",
                        (first, second) -> first
                ));

        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Ошибка валидации данных",
                        "status", 400,
                        "details", errors
                )));
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "error", message != null ? message : status.getReasonPhrase(),
                        "status", status.value()
                ));
    }
}
