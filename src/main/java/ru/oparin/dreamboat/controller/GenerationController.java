package ru.oparin.dreamboat.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.exception.PaymentGateException;
import ru.oparin.dreamboat.model.dto.generation.GenerationRequestDTO;
import ru.oparin.dreamboat.model.dto.generation.GenerationStatusDTO;
import ru.oparin.dreamboat.model.dto.generation.GenerationSummaryDTO;
import ru.oparin.dreamboat.service.SampleGenerationService;
import ru.oparin.dreamboat.service.generation.GenerationService;

import java.util.Map;

/**
 * Контроллер для запуска генерации изображений.
 */
@Slf4j
@RestController
@RequestMapping("/generation")
@RequiredArgsConstructor
@Tag(name = "Генерация", description = "API для генерации изображений по сценариям")
public class GenerationController {

    private final GenerationService generationService;
    private final SampleGenerationService sampleGenerationService;

    /**
     * Запустить генерацию: каждая фотография с каждым сценарием.
     * Использует одну оплату пользователя.
     */
    @Operation(summary = "Запустить генерацию",
            description = "Резервирует оплату, выполняет задачи пакетами и возвращает итог по каждой задаче")
    @PostMapping
    public Mono<ResponseEntity<GenerationSummaryDTO>> generate(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @Valid @RequestBody GenerationRequestDTO request) {
        return generationService.generate(userId, request)
                .map(ResponseEntity::ok)
                .doOnError(error -> {
                    if (error instanceof PaymentGateException paymentError) {
                        log.warn("Генерация для пользователя {} отклонена: {}", userId, paymentError.getMessage());
                    } else {
                        log.error("Ошибка при генерации для пользователя {}", userId, error);
                    }
                });
    }

    @Operation(summary = "Получить состояние генерации",
            description = "Возвращает активное задание генерации или последнее завершенное")
    @GetMapping("/status")
    public Mono<ResponseEntity<GenerationStatusDTO>> getStatus(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId) {
        return generationService.getStatus(userId)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Запросить пробное изображение",
            description = "Запускает в фоне бесплатную генерацию одного изображения по фотографии")
    @PostMapping("/sample/{photoId}")
    public Mono<ResponseEntity<Map<String, Object>>> requestSample(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @PathVariable Long photoId) {
        return sampleGenerationService.requestSample(userId, photoId)
                .map(accepted -> ResponseEntity.status(accepted ? HttpStatus.ACCEPTED : HttpStatus.OK)
                        .body(Map.of("accepted", accepted)));
    }
}
