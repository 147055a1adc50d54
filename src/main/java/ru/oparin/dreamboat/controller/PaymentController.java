package ru.oparin.dreamboat.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.model.dto.payment.AccessStatusDTO;
import ru.oparin.dreamboat.model.dto.payment.PaymentCreditDTO;
import ru.oparin.dreamboat.model.dto.payment.RecordPaymentRequestDTO;
import ru.oparin.dreamboat.service.PaymentCreditService;

import java.util.List;

/**
 * Контроллер для работы с оплатами.
 */
@Slf4j
@RestController
@RequestMapping("/payment")
@RequiredArgsConstructor
@Tag(name = "Платежи", description = "API для записи оплат и проверки доступа к генерации")
public class PaymentController {

    private final PaymentCreditService paymentCreditService;

    @Operation(summary = "Записать подтвержденную оплату",
            description = "Вызывается после подтверждения оплаты платежной системой. Повторный вызов с той же транзакцией не создает новую оплату")
    @PostMapping("/confirmed")
    public Mono<ResponseEntity<PaymentCreditDTO>> recordConfirmedPayment(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @Valid @RequestBody RecordPaymentRequestDTO request) {
        log.info("Подтверждение оплаты {} для пользователя {}", request.getTransactionId(), userId);
        return paymentCreditService.recordConfirmedPayment(userId, request)
                .map(PaymentCreditDTO::fromEntity)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Проверить доступ к генерации")
    @GetMapping("/access")
    public Mono<ResponseEntity<AccessStatusDTO>> checkAccess(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId) {
        return paymentCreditService.checkAccess(userId)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "История оплат", description = "Все оплаты пользователя, новые первыми")
    @GetMapping("/history")
    public Mono<ResponseEntity<List<PaymentCreditDTO>>> getPaymentHistory(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId) {
        return paymentCreditService.getPaymentHistory(userId)
                .collectList()
                .map(ResponseEntity::ok);
    }
}
