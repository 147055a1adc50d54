package ru.oparin.dreamboat.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.exception.TransactionConflictException;
import ru.oparin.dreamboat.model.dto.payment.AccessStatusDTO;
import ru.oparin.dreamboat.model.dto.payment.PaymentCreditDTO;
import ru.oparin.dreamboat.model.dto.payment.RecordPaymentRequestDTO;
import ru.oparin.dreamboat.model.entity.PaymentCredit;
import ru.oparin.dreamboat.repository.PaymentCreditRepository;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Сервис для работы с оплатами пользователей.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentCreditService {

    private final PaymentCreditRepository paymentCreditRepository;
    private final Clock clock;

    /**
     * Записать подтвержденную оплату.
     * Повторное подтверждение той же транзакции возвращает уже созданный кредит.
     *
     * @throws TransactionConflictException если транзакция записана на другого пользователя
     */
    public Mono<PaymentCredit> recordConfirmedPayment(Long userId, RecordPaymentRequestDTO request) {
        return paymentCreditRepository.findByTransactionId(request.getTransactionId())
                .flatMap(existing -> requireOwner(userId, existing))
                .doOnNext(existing -> log.info("Оплата {} уже записана (кредит {}), повторное подтверждение пропущено",
                        request.getTransactionId(), existing.getId()))
                .switchIfEmpty(Mono.defer(() -> createCredit(userId, request)));
    }

    private Mono<PaymentCredit> requireOwner(Long userId, PaymentCredit existing) {
        if (!userId.equals(existing.getUserId())) {
            log.warn("Пользователь {} пытается записать транзакцию {}, принадлежащую пользователю {}",
                    userId, existing.getTransactionId(), existing.getUserId());
            return Mono.error(new TransactionConflictException(existing.getTransactionId()));
        }
        return Mono.just(existing);
    }

    private Mono<PaymentCredit> createCredit(Long userId, RecordPaymentRequestDTO request) {
        LocalDateTime now = LocalDateTime.now(clock);
        PaymentCredit credit = PaymentCredit.builder()
                .userId(userId)
                .transactionId(request.getTransactionId())
                .amount(request.getAmount())
                .currency(request.getCurrency().toLowerCase())
                .redeemed(false)
                .paidAt(now)
                .createdAt(now)
                .build();

        return paymentCreditRepository.save(credit)
                .doOnNext(saved -> log.info("Записана оплата {} пользователя {}: {} {}",
                        saved.getTransactionId(), userId, saved.getAmount(), saved.getCurrency()))
                .onErrorResume(DataIntegrityViolationException.class, e -> {
                    log.info("Оплата {} записана параллельным запросом", request.getTransactionId());
                    return paymentCreditRepository.findByTransactionId(request.getTransactionId())
                            .flatMap(existing -> requireOwner(userId, existing));
                });
    }

    /**
     * Проверить, может ли пользователь запустить генерацию.
     */
    public Mono<AccessStatusDTO> checkAccess(Long userId) {
        return paymentCreditRepository.countUnredeemed(userId)
                .defaultIfEmpty(0L)
                .map(count -> AccessStatusDTO.builder()
                        .hasAccess(count > 0)
                        .availableCredits(count)
                        .build());
    }

    /**
     * История оплат пользователя, новые первыми.
     */
    public Flux<PaymentCreditDTO> getPaymentHistory(Long userId) {
        return paymentCreditRepository.findByUserIdOrderByPaidAtDesc(userId)
                .map(PaymentCreditDTO::fromEntity);
    }
}
