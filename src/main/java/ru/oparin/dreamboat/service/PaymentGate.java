package ru.oparin.dreamboat.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.exception.AlreadyRedeemedException;
import ru.oparin.dreamboat.exception.InvalidReferenceException;
import ru.oparin.dreamboat.exception.NoCreditException;
import ru.oparin.dreamboat.model.entity.PaymentCredit;
import ru.oparin.dreamboat.repository.PaymentCreditRepository;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Резервирование платежного кредита под задание генерации.
 * Один запрос генерации использует ровно один кредит. Кредит помечается использованным
 * одним условным UPDATE, поэтому из параллельных запросов на один кредит успешен только один.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentGate {

    private final PaymentCreditRepository paymentCreditRepository;
    private final Clock clock;

    /**
     * Зарезервировать кредит пользователя.
     * Без ссылки используется последняя по времени оплаты неиспользованная оплата.
     * Ссылка (id кредита или идентификатор транзакции), не совпадающая с ней, ищется отдельно.
     *
     * @param userId    пользователь
     * @param reference ссылка на оплату или null
     * @return использованный кредит
     */
    public Mono<PaymentCredit> reserve(Long userId, String reference) {
        return paymentCreditRepository.findLatestUnredeemed(userId)
                .switchIfEmpty(Mono.error(() -> {
                    log.warn("Пользователь {} запросил генерацию без оплаты", userId);
                    return new NoCreditException(userId);
                }))
                .flatMap(latest -> {
                    if (reference == null || reference.isBlank() || latest.matchesReference(reference)) {
                        return redeem(latest);
                    }
                    return findByReference(userId, reference)
                            .switchIfEmpty(Mono.error(() -> new InvalidReferenceException(reference)))
                            .flatMap(credit -> Boolean.TRUE.equals(credit.getRedeemed())
                                    ? Mono.error(new AlreadyRedeemedException(reference))
                                    : redeem(credit));
                });
    }

    private Mono<PaymentCredit> findByReference(Long userId, String reference) {
        Mono<PaymentCredit> byTransactionId = paymentCreditRepository.findByTransactionIdAndUserId(reference, userId);
        Long creditId = parseId(reference);
        if (creditId == null) {
            return byTransactionId;
        }
        return paymentCreditRepository.findByIdAndUserId(creditId, userId)
                .switchIfEmpty(byTransactionId);
    }

    private Mono<PaymentCredit> redeem(PaymentCredit credit) {
        LocalDateTime now = LocalDateTime.now(clock);
        return paymentCreditRepository.redeem(credit.getId(), now)
                .flatMap(updated -> {
                    if (updated == 0) {
                        log.warn("Оплата {} уже использована параллельным запросом", credit.getId());
                        return Mono.error(new AlreadyRedeemedException(String.valueOf(credit.getId())));
                    }
                    credit.setRedeemed(true);
                    credit.setRedeemedAt(now);
                    log.info("Оплата {} пользователя {} использована для генерации", credit.getId(), credit.getUserId());
                    return Mono.just(credit);
                });
    }

    private Long parseId(String reference) {
        try {
            return Long.parseLong(reference.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
