package ru.oparin.dreamboat.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.model.entity.PaymentCredit;

import java.time.LocalDateTime;

@Repository
public interface PaymentCreditRepository extends ReactiveCrudRepository<PaymentCredit, Long> {

    Mono<PaymentCredit> findByTransactionId(String transactionId);

    Mono<PaymentCredit> findByIdAndUserId(Long id, Long userId);

    Mono<PaymentCredit> findByTransactionIdAndUserId(String transactionId, Long userId);

    @Query("SELECT * FROM dreamboat.payment_credit WHERE user_id = :userId AND redeemed = FALSE " +
            "ORDER BY paid_at DESC LIMIT 1")
    Mono<PaymentCredit> findLatestUnredeemed(Long userId);

    @Query("SELECT * FROM dreamboat.payment_credit WHERE user_id = :userId ORDER BY paid_at DESC")
    Flux<PaymentCredit> findByUserIdOrderByPaidAtDesc(Long userId);

    @Query("SELECT COUNT(*) FROM dreamboat.payment_credit WHERE user_id = :userId AND redeemed = FALSE")
    Mono<Long> countUnredeemed(Long userId);

    /**
     * Пометить кредит использованным, только если он еще не использован.
     *
     * @return количество измененных строк: 1 при успехе, 0 если кредит уже использован
     */
    @Modifying
    @Query("UPDATE dreamboat.payment_credit SET redeemed = TRUE, redeemed_at = :redeemedAt " +
            "WHERE id = :id AND redeemed = FALSE")
    Mono<Integer> redeem(Long id, LocalDateTime redeemedAt);
}
