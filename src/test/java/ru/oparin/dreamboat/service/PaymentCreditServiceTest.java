package ru.oparin.dreamboat.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.dreamboat.exception.TransactionConflictException;
import ru.oparin.dreamboat.model.dto.payment.RecordPaymentRequestDTO;
import ru.oparin.dreamboat.model.entity.PaymentCredit;
import ru.oparin.dreamboat.repository.PaymentCreditRepository;

import java.math.BigDecimal;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentCreditServiceTest {

    @Mock
    private PaymentCreditRepository paymentCreditRepository;

    private PaymentCreditService paymentCreditService;

    private final RecordPaymentRequestDTO request = RecordPaymentRequestDTO.builder()
            .transactionId("pi_123")
            .amount(new BigDecimal("9.99"))
            .currency("USD")
            .build();

    @BeforeEach
    void setUp() {
        paymentCreditService = new PaymentCreditService(paymentCreditRepository, Clock.systemUTC());
    }

    @Test
    void recordConfirmedPayment_shouldCreateUnredeemedCredit() {
        // Given
        when(paymentCreditRepository.findByTransactionId("pi_123")).thenReturn(Mono.empty());
        when(paymentCreditRepository.save(any(PaymentCredit.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        // When / Then
        StepVerifier.create(paymentCreditService.recordConfirmedPayment(3L, request))
                .assertNext(credit -> {
                    assertEquals(3L, credit.getUserId());
                    assertEquals("usd", credit.getCurrency());
                    assertFalse(credit.getRedeemed());
                    assertNotNull(credit.getPaidAt());
                })
                .verifyComplete();
    }

    @Test
    void recordConfirmedPayment_shouldReturnExistingCredit_whenTransactionRepeated() {
        PaymentCredit existing = PaymentCredit.builder().id(8L).userId(3L).transactionId("pi_123").build();
        when(paymentCreditRepository.findByTransactionId("pi_123")).thenReturn(Mono.just(existing));

        StepVerifier.create(paymentCreditService.recordConfirmedPayment(3L, request))
                .expectNext(existing)
                .verifyComplete();
        verify(paymentCreditRepository, never()).save(any());
    }

    @Test
    void recordConfirmedPayment_shouldReadWinner_whenConcurrentInsertConflicts() {
        // Given
        PaymentCredit winner = PaymentCredit.builder().id(8L).userId(3L).transactionId("pi_123").build();
        when(paymentCreditRepository.findByTransactionId("pi_123"))
                .thenReturn(Mono.empty())
                .thenReturn(Mono.just(winner));
        when(paymentCreditRepository.save(any(PaymentCredit.class)))
                .thenReturn(Mono.error(new DataIntegrityViolationException("duplicate key")));

        // When / Then
        StepVerifier.create(paymentCreditService.recordConfirmedPayment(3L, request))
                .expectNext(winner)
                .verifyComplete();
    }

    @Test
    void recordConfirmedPayment_shouldReject_whenTransactionBelongsToAnotherUser() {
        // Given - pi_123 was recorded for user 5
        PaymentCredit foreign = PaymentCredit.builder().id(8L).userId(5L).transactionId("pi_123").redeemed(true).build();
        when(paymentCreditRepository.findByTransactionId("pi_123")).thenReturn(Mono.just(foreign));

        // When / Then
        StepVerifier.create(paymentCreditService.recordConfirmedPayment(3L, request))
                .expectErrorSatisfies(error -> {
                    TransactionConflictException conflict = assertInstanceOf(TransactionConflictException.class, error);
                    assertEquals(HttpStatus.CONFLICT, conflict.getStatus());
                    assertFalse(conflict.getMessage().contains("5"));
                })
                .verify();
        verify(paymentCreditRepository, never()).save(any());
    }

    @Test
    void recordConfirmedPayment_shouldReject_whenConcurrentInsertByAnotherUserWins() {
        PaymentCredit foreign = PaymentCredit.builder().id(8L).userId(5L).transactionId("pi_123").build();
        when(paymentCreditRepository.findByTransactionId("pi_123"))
                .thenReturn(Mono.empty())
                .thenReturn(Mono.just(foreign));
        when(paymentCreditRepository.save(any(PaymentCredit.class)))
                .thenReturn(Mono.error(new DataIntegrityViolationException("duplicate key")));

        StepVerifier.create(paymentCreditService.recordConfirmedPayment(3L, request))
                .expectError(TransactionConflictException.class)
                .verify();
    }

    @Test
    void checkAccess_shouldReportAvailableCredits() {
        when(paymentCreditRepository.countUnredeemed(3L)).thenReturn(Mono.just(2L));

        StepVerifier.create(paymentCreditService.checkAccess(3L))
                .assertNext(access -> {
                    assertTrue(access.getHasAccess());
                    assertEquals(2L, access.getAvailableCredits());
                })
                .verifyComplete();
    }
}
