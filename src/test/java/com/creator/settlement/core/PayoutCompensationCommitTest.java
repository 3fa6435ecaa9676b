package com.creator.settlement.core;

import com.creator.settlement.api.SettlementException;
import com.creator.settlement.compliance.SettlementAuditLogger;
import com.creator.settlement.domain.ErrorKind;
import com.creator.settlement.domain.KycStatus;
import com.creator.settlement.domain.PayoutStatus;
import com.creator.settlement.domain.PixKeyType;
import com.creator.settlement.messaging.SettlementEventProducer;
import com.creator.settlement.persistence.entity.CreatorEntity;
import com.creator.settlement.persistence.entity.PayoutEntity;
import com.creator.settlement.persistence.repository.BalanceRepository;
import com.creator.settlement.persistence.repository.CreatorRepository;
import com.creator.settlement.persistence.repository.PayoutRepository;
import com.creator.settlement.persistence.service.PayoutPersistenceService;
import com.creator.settlement.risk.domain.VelocityCheckResult;
import com.creator.settlement.risk.domain.VelocityKind;
import com.creator.settlement.risk.flags.FraudFlagRegistry;
import com.creator.settlement.risk.velocity.VelocityGuard;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Payout saga with each step committing on its own: the debit is already durable when the
 * gateway fails, so the returned funds must come from the compensation.
 */
@DataJpaTest(properties = {
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "settlement.payout.fee=500"
})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({LedgerService.class, PayoutPersistenceService.class, PayoutOrchestrator.class,
        PayoutCompensationCommitTest.CircuitBreakerTestConfig.class})
class PayoutCompensationCommitTest {

    @TestConfiguration
    static class CircuitBreakerTestConfig {
        @Bean
        CircuitBreakerRegistry circuitBreakerRegistry() {
            return CircuitBreakerRegistry.ofDefaults();
        }
    }

    @Autowired
    private PayoutOrchestrator orchestrator;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private CreatorRepository creatorRepository;

    @Autowired
    private PayoutRepository payoutRepository;

    @Autowired
    private BalanceRepository balanceRepository;

    @MockitoBean
    private VelocityGuard velocityGuard;

    @MockitoBean
    private FraudFlagRegistry fraudFlagRegistry;

    @MockitoBean
    private PayoutLockService payoutLockService;

    @MockitoBean
    private SettlementGateway settlementGateway;

    @MockitoBean
    private SettlementAuditLogger auditLogger;

    @MockitoBean
    private SettlementEventProducer eventProducer;

    @BeforeEach
    void setUp() {
        creatorRepository.save(CreatorEntity.builder()
                .id("c-1")
                .userId("u-1")
                .kycStatus(KycStatus.APPROVED)
                .pixKey("creator@example.com")
                .pixKeyType(PixKeyType.EMAIL)
                .build());
        ledgerService.openBalance("c-1");
        ledgerService.credit("c-1", 5000);

        when(payoutLockService.withCreatorLock(anyString(), any()))
                .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(1)).get());
        when(velocityGuard.checkVelocity(eq(VelocityKind.PAYOUT), anyString(), anyInt(), anyInt()))
                .thenReturn(VelocityCheckResult.builder().kind(VelocityKind.PAYOUT).actorId("u-1")
                        .allowed(true).count(0).limit(3).windowMinutes(60).build());
        when(settlementGateway.getName()).thenReturn("stub");
    }

    @AfterEach
    void cleanUp() {
        payoutRepository.deleteAll();
        balanceRepository.deleteAll();
        creatorRepository.deleteAll();
    }

    @Test
    void gatewayFailureAfterCommittedDebitRestoresBalance() {
        when(settlementGateway.transfer(any())).thenThrow(new SettlementGatewayException("Asaas returned HTTP 503", 503));

        assertThatThrownBy(() -> orchestrator.requestPayout("c-1", null))
                .isInstanceOf(SettlementException.class)
                .extracting(e -> ((SettlementException) e).getKind())
                .isEqualTo(ErrorKind.EXTERNAL_GATEWAY_ERROR);

        assertThat(ledgerService.getBalance("c-1").getAvailable()).isEqualTo(5000);
        List<PayoutEntity> payouts = payoutRepository.findAll();
        assertThat(payouts).hasSize(1);
        assertThat(payouts.get(0).getStatus()).isEqualTo(PayoutStatus.FAILED);
    }

    @Test
    void failureBeforeTransferIsSubmittedRestoresBalance() {
        doThrow(new IllegalStateException("audit sink unavailable"))
                .when(auditLogger).logPayoutRequested(any(PayoutEntity.class), anyString());

        assertThatThrownBy(() -> orchestrator.requestPayout("c-1", 3000L))
                .isInstanceOf(SettlementException.class)
                .extracting(e -> ((SettlementException) e).getKind())
                .isEqualTo(ErrorKind.EXTERNAL_GATEWAY_ERROR);

        verify(settlementGateway, never()).transfer(any());
        assertThat(ledgerService.getBalance("c-1").getAvailable()).isEqualTo(5000);
        assertThat(payoutRepository.findAll()).extracting(PayoutEntity::getStatus).containsExactly(PayoutStatus.FAILED);
    }
}
