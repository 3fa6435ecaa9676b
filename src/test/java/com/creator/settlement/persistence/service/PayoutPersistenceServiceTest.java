package com.creator.settlement.persistence.service;

import com.creator.settlement.core.LedgerService;
import com.creator.settlement.domain.PayoutQuote;
import com.creator.settlement.domain.PayoutStatus;
import com.creator.settlement.domain.TransferResult;
import com.creator.settlement.domain.TransferStatus;
import com.creator.settlement.persistence.entity.PayoutEntity;
import com.creator.settlement.persistence.repository.PayoutRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Saga steps against H2: open (insert + debit), record, and compensation (fail + credit).
 */
@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=create-drop")
@Import({LedgerService.class, PayoutPersistenceService.class})
class PayoutPersistenceServiceTest {

    @Autowired
    private PayoutPersistenceService persistenceService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private PayoutRepository payoutRepository;

    @BeforeEach
    void setUp() {
        ledgerService.openBalance("c-1");
        ledgerService.credit("c-1", 5000);
    }

    @Test
    void openPayoutDebitsGrossAndRecordsProcessingPayout() {
        PayoutEntity payout = persistenceService.openPayout("c-1", new PayoutQuote(5000, 199, 4801));

        assertThat(ledgerService.getBalance("c-1").getAvailable()).isZero();
        PayoutEntity stored = payoutRepository.findById(payout.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(PayoutStatus.PROCESSING);
        assertThat(stored.getAmount()).isEqualTo(5000);
        assertThat(stored.getFee()).isEqualTo(199);
        assertThat(stored.getNetAmount()).isEqualTo(4801);
    }

    @Test
    void compensationRestoresBalanceAndFailsPayout() {
        PayoutEntity payout = persistenceService.openPayout("c-1", new PayoutQuote(3000, 199, 2801));

        boolean compensated = persistenceService.compensateFailedPayout(payout.getId(), "gateway timeout");

        assertThat(compensated).isTrue();
        assertThat(ledgerService.getBalance("c-1").getAvailable()).isEqualTo(5000);
        PayoutEntity stored = payoutRepository.findById(payout.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(PayoutStatus.FAILED);
        assertThat(stored.getFailedReason()).isEqualTo("gateway timeout");
        assertThat(stored.getProcessedAt()).isNotNull();
    }

    @Test
    void compensationCreditsOnlyOnce() {
        PayoutEntity payout = persistenceService.openPayout("c-1", new PayoutQuote(3000, 199, 2801));

        assertThat(persistenceService.compensateFailedPayout(payout.getId(), "first")).isTrue();
        assertThat(persistenceService.compensateFailedPayout(payout.getId(), "second")).isFalse();

        assertThat(ledgerService.getBalance("c-1").getAvailable()).isEqualTo(5000);
        assertThat(payoutRepository.findById(payout.getId()).orElseThrow().getFailedReason()).isEqualTo("first");
    }

    @Test
    void completedPayoutIsNeverCompensated() {
        PayoutEntity payout = persistenceService.openPayout("c-1", new PayoutQuote(3000, 199, 2801));
        persistenceService.recordTransfer(payout.getId(), TransferResult.builder()
                .id("tr-1").status(TransferStatus.DONE).rawStatus("DONE").build());

        assertThat(persistenceService.compensateFailedPayout(payout.getId(), "late failure")).isFalse();

        assertThat(ledgerService.getBalance("c-1").getAvailable()).isEqualTo(2000);
        PayoutEntity stored = payoutRepository.findById(payout.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(PayoutStatus.COMPLETED);
        assertThat(stored.getExternalTransferId()).isEqualTo("tr-1");
    }

    @Test
    void inFlightTransferKeepsPayoutProcessingUntilMarkedCompleted() {
        PayoutEntity payout = persistenceService.openPayout("c-1", new PayoutQuote(3000, 199, 2801));
        PayoutEntity recorded = persistenceService.recordTransfer(payout.getId(), TransferResult.builder()
                .id("tr-2").status(TransferStatus.BANK_PROCESSING).rawStatus("BANK_PROCESSING").build());

        assertThat(recorded.getStatus()).isEqualTo(PayoutStatus.PROCESSING);
        assertThat(recorded.getProcessedAt()).isNull();

        assertThat(persistenceService.markCompleted(payout.getId())).isTrue();
        assertThat(persistenceService.markCompleted(payout.getId())).isFalse();
        assertThat(payoutRepository.findById(payout.getId()).orElseThrow().getStatus())
                .isEqualTo(PayoutStatus.COMPLETED);
    }
}
