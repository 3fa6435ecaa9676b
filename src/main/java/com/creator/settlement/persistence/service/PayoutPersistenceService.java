package com.creator.settlement.persistence.service;

import com.creator.settlement.api.SettlementException;
import com.creator.settlement.core.LedgerService;
import com.creator.settlement.domain.PayoutQuote;
import com.creator.settlement.domain.PayoutStatus;
import com.creator.settlement.domain.TransferResult;
import com.creator.settlement.persistence.entity.PayoutEntity;
import com.creator.settlement.persistence.repository.PayoutRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Local transactions of the payout saga. The gateway call sits between {@link #openPayout} and
 * either {@link #recordTransfer} or {@link #compensateFailedPayout}, outside any transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayoutPersistenceService {

    private final PayoutRepository payoutRepository;
    private final LedgerService ledgerService;

    /**
     * Inserts the PROCESSING payout and debits the gross amount in one transaction. A failed
     * debit rolls the insert back, so no payout row exists without its debit.
     */
    @Transactional
    public PayoutEntity openPayout(String creatorId, PayoutQuote quote) {
        PayoutEntity payout = payoutRepository.save(PayoutEntity.builder()
                .id(UUID.randomUUID().toString())
                .creatorId(creatorId)
                .amount(quote.getGross())
                .fee(quote.getFee())
                .netAmount(quote.getNet())
                .status(PayoutStatus.PROCESSING)
                .build());
        ledgerService.debit(creatorId, quote.getGross());
        log.info("Opened payout payoutId={} creatorId={} gross={} net={}",
                payout.getId(), creatorId, quote.getGross(), quote.getNet());
        return payout;
    }

    /**
     * Stores the gateway transfer id; completes the payout when the gateway already settled it.
     */
    @Transactional
    public PayoutEntity recordTransfer(String payoutId, TransferResult transfer) {
        PayoutEntity payout = payoutRepository.findById(payoutId)
                .orElseThrow(() -> SettlementException.notFound("Payout", payoutId));
        payout.setExternalTransferId(transfer.getId());
        if (transfer.isSettled()) {
            payout.setStatus(PayoutStatus.COMPLETED);
            payout.setProcessedAt(Instant.now());
        }
        return payoutRepository.save(payout);
    }

    /**
     * Marks a PROCESSING payout COMPLETED. Returns false when it was no longer PROCESSING.
     */
    @Transactional
    public boolean markCompleted(String payoutId) {
        Instant now = Instant.now();
        return payoutRepository.transition(payoutId, PayoutStatus.PROCESSING, PayoutStatus.COMPLETED,
                null, now, now) == 1;
    }

    /**
     * Compensation step: moves the payout PROCESSING -> FAILED and credits the full gross back,
     * atomically. Only the caller that wins the status transition credits, so running this twice
     * credits once. Returns whether this call performed the compensation.
     */
    @Transactional
    public boolean compensateFailedPayout(String payoutId, String reason) {
        PayoutEntity payout = payoutRepository.findById(payoutId)
                .orElseThrow(() -> SettlementException.notFound("Payout", payoutId));
        Instant now = Instant.now();
        int transitioned = payoutRepository.transition(payoutId, PayoutStatus.PROCESSING, PayoutStatus.FAILED,
                truncate(reason), now, now);
        if (transitioned == 0) {
            log.warn("Payout payoutId={} no longer PROCESSING (status={}), skipping compensation",
                    payoutId, payout.getStatus());
            return false;
        }
        ledgerService.credit(payout.getCreatorId(), payout.getAmount());
        log.info("Compensated payout payoutId={} creatorId={} credited={}",
                payoutId, payout.getCreatorId(), payout.getAmount());
        return true;
    }

    @Transactional(readOnly = true)
    public PayoutEntity getPayout(String payoutId) {
        return payoutRepository.findById(payoutId)
                .orElseThrow(() -> SettlementException.notFound("Payout", payoutId));
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return "unknown";
        }
        return reason.length() > 500 ? reason.substring(0, 500) : reason;
    }
}
