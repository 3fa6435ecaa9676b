package com.creator.settlement.compliance;

import com.creator.settlement.persistence.entity.ChargebackEntity;
import com.creator.settlement.persistence.entity.PayoutEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes [AUDIT] lines for every money movement and every administrative change to a creator's
 * payout rights. Log shipping keeps these lines separately from application logs.
 */
@Slf4j
@Component
public class SettlementAuditLogger {

    public void logPayoutRequested(PayoutEntity payout, String pixKey) {
        log.info("[AUDIT] PAYOUT_REQUEST payoutId={} creatorId={} gross={} fee={} net={} pixKey={}",
                payout.getId(),
                payout.getCreatorId(),
                payout.getAmount(),
                payout.getFee(),
                payout.getNetAmount(),
                SensitiveDataMasker.maskPixKey(pixKey));
    }

    public void logPayoutResult(PayoutEntity payout) {
        log.info("[AUDIT] PAYOUT_RESULT payoutId={} creatorId={} status={} transferId={} failedReason={}",
                payout.getId(),
                payout.getCreatorId(),
                payout.getStatus(),
                payout.getExternalTransferId(),
                payout.getFailedReason());
    }

    public void logChargeback(ChargebackEntity chargeback, String action) {
        log.info("[AUDIT] CHARGEBACK_{} chargebackId={} paymentId={} creatorId={} amount={} status={} penaltyApplied={}",
                action,
                chargeback.getId(),
                chargeback.getPaymentId(),
                chargeback.getCreatorId(),
                chargeback.getAmount(),
                chargeback.getStatus(),
                chargeback.isPenaltyApplied());
    }

    public void logPayoutBlockChange(String creatorId, boolean blocked, String reason, String actorId) {
        log.info("[AUDIT] PAYOUT_BLOCK creatorId={} blocked={} reason={} actor={}",
                creatorId, blocked, reason, actorId);
    }
}
