package com.creator.settlement.core;

import com.creator.settlement.api.SettlementException;
import com.creator.settlement.compliance.SettlementAuditLogger;
import com.creator.settlement.persistence.entity.CreatorEntity;
import com.creator.settlement.persistence.repository.CreatorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Manual block and unblock of a creator's payouts by the back-office. Automatic blocks come from
 * the chargeback escalation and are lifted here as well.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayoutBlockService {

    private final CreatorRepository creatorRepository;
    private final SettlementAuditLogger auditLogger;

    @Transactional
    public CreatorEntity blockPayouts(String creatorId, String reason, String actorId) {
        if (reason == null || reason.isBlank()) {
            throw SettlementException.validation("BLOCK_REASON_REQUIRED", "A reason is required to block payouts");
        }
        CreatorEntity creator = creatorRepository.findById(creatorId)
                .orElseThrow(() -> SettlementException.notFound("Creator", creatorId));
        if (creator.isPayoutsBlocked()) {
            throw SettlementException.invalidState("PAYOUTS_ALREADY_BLOCKED", "Payouts are already blocked");
        }
        creator.setPayoutsBlocked(true);
        creator.setPayoutBlockReason(reason);
        CreatorEntity saved = creatorRepository.save(creator);
        log.info("Payouts blocked for creatorId={} by {}", creatorId, actorId);
        auditLogger.logPayoutBlockChange(creatorId, true, reason, actorId);
        return saved;
    }

    @Transactional
    public CreatorEntity unblockPayouts(String creatorId, String actorId) {
        CreatorEntity creator = creatorRepository.findById(creatorId)
                .orElseThrow(() -> SettlementException.notFound("Creator", creatorId));
        if (!creator.isPayoutsBlocked()) {
            throw SettlementException.invalidState("PAYOUTS_NOT_BLOCKED", "Payouts are not blocked");
        }
        String previousReason = creator.getPayoutBlockReason();
        creator.setPayoutsBlocked(false);
        creator.setPayoutBlockReason(null);
        CreatorEntity saved = creatorRepository.save(creator);
        log.info("Payouts unblocked for creatorId={} by {} (was: {})", creatorId, actorId, previousReason);
        auditLogger.logPayoutBlockChange(creatorId, false, previousReason, actorId);
        return saved;
    }
}
