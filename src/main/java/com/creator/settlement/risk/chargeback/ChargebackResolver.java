package com.creator.settlement.risk.chargeback;

import com.creator.settlement.api.SettlementException;
import com.creator.settlement.compliance.SettlementAuditLogger;
import com.creator.settlement.core.LedgerService;
import com.creator.settlement.domain.ChargebackStatus;
import com.creator.settlement.messaging.SettlementEventProducer;
import com.creator.settlement.messaging.SettlementEventType;
import com.creator.settlement.persistence.entity.ChargebackEntity;
import com.creator.settlement.persistence.entity.CreatorEntity;
import com.creator.settlement.persistence.repository.ChargebackRepository;
import com.creator.settlement.persistence.repository.CreatorRepository;
import com.creator.settlement.risk.domain.FraudFlagType;
import com.creator.settlement.risk.domain.NewFraudFlag;
import com.creator.settlement.risk.flags.FraudFlagRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Records chargebacks reported by the payment gateway and drives them to a final status.
 * <p>
 * Every chargeback counts against the creator; at the block threshold payouts are blocked
 * automatically. A LOST chargeback charges its amount as a penalty exactly once, settled from
 * the available balance when it covers the amount and carried as outstanding otherwise.
 * A WON chargeback gives the count back but never lifts a block.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChargebackResolver {

    static final int CHARGEBACK_SEVERITY = 4;
    static final String BLOCK_REASON = "multiple chargebacks";

    private final ChargebackRepository chargebackRepository;
    private final CreatorRepository creatorRepository;
    private final LedgerService ledgerService;
    private final FraudFlagRegistry fraudFlagRegistry;
    private final SettlementAuditLogger auditLogger;
    private final SettlementEventProducer eventProducer;

    @Value("${settlement.chargeback.block-threshold:3}")
    private int blockThreshold;

    /**
     * @param externalChargebackId gateway id; a redelivered webhook with a known id returns the
     *                             existing chargeback without counting it again. May be null.
     */
    @Transactional
    public ChargebackEntity recordChargeback(String paymentId, String creatorId, long amount, String externalChargebackId) {
        if (amount <= 0) {
            throw SettlementException.validation("INVALID_AMOUNT", "Chargeback amount must be positive");
        }
        if (externalChargebackId != null) {
            Optional<ChargebackEntity> existing = chargebackRepository.findByExternalChargebackId(externalChargebackId);
            if (existing.isPresent()) {
                log.info("Chargeback already recorded for externalChargebackId={}, chargebackId={}",
                        externalChargebackId, existing.get().getId());
                return existing.get();
            }
        }
        CreatorEntity creator = creatorRepository.findById(creatorId)
                .orElseThrow(() -> SettlementException.notFound("Creator", creatorId));

        ChargebackEntity chargeback = chargebackRepository.save(ChargebackEntity.builder()
                .id(UUID.randomUUID().toString())
                .paymentId(paymentId)
                .creatorId(creatorId)
                .amount(amount)
                .status(ChargebackStatus.PENDING)
                .externalChargebackId(externalChargebackId)
                .build());

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("chargebackId", chargeback.getId());
        metadata.put("paymentId", paymentId);
        metadata.put("amount", amount);
        fraudFlagRegistry.raise(NewFraudFlag.builder()
                .userId(creator.getUserId())
                .creatorId(creatorId)
                .type(FraudFlagType.CHARGEBACK)
                .severity(CHARGEBACK_SEVERITY)
                .description("Chargeback received for payment " + paymentId)
                .metadata(metadata)
                .build());

        Instant now = Instant.now();
        creatorRepository.incrementChargebackCount(creatorId, now);
        if (creatorRepository.blockPayoutsAtChargebackThreshold(creatorId, blockThreshold, BLOCK_REASON, now) == 1) {
            log.warn("Payouts blocked for creatorId={}: chargeback count reached {}", creatorId, blockThreshold);
            auditLogger.logPayoutBlockChange(creatorId, true, BLOCK_REASON, "system");
        }

        log.info("Chargeback recorded: chargebackId={} paymentId={} creatorId={} amount={}",
                chargeback.getId(), paymentId, creatorId, amount);
        auditLogger.logChargeback(chargeback, "RECORDED");
        eventProducer.publishChargeback(chargeback, SettlementEventType.CHARGEBACK_RECORDED);
        return chargeback;
    }

    /**
     * Moves a chargeback along PENDING -> DISPUTED -> WON|LOST (PENDING may go straight to a final
     * status). Setting the current status again is a no-op apart from the LOST penalty, which is
     * guarded by {@code penaltyApplied}.
     */
    @Transactional
    public ChargebackEntity updateStatus(String chargebackId, ChargebackStatus newStatus) {
        if (newStatus == null) {
            throw SettlementException.validation("STATUS_REQUIRED", "Chargeback status is required");
        }
        ChargebackEntity chargeback = chargebackRepository.findById(chargebackId)
                .orElseThrow(() -> SettlementException.notFound("Chargeback", chargebackId));
        ChargebackStatus previous = chargeback.getStatus();
        if (!previous.canTransitionTo(newStatus)) {
            throw SettlementException.invalidState("INVALID_CHARGEBACK_TRANSITION",
                    "Chargeback cannot move from " + previous + " to " + newStatus);
        }

        chargeback.setStatus(newStatus);
        chargebackRepository.saveAndFlush(chargeback);

        Instant now = Instant.now();
        if (newStatus == ChargebackStatus.LOST) {
            applyPenaltyOnce(chargeback, now);
        } else if (newStatus == ChargebackStatus.WON && previous != ChargebackStatus.WON) {
            creatorRepository.decrementChargebackCount(chargeback.getCreatorId(), now);
        }

        ChargebackEntity updated = chargebackRepository.findById(chargebackId).orElse(chargeback);
        log.info("Chargeback status changed: chargebackId={} {} -> {}", chargebackId, previous, newStatus);
        if (previous != newStatus) {
            auditLogger.logChargeback(updated, "STATUS_" + newStatus);
            eventProducer.publishChargeback(updated, SettlementEventType.CHARGEBACK_STATUS_CHANGED);
        }
        return updated;
    }

    @Transactional(readOnly = true)
    public ChargebackEntity getChargeback(String chargebackId) {
        return chargebackRepository.findById(chargebackId)
                .orElseThrow(() -> SettlementException.notFound("Chargeback", chargebackId));
    }

    private void applyPenaltyOnce(ChargebackEntity chargeback, Instant now) {
        if (chargebackRepository.markPenaltyApplied(chargeback.getId(), now) == 0) {
            log.debug("Penalty already applied for chargebackId={}", chargeback.getId());
            return;
        }
        String creatorId = chargeback.getCreatorId();
        long amount = chargeback.getAmount();
        creatorRepository.addChargebackPenalty(creatorId, amount, now);
        if (ledgerService.tryDebit(creatorId, amount)) {
            creatorRepository.settleChargebackPenalty(creatorId, amount, now);
            log.info("Chargeback penalty settled from balance: chargebackId={} creatorId={} amount={}",
                    chargeback.getId(), creatorId, amount);
        } else {
            log.warn("Chargeback penalty outstanding: chargebackId={} creatorId={} amount={} (insufficient balance)",
                    chargeback.getId(), creatorId, amount);
        }
    }
}
