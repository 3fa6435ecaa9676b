package com.creator.settlement.core;

import com.creator.settlement.api.SettlementException;
import com.creator.settlement.persistence.entity.CreatorEntity;
import com.creator.settlement.persistence.repository.CreatorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Periodic sweep that pays out the full balance of every creator who reached the minimum and
 * has a PIX key. Each creator goes through the normal payout checks; one failure does not stop
 * the sweep.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "settlement.payout.auto.enabled", havingValue = "true")
public class AutomaticPayoutJob {

    private final LedgerService ledgerService;
    private final CreatorRepository creatorRepository;
    private final PayoutOrchestrator payoutOrchestrator;

    @Value("${settlement.payout.min-amount:2000}")
    private long minPayoutAmount;

    @Scheduled(cron = "${settlement.payout.auto.cron:0 0 6 * * *}")
    public void run() {
        SweepResult result = sweep();
        log.info("Automatic payout sweep finished: candidates={} requested={} skipped={} failed={}",
                result.getCandidates(), result.getRequested(), result.getSkipped(), result.getFailed());
    }

    public SweepResult sweep() {
        List<String> creatorIds = ledgerService.findCreatorsWithAvailableAtLeast(minPayoutAmount);
        int requested = 0;
        int skipped = 0;
        int failed = 0;
        for (String creatorId : creatorIds) {
            Optional<CreatorEntity> creator = creatorRepository.findById(creatorId);
            if (creator.isEmpty() || creator.get().getPixKey() == null || creator.get().getPixKey().isBlank()) {
                skipped++;
                continue;
            }
            try {
                payoutOrchestrator.requestPayout(creatorId, null);
                requested++;
            } catch (SettlementException e) {
                log.warn("Automatic payout not requested for creatorId={}: {} ({})", creatorId, e.getCode(), e.getMessage());
                failed++;
            } catch (RuntimeException e) {
                log.error("Automatic payout failed for creatorId={}", creatorId, e);
                failed++;
            }
        }
        return new SweepResult(creatorIds.size(), requested, skipped, failed);
    }

    @lombok.Value
    public static class SweepResult {
        int candidates;
        int requested;
        int skipped;
        int failed;
    }
}
