package com.creator.settlement.risk.velocity;

import com.creator.settlement.api.SettlementException;
import com.creator.settlement.persistence.repository.CreatorRepository;
import com.creator.settlement.persistence.repository.PaymentRepository;
import com.creator.settlement.persistence.repository.PayoutRepository;
import com.creator.settlement.risk.domain.VelocityCheckResult;
import com.creator.settlement.risk.domain.VelocityKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

/**
 * How many payments (by payer) or payouts (by creator) has this actor made in the trailing window?
 * <p>
 * Read-count-then-decide: nothing is reserved, so two requests racing inside the same window can
 * both see a count under the limit. Payout requests are additionally serialized per creator by
 * {@link com.creator.settlement.core.PayoutLockService}; payments are not.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VelocityGuard {

    private final PaymentRepository paymentRepository;
    private final PayoutRepository payoutRepository;
    private final CreatorRepository creatorRepository;

    /**
     * @param actorId payer user id for PAYMENT, the creator's user id for PAYOUT
     */
    @Transactional(readOnly = true)
    public VelocityCheckResult checkVelocity(VelocityKind kind, String actorId, int windowMinutes, int limit) {
        if (kind == null || windowMinutes <= 0 || limit <= 0) {
            throw SettlementException.validation("INVALID_VELOCITY_WINDOW",
                    "Velocity kind is required and window and limit must be positive");
        }
        Instant since = Instant.now().minus(Duration.ofMinutes(windowMinutes));
        long count;
        if (kind == VelocityKind.PAYMENT) {
            count = paymentRepository.countByPayerIdAndCreatedAtGreaterThanEqual(actorId, since);
        } else {
            count = creatorRepository.findByUserId(actorId)
                    .map(creator -> payoutRepository.countByCreatorIdAndCreatedAtGreaterThanEqual(creator.getId(), since))
                    .orElse(0L);
        }
        boolean allowed = count < limit;
        if (!allowed) {
            log.warn("Velocity exceeded: kind={} actorId={} count={} limit={} windowMinutes={}",
                    kind, actorId, count, limit, windowMinutes);
        }
        return VelocityCheckResult.builder()
                .kind(kind)
                .actorId(actorId)
                .allowed(allowed)
                .count(count)
                .limit(limit)
                .windowMinutes(windowMinutes)
                .build();
    }
}
