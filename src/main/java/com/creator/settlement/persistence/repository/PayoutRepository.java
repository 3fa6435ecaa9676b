package com.creator.settlement.persistence.repository;

import com.creator.settlement.domain.PayoutStatus;
import com.creator.settlement.persistence.entity.PayoutEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface PayoutRepository extends JpaRepository<PayoutEntity, String> {

    /** All payouts since the given instant, any status. Used by the payout velocity check. */
    long countByCreatorIdAndCreatedAtGreaterThanEqual(String creatorId, Instant since);

    /** Payouts since the given instant excluding one status. Used by the monthly limit. */
    long countByCreatorIdAndCreatedAtGreaterThanEqualAndStatusNot(String creatorId, Instant since, PayoutStatus status);

    Page<PayoutEntity> findByCreatorIdOrderByCreatedAtDesc(String creatorId, Pageable pageable);

    Page<PayoutEntity> findByCreatorIdAndStatusOrderByCreatedAtDesc(String creatorId, PayoutStatus status, Pageable pageable);

    /**
     * Moves a payout from {@code expected} to {@code target}. Returns 1 only for the caller
     * that performed the transition, which makes compensation run at most once.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PayoutEntity p SET p.status = :target, p.failedReason = :reason, p.processedAt = :processedAt, "
            + "p.updatedAt = :now WHERE p.id = :id AND p.status = :expected")
    int transition(@Param("id") String id,
                   @Param("expected") PayoutStatus expected,
                   @Param("target") PayoutStatus target,
                   @Param("reason") String reason,
                   @Param("processedAt") Instant processedAt,
                   @Param("now") Instant now);
}
