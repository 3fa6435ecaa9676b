package com.creator.settlement.persistence.repository;

import com.creator.settlement.persistence.entity.CreatorEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Creator risk state. The chargeback columns are only written through the modifying
 * queries below.
 */
@Repository
public interface CreatorRepository extends JpaRepository<CreatorEntity, String> {

    Optional<CreatorEntity> findByUserId(String userId);

    Optional<CreatorEntity> findFirstByCpfCnpjIn(Collection<String> cpfCnpj);

    Optional<CreatorEntity> findFirstByCpfCnpjInAndUserIdNot(Collection<String> cpfCnpj, String userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CreatorEntity c SET c.chargebackCount = c.chargebackCount + 1, c.updatedAt = :now WHERE c.id = :id")
    int incrementChargebackCount(@Param("id") String id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CreatorEntity c SET c.chargebackCount = "
            + "CASE WHEN c.chargebackCount > 0 THEN c.chargebackCount - 1 ELSE 0 END, c.updatedAt = :now WHERE c.id = :id")
    int decrementChargebackCount(@Param("id") String id, @Param("now") Instant now);

    /**
     * Blocks payouts once the chargeback count reaches the threshold. No-op when already blocked.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CreatorEntity c SET c.payoutsBlocked = true, c.payoutBlockReason = :reason, c.updatedAt = :now "
            + "WHERE c.id = :id AND c.payoutsBlocked = false AND c.chargebackCount >= :threshold")
    int blockPayoutsAtChargebackThreshold(@Param("id") String id,
                                          @Param("threshold") int threshold,
                                          @Param("reason") String reason,
                                          @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CreatorEntity c SET c.chargebackPenaltyBalance = c.chargebackPenaltyBalance + :amount, "
            + "c.updatedAt = :now WHERE c.id = :id")
    int addChargebackPenalty(@Param("id") String id, @Param("amount") long amount, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CreatorEntity c SET c.chargebackPenaltyBalance = "
            + "CASE WHEN c.chargebackPenaltyBalance >= :amount THEN c.chargebackPenaltyBalance - :amount ELSE 0 END, "
            + "c.updatedAt = :now WHERE c.id = :id")
    int settleChargebackPenalty(@Param("id") String id, @Param("amount") long amount, @Param("now") Instant now);
}
