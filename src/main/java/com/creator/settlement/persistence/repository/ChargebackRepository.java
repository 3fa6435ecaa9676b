package com.creator.settlement.persistence.repository;

import com.creator.settlement.persistence.entity.ChargebackEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface ChargebackRepository extends JpaRepository<ChargebackEntity, String> {

    Optional<ChargebackEntity> findByExternalChargebackId(String externalChargebackId);

    /**
     * Claims the one-time penalty. Returns 1 only for the first caller.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ChargebackEntity c SET c.penaltyApplied = true, c.penaltyAmount = c.amount, c.updatedAt = :now "
            + "WHERE c.id = :id AND c.penaltyApplied = false")
    int markPenaltyApplied(@Param("id") String id, @Param("now") Instant now);
}
