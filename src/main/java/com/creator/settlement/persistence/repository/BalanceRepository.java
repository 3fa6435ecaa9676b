package com.creator.settlement.persistence.repository;

import com.creator.settlement.persistence.entity.BalanceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Balance rows. Mutations are single conditional UPDATE statements; callers decide success
 * from the affected-row count, never by reading the balance first.
 */
@Repository
public interface BalanceRepository extends JpaRepository<BalanceEntity, String> {

    Optional<BalanceEntity> findByCreatorId(String creatorId);

    boolean existsByCreatorId(String creatorId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BalanceEntity b SET b.available = b.available + :amount, b.updatedAt = :now "
            + "WHERE b.creatorId = :creatorId")
    int credit(@Param("creatorId") String creatorId, @Param("amount") long amount, @Param("now") Instant now);

    /**
     * Returns 0 when the row is missing or {@code available < amount}.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BalanceEntity b SET b.available = b.available - :amount, b.updatedAt = :now "
            + "WHERE b.creatorId = :creatorId AND b.available >= :amount")
    int debitIfSufficient(@Param("creatorId") String creatorId, @Param("amount") long amount, @Param("now") Instant now);

    @Query("SELECT b.creatorId FROM BalanceEntity b WHERE b.available >= :minimum ORDER BY b.available DESC")
    List<String> findCreatorIdsWithAvailableAtLeast(@Param("minimum") long minimum);
}
