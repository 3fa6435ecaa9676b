package com.creator.settlement.core;

import com.creator.settlement.api.SettlementException;
import com.creator.settlement.domain.BalanceSnapshot;
import com.creator.settlement.domain.ErrorKind;
import com.creator.settlement.persistence.entity.BalanceEntity;
import com.creator.settlement.persistence.repository.BalanceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Creator balance ledger. The only component allowed to change a balance.
 * <p>
 * Credits and debits are one conditional UPDATE each; the database checks sufficiency and
 * applies the arithmetic, so concurrent debits can never overdraw a balance. Amounts are
 * minor units and must be positive.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerService {

    private final BalanceRepository balanceRepository;

    /**
     * Creates the zero balance row for a creator. Safe to call more than once.
     * <p>
     * Not transactional: the insert runs in the repository's own transaction, so a lost
     * unique-constraint race rolls back only that insert. Inside a caller's transaction a lost race
     * still marks that transaction rollback-only.
     */
    public void openBalance(String creatorId) {
        if (balanceRepository.existsByCreatorId(creatorId)) {
            return;
        }
        try {
            balanceRepository.saveAndFlush(BalanceEntity.builder()
                    .id(UUID.randomUUID().toString())
                    .creatorId(creatorId)
                    .available(0)
                    .pending(0)
                    .build());
            log.info("Opened balance for creatorId={}", creatorId);
        } catch (DataIntegrityViolationException e) {
            // Concurrent open won the unique constraint
            log.debug("Balance already opened concurrently for creatorId={}", creatorId);
        }
    }

    @Transactional
    public void credit(String creatorId, long amount) {
        requirePositive(amount);
        int updated = balanceRepository.credit(creatorId, amount, Instant.now());
        if (updated == 0) {
            throw SettlementException.notFound("Balance", creatorId);
        }
        log.debug("Credited creatorId={} amount={}", creatorId, amount);
    }

    /**
     * Debits the balance or fails with INSUFFICIENT_FUNDS leaving it untouched.
     */
    @Transactional
    public void debit(String creatorId, long amount) {
        if (!tryDebit(creatorId, amount)) {
            if (!balanceRepository.existsByCreatorId(creatorId)) {
                throw SettlementException.notFound("Balance", creatorId);
            }
            throw new SettlementException(ErrorKind.INSUFFICIENT_FUNDS, "INSUFFICIENT_FUNDS",
                    "Insufficient available balance");
        }
    }

    /**
     * Debits the balance if it covers {@code amount}. Returns false instead of failing.
     */
    @Transactional
    public boolean tryDebit(String creatorId, long amount) {
        requirePositive(amount);
        boolean debited = balanceRepository.debitIfSufficient(creatorId, amount, Instant.now()) == 1;
        log.debug("Debit creatorId={} amount={} applied={}", creatorId, amount, debited);
        return debited;
    }

    /**
     * Current balance. A creator without a balance row reads as zero.
     */
    @Transactional(readOnly = true)
    public BalanceSnapshot getBalance(String creatorId) {
        return balanceRepository.findByCreatorId(creatorId)
                .map(b -> BalanceSnapshot.builder()
                        .creatorId(b.getCreatorId())
                        .available(b.getAvailable())
                        .pending(b.getPending())
                        .updatedAt(b.getUpdatedAt())
                        .build())
                .orElseGet(() -> BalanceSnapshot.empty(creatorId));
    }

    @Transactional(readOnly = true)
    public List<String> findCreatorsWithAvailableAtLeast(long minimum) {
        return balanceRepository.findCreatorIdsWithAvailableAtLeast(minimum);
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw SettlementException.validation("INVALID_AMOUNT", "Amount must be positive");
        }
    }
}
