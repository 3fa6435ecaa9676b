package com.creator.settlement.domain;

/**
 * Lifecycle of a creator payout. COMPLETED and FAILED are terminal; a FAILED payout never
 * keeps its ledger debit.
 */
public enum PayoutStatus {
    /** Recorded but not yet submitted to the settlement gateway. */
    PENDING,
    /** Ledger debited and transfer submitted (or in flight at the gateway). */
    PROCESSING,
    /** Gateway reported the transfer as settled. */
    COMPLETED,
    /** Transfer failed or was rejected; the gross amount was credited back. */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
