package com.creator.settlement.domain;

/**
 * Failure categories surfaced to callers of the settlement core. Each kind maps to a
 * distinct HTTP status in the REST layer.
 */
public enum ErrorKind {
    NOT_FOUND,
    /** Malformed input, missing settlement destination, malformed identity document. */
    VALIDATION_FAILED,
    KYC_REQUIRED,
    PAYOUTS_BLOCKED,
    /** Velocity, monthly limit or a concurrent payout for the same creator. */
    RATE_LIMITED,
    INSUFFICIENT_FUNDS,
    BELOW_MINIMUM,
    /** Transfer failed after the ledger debit; the debit was compensated. */
    EXTERNAL_GATEWAY_ERROR,
    /** Requested transition is not allowed from the entity's current state. */
    INVALID_STATE,
    /** Compensation could not be written; ledger and payout need manual reconciliation. */
    RECONCILIATION_REQUIRED
}
