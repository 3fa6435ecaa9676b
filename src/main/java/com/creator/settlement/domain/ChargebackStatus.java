package com.creator.settlement.domain;

/**
 * Dispute lifecycle of a chargeback: PENDING, then optionally DISPUTED, then WON or LOST.
 * Re-applying the current status is accepted so that redelivered webhooks stay harmless.
 */
public enum ChargebackStatus {
    PENDING,
    DISPUTED,
    WON,
    LOST;

    public boolean isFinal() {
        return this == WON || this == LOST;
    }

    public boolean canTransitionTo(ChargebackStatus target) {
        if (target == null) {
            return false;
        }
        if (target == this) {
            return true;
        }
        switch (this) {
            case PENDING:
                return target == DISPUTED || target == WON || target == LOST;
            case DISPUTED:
                return target == WON || target == LOST;
            default:
                return false;
        }
    }
}
