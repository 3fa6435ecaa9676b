package com.creator.settlement.risk.domain;

/**
 * Event stream a velocity check counts: payments made by a payer, or payouts requested by a creator.
 */
public enum VelocityKind {
    PAYMENT,
    PAYOUT
}
