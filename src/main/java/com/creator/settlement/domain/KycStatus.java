package com.creator.settlement.domain;

/**
 * Identity verification state of a creator. Only APPROVED creators may request payouts.
 */
public enum KycStatus {
    NONE,
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED
}
