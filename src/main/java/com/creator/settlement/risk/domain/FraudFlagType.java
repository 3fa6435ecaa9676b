package com.creator.settlement.risk.domain;

public enum FraudFlagType {
    DUPLICATE_IDENTITY,
    VELOCITY_PAYMENT,
    VELOCITY_PAYOUT,
    SUSPICIOUS_PATTERN,
    CHARGEBACK,
    DEVICE_FINGERPRINT
}
