package com.creator.settlement.messaging;

public enum SettlementEventType {
    PAYOUT_REQUESTED,
    PAYOUT_PROCESSING,
    PAYOUT_COMPLETED,
    PAYOUT_FAILED,
    CHARGEBACK_RECORDED,
    CHARGEBACK_STATUS_CHANGED,
    FRAUD_FLAG_RAISED
}
