package com.creator.settlement.messaging;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Event emitted to Kafka for settlement lifecycle changes. Consumed by notifications,
 * the back-office and analytics. {@code aggregateId} is the payout, chargeback or flag id
 * depending on {@link #eventType}.
 */
@Value
@Builder
@Jacksonized
public class SettlementEvent {

    String eventId;
    SettlementEventType eventType;
    String creatorId;
    String aggregateId;
    String status;
    /** Minor units; null for events without an amount. */
    Long amount;
    String reason;
    Instant timestamp;
}
