package com.creator.settlement.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class BalanceSnapshot {

    String creatorId;
    long available;
    long pending;
    Instant updatedAt;

    public static BalanceSnapshot empty(String creatorId) {
        return BalanceSnapshot.builder()
                .creatorId(creatorId)
                .available(0)
                .pending(0)
                .build();
    }
}
