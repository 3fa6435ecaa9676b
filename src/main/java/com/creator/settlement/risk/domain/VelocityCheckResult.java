package com.creator.settlement.risk.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a trailing-window count. {@code allowed} is {@code count < limit}.
 */
@Value
@Builder
public class VelocityCheckResult {

    VelocityKind kind;
    String actorId;
    boolean allowed;
    long count;
    int limit;
    int windowMinutes;
}
