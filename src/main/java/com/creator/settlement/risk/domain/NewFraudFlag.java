package com.creator.settlement.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Input for raising a fraud flag. Severity outside 1..5 is clamped on creation.
 */
@Value
@Builder
public class NewFraudFlag {

    String userId;
    String creatorId;
    FraudFlagType type;
    int severity;
    String description;
    Map<String, Object> metadata;
}
