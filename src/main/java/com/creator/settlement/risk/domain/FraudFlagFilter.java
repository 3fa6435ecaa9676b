package com.creator.settlement.risk.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Closed filter set for listing flags. Null fields do not filter.
 */
@Value
@Builder
public class FraudFlagFilter {

    Boolean resolved;
    FraudFlagType type;

    public static FraudFlagFilter all() {
        return FraudFlagFilter.builder().build();
    }
}
