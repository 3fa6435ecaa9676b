package com.creator.settlement.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Usage of the trailing 30-day payout allowance. FAILED payouts do not count.
 */
@Value
@Builder
public class PayoutLimitInfo {

    long used;
    int limit;
    long remaining;
    boolean pro;
}
