package com.creator.settlement.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Balance plus payout terms as shown to a creator before requesting a payout.
 */
@Value
@Builder
public class BalanceSummary {

    long available;
    long pending;
    long minPayout;
    long payoutFee;
    /** What the creator would receive for a full payout right now. */
    long netAvailable;
    PayoutLimitInfo payoutLimit;
}
