package com.creator.settlement.api;

import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * Request body for POST /api/v1/creators/{creatorId}/payouts. The body itself is optional.
 */
@Data
public class PayoutRequestDto {

    /** Gross amount in minor units. If null, pays out the whole available balance. */
    @Positive(message = "amount must be positive")
    private Long amount;
}
