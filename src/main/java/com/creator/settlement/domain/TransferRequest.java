package com.creator.settlement.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Instruction sent to the settlement gateway. The amount is the net payout in major units
 * (reais), the reference is the payout id so gateway callbacks can be matched.
 */
@Value
@Builder
public class TransferRequest {

    BigDecimal amountDecimal;
    String destinationKey;
    PixKeyType destinationKeyType;
    String description;
    String externalReference;
}
