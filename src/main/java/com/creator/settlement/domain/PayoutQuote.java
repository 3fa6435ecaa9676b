package com.creator.settlement.domain;

import lombok.Value;

/**
 * Resolved amounts for one payout request, all in minor units. {@code gross} is debited from
 * the ledger, {@code net} is what reaches the PIX key.
 */
@Value
public class PayoutQuote {

    long gross;
    long fee;
    long net;
}
