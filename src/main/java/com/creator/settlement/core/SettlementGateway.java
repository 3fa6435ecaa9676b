package com.creator.settlement.core;

import com.creator.settlement.domain.TransferRequest;
import com.creator.settlement.domain.TransferResult;

/**
 * External service that moves money to a creator's PIX key. Implementations are blocking,
 * do not retry, and signal failure either by throwing or by returning a rejected status.
 */
public interface SettlementGateway {

    /** Name used in logs. */
    String getName();

    TransferResult transfer(TransferRequest request);

    /** Current state of a previously submitted transfer. */
    TransferResult getTransfer(String transferId);
}
