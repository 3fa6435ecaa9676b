package com.creator.settlement.api;

import com.creator.settlement.domain.ErrorKind;

/**
 * Thrown when a payout's ledger state could not be made consistent automatically: the
 * compensating credit failed, or a settled transfer could not be recorded. Operators must
 * reconcile the payout by hand; handler returns HTTP 500.
 */
public class ReconciliationRequiredException extends SettlementException {

    private final String payoutId;

    public ReconciliationRequiredException(String payoutId, String message, Throwable cause) {
        super(ErrorKind.RECONCILIATION_REQUIRED, "RECONCILIATION_REQUIRED", message, cause);
        this.payoutId = payoutId;
    }

    public String getPayoutId() {
        return payoutId;
    }
}
