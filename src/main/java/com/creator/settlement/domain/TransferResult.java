package com.creator.settlement.domain;

import lombok.Builder;
import lombok.Value;

/**
 * What the settlement gateway answered for a transfer. Normalized so every gateway looks the same.
 */
@Value
@Builder
public class TransferResult {

    String id;
    TransferStatus status;
    /** Raw status string from the gateway, kept for logs and failure reasons. */
    String rawStatus;

    public boolean isSettled() {
        return status == TransferStatus.DONE;
    }

    public boolean isRejected() {
        return status == TransferStatus.CANCELLED || status == TransferStatus.FAILED;
    }
}
