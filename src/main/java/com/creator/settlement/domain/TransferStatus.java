package com.creator.settlement.domain;

import java.util.Locale;

/**
 * Normalized transfer states reported by a settlement gateway.
 */
public enum TransferStatus {
    PENDING,
    BANK_PROCESSING,
    /** Funds settled at the destination key. */
    DONE,
    CANCELLED,
    FAILED;

    /**
     * Maps a raw gateway status string. Unknown values are treated as still in flight.
     */
    public static TransferStatus fromGatewayValue(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        try {
            return TransferStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }
}
