package com.creator.settlement.core;

/**
 * Transfer call failed at the gateway (HTTP error, timeout, unreadable response). Never shown to
 * creators; the orchestrator turns it into a compensated payout failure.
 */
public class SettlementGatewayException extends RuntimeException {

    private final int statusCode;

    public SettlementGatewayException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SettlementGatewayException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status returned by the gateway, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
