package com.creator.settlement.api;

import com.creator.settlement.domain.ErrorKind;

/**
 * Failure raised by the settlement core. {@link #getKind()} drives the HTTP status and
 * {@link #getCode()} is a stable machine-readable reason (e.g. MONTHLY_LIMIT_REACHED).
 */
public class SettlementException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    public SettlementException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public SettlementException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public static SettlementException notFound(String resource, String id) {
        return new SettlementException(ErrorKind.NOT_FOUND, resource.toUpperCase().replace(' ', '_') + "_NOT_FOUND",
                resource + " not found: " + id);
    }

    public static SettlementException validation(String code, String message) {
        return new SettlementException(ErrorKind.VALIDATION_FAILED, code, message);
    }

    public static SettlementException invalidState(String code, String message) {
        return new SettlementException(ErrorKind.INVALID_STATE, code, message);
    }
}
