package com.creator.settlement.api;

import com.creator.settlement.domain.ErrorKind;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps settlement errors to HTTP. Every {@link ErrorKind} has its own status; the body is
 * {@code {"error": kind, "code": reason, "message": text}}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static HttpStatus statusFor(ErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case VALIDATION_FAILED:
                return HttpStatus.BAD_REQUEST;
            case KYC_REQUIRED:
                return HttpStatus.FORBIDDEN;
            case PAYOUTS_BLOCKED:
                return HttpStatus.LOCKED;
            case RATE_LIMITED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case INSUFFICIENT_FUNDS:
                return HttpStatus.PAYMENT_REQUIRED;
            case BELOW_MINIMUM:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case EXTERNAL_GATEWAY_ERROR:
                return HttpStatus.BAD_GATEWAY;
            case INVALID_STATE:
                return HttpStatus.CONFLICT;
            case RECONCILIATION_REQUIRED:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    @ExceptionHandler(ReconciliationRequiredException.class)
    public ResponseEntity<Map<String, String>> handleReconciliation(ReconciliationRequiredException ex) {
        log.error("Payout requires manual reconciliation: payoutId={}", ex.getPayoutId(), ex);
        return body(ex.getKind(), ex.getCode(), "Payout failed and requires manual review");
    }

    @ExceptionHandler(SettlementException.class)
    public ResponseEntity<Map<String, String>> handleSettlement(SettlementException ex) {
        if (ex.getKind() == ErrorKind.EXTERNAL_GATEWAY_ERROR) {
            log.warn("Settlement gateway error: code={} message={}", ex.getCode(), ex.getMessage());
        } else {
            log.debug("Request rejected: kind={} code={} message={}", ex.getKind(), ex.getCode(), ex.getMessage());
        }
        return body(ex.getKind(), ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        e -> e.getDefaultMessage() != null ? e.getDefaultMessage() : "invalid",
                        (first, second) -> first));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ErrorKind.VALIDATION_FAILED.name());
        body.put("code", "INVALID_REQUEST");
        body.put("message", "Request validation failed");
        body.put("details", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            ConstraintViolationException.class,
            HandlerMethodValidationException.class
    })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        return body(ErrorKind.VALIDATION_FAILED, "INVALID_REQUEST", "Malformed or invalid request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "code", "INTERNAL_ERROR", "message", "Internal error"));
    }

    private static ResponseEntity<Map<String, String>> body(ErrorKind kind, String code, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", kind.name());
        body.put("code", code);
        body.put("message", message);
        return ResponseEntity.status(statusFor(kind)).body(body);
    }
}
