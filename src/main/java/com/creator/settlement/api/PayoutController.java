package com.creator.settlement.api;

import com.creator.settlement.core.PayoutOrchestrator;
import com.creator.settlement.domain.BalanceSummary;
import com.creator.settlement.domain.PayoutStatus;
import com.creator.settlement.persistence.entity.PayoutEntity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for creator balances and payouts.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Payouts", description = "Creator balance and PIX payouts")
public class PayoutController {

    private final PayoutOrchestrator payoutOrchestrator;

    @PostMapping("/creators/{creatorId}/payouts")
    @Operation(
            summary = "Request payout",
            description = "Pays out the given gross amount (minor units) or, without an amount, the whole available balance. "
                    + "A fixed fee is deducted from the transferred amount. Returns the payout as COMPLETED when the gateway "
                    + "settled immediately, otherwise PROCESSING.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Payout created"),
            @ApiResponse(responseCode = "400", description = "Invalid amount or no PIX key configured"),
            @ApiResponse(responseCode = "402", description = "Amount exceeds the available balance"),
            @ApiResponse(responseCode = "403", description = "KYC not approved"),
            @ApiResponse(responseCode = "404", description = "Creator not found"),
            @ApiResponse(responseCode = "422", description = "Below the minimum payout or net amount"),
            @ApiResponse(responseCode = "423", description = "Payouts blocked for this creator"),
            @ApiResponse(responseCode = "429", description = "Velocity exceeded, monthly limit reached or payout already in progress"),
            @ApiResponse(responseCode = "502", description = "Transfer failed; the debited amount was returned to the balance")
    })
    public ResponseEntity<PayoutResponseDto> requestPayout(@PathVariable String creatorId,
                                                           @Valid @RequestBody(required = false) PayoutRequestDto dto) {
        Long amount = dto != null ? dto.getAmount() : null;
        PayoutEntity payout = payoutOrchestrator.requestPayout(creatorId, amount);
        return ResponseEntity.status(HttpStatus.CREATED).body(PayoutResponseDto.from(payout));
    }

    @GetMapping("/creators/{creatorId}/balance")
    @Operation(summary = "Balance summary", description = "Available and pending balance with payout fee, minimum and monthly allowance.")
    public BalanceSummary getBalance(@PathVariable String creatorId) {
        return payoutOrchestrator.getBalanceSummary(creatorId);
    }

    @GetMapping("/creators/{creatorId}/payouts")
    @Operation(summary = "List payouts", description = "Newest first, optionally filtered by status.")
    public PageDto<PayoutResponseDto> listPayouts(@PathVariable String creatorId,
                                                  @RequestParam(required = false) PayoutStatus status,
                                                  @RequestParam(defaultValue = "0") @Min(0) int page,
                                                  @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return PageDto.from(payoutOrchestrator.listPayouts(creatorId, status, PageRequest.of(page, size)),
                PayoutResponseDto::from);
    }

    @GetMapping("/payouts/{payoutId}")
    @Operation(summary = "Get payout")
    public PayoutResponseDto getPayout(@PathVariable String payoutId) {
        return PayoutResponseDto.from(payoutOrchestrator.getPayout(payoutId));
    }

    @PostMapping("/payouts/{payoutId}/reconcile")
    @Operation(
            summary = "Reconcile payout",
            description = "Queries the gateway for a PROCESSING payout's transfer. DONE completes the payout; "
                    + "CANCELLED or FAILED marks it FAILED and returns the funds. Other payouts are returned unchanged.")
    public PayoutResponseDto reconcile(@PathVariable String payoutId) {
        log.info("Reconcile requested for payoutId={}", payoutId);
        return PayoutResponseDto.from(payoutOrchestrator.reconcile(payoutId));
    }
}
