package com.creator.settlement.api;

import com.creator.settlement.risk.chargeback.ChargebackResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Chargeback intake and status updates, called by the payment gateway webhook handler.
 */
@RestController
@RequestMapping("/api/v1/chargebacks")
@RequiredArgsConstructor
@Tag(name = "Chargebacks", description = "Chargeback recording and resolution")
public class ChargebackController {

    private final ChargebackResolver chargebackResolver;

    @PostMapping
    @Operation(summary = "Record chargeback",
            description = "Counts the chargeback against the creator and blocks payouts at the escalation threshold.")
    public ResponseEntity<ChargebackResponseDto> record(@Valid @RequestBody ChargebackRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ChargebackResponseDto.from(
                chargebackResolver.recordChargeback(dto.getPaymentId(), dto.getCreatorId(), dto.getAmount(),
                        dto.getExternalChargebackId())));
    }

    @PostMapping("/{chargebackId}/status")
    @Operation(summary = "Update chargeback status",
            description = "LOST charges the amount as a penalty once; WON gives back one chargeback count.")
    public ChargebackResponseDto updateStatus(@PathVariable String chargebackId,
                                              @Valid @RequestBody ChargebackStatusRequestDto dto) {
        return ChargebackResponseDto.from(chargebackResolver.updateStatus(chargebackId, dto.getStatus()));
    }

    @GetMapping("/{chargebackId}")
    @Operation(summary = "Get chargeback")
    public ChargebackResponseDto get(@PathVariable String chargebackId) {
        return ChargebackResponseDto.from(chargebackResolver.getChargeback(chargebackId));
    }
}
