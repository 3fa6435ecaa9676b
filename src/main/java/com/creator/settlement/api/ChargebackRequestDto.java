package com.creator.settlement.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * Chargeback notification forwarded by the payment gateway webhook handler.
 */
@Data
public class ChargebackRequestDto {

    @NotBlank(message = "paymentId is required")
    private String paymentId;

    @NotBlank(message = "creatorId is required")
    private String creatorId;

    /** Minor units. */
    @NotNull(message = "amount is required")
    @Positive(message = "amount must be positive")
    private Long amount;

    /** Gateway chargeback id; redeliveries with the same id are recorded once. */
    private String externalChargebackId;
}
