package com.creator.settlement.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class PayoutBlockRequestDto {

    @NotBlank(message = "reason is required")
    @Size(max = 255)
    private String reason;

    /** Back-office user performing the change. */
    @NotBlank(message = "actorId is required")
    private String actorId;
}
