package com.creator.settlement.risk.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ResolveFraudFlagRequestDto {

    @NotBlank(message = "resolverId is required")
    private String resolverId;

    @NotBlank(message = "resolution is required")
    private String resolution;
}
