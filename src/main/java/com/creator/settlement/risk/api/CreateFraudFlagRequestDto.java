package com.creator.settlement.risk.api;

import com.creator.settlement.risk.domain.FraudFlagType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.Map;

/**
 * Manual flag raised from the back-office. Severity outside 1..5 is clamped, not rejected.
 */
@Data
public class CreateFraudFlagRequestDto {

    private String userId;

    private String creatorId;

    @NotNull(message = "type is required")
    private FraudFlagType type;

    private int severity = 3;

    @Size(max = 1000)
    private String description;

    private Map<String, Object> metadata;
}
