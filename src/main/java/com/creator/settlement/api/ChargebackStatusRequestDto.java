package com.creator.settlement.api;

import com.creator.settlement.domain.ChargebackStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ChargebackStatusRequestDto {

    @NotNull(message = "status is required")
    private ChargebackStatus status;
}
