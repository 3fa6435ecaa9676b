package com.creator.settlement.risk.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class DeviceRequestDto {

    @NotBlank(message = "userId is required")
    private String userId;

    private String userAgent;
    private String screenResolution;
    private String timezone;
    private String language;
    private String ipAddress;
}
