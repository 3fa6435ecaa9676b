package com.creator.settlement.risk.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Browser signals a fingerprint is derived from. Property order is part of the fingerprint,
 * so it is pinned; absent fields are left out of the hashed JSON.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"userAgent", "screenResolution", "timezone", "language", "ipAddress"})
public class DeviceSignals {

    String userAgent;
    String screenResolution;
    String timezone;
    String language;
    String ipAddress;
}
