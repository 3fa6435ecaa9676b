package com.creator.settlement.adapters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Subset of the Asaas transfer resource this service reads.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AsaasTransferResponse {

    private String id;
    private BigDecimal value;
    private String status;
    private String transferDate;
    private String failReason;
}
