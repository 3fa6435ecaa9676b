package com.creator.settlement.api;

import com.creator.settlement.domain.ChargebackStatus;
import com.creator.settlement.persistence.entity.ChargebackEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ChargebackResponseDto {

    String id;
    String paymentId;
    String creatorId;
    long amount;
    ChargebackStatus status;
    String externalChargebackId;
    Long penaltyAmount;
    boolean penaltyApplied;
    Instant createdAt;
    Instant updatedAt;

    public static ChargebackResponseDto from(ChargebackEntity chargeback) {
        return ChargebackResponseDto.builder()
                .id(chargeback.getId())
                .paymentId(chargeback.getPaymentId())
                .creatorId(chargeback.getCreatorId())
                .amount(chargeback.getAmount())
                .status(chargeback.getStatus())
                .externalChargebackId(chargeback.getExternalChargebackId())
                .penaltyAmount(chargeback.getPenaltyAmount())
                .penaltyApplied(chargeback.isPenaltyApplied())
                .createdAt(chargeback.getCreatedAt())
                .updatedAt(chargeback.getUpdatedAt())
                .build();
    }
}
