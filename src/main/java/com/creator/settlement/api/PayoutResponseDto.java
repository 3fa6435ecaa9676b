package com.creator.settlement.api;

import com.creator.settlement.domain.PayoutStatus;
import com.creator.settlement.persistence.entity.PayoutEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PayoutResponseDto {

    String id;
    String creatorId;
    long amount;
    long fee;
    long netAmount;
    PayoutStatus status;
    String externalTransferId;
    String failedReason;
    Instant processedAt;
    Instant createdAt;

    public static PayoutResponseDto from(PayoutEntity payout) {
        return PayoutResponseDto.builder()
                .id(payout.getId())
                .creatorId(payout.getCreatorId())
                .amount(payout.getAmount())
                .fee(payout.getFee())
                .netAmount(payout.getNetAmount())
                .status(payout.getStatus())
                .externalTransferId(payout.getExternalTransferId())
                .failedReason(payout.getFailedReason())
                .processedAt(payout.getProcessedAt())
                .createdAt(payout.getCreatedAt())
                .build();
    }
}
