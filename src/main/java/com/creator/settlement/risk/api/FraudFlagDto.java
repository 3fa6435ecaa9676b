package com.creator.settlement.risk.api;

import com.creator.settlement.persistence.entity.FraudFlagEntity;
import com.creator.settlement.risk.domain.FraudFlagType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class FraudFlagDto {

    String id;
    String userId;
    String creatorId;
    FraudFlagType type;
    int severity;
    String description;
    Map<String, Object> metadata;
    boolean resolved;
    String resolvedBy;
    String resolution;
    Instant resolvedAt;
    Instant createdAt;

    public static FraudFlagDto from(FraudFlagEntity flag) {
        return FraudFlagDto.builder()
                .id(flag.getId())
                .userId(flag.getUserId())
                .creatorId(flag.getCreatorId())
                .type(flag.getType())
                .severity(flag.getSeverity())
                .description(flag.getDescription())
                .metadata(flag.getMetadata())
                .resolved(flag.isResolved())
                .resolvedBy(flag.getResolvedBy())
                .resolution(flag.getResolution())
                .resolvedAt(flag.getResolvedAt())
                .createdAt(flag.getCreatedAt())
                .build();
    }
}
