package com.creator.settlement.risk.api;

import com.creator.settlement.risk.domain.DuplicateIdentity;
import lombok.Value;

import java.util.Optional;

@Value
public class DuplicateCheckResponseDto {

    boolean duplicate;
    String existingUserId;
    String existingCreatorId;

    public static DuplicateCheckResponseDto from(Optional<DuplicateIdentity> match) {
        return match
                .map(m -> new DuplicateCheckResponseDto(true, m.getUserId(), m.getCreatorId()))
                .orElseGet(() -> new DuplicateCheckResponseDto(false, null, null));
    }
}
