package com.creator.settlement.api;

import com.creator.settlement.persistence.entity.CreatorEntity;
import lombok.Value;

/**
 * Payout block state of a creator after a block change.
 */
@Value
public class CreatorPayoutStateDto {

    String creatorId;
    boolean payoutsBlocked;
    String payoutBlockReason;
    int chargebackCount;

    public static CreatorPayoutStateDto from(CreatorEntity creator) {
        return new CreatorPayoutStateDto(creator.getId(), creator.isPayoutsBlocked(),
                creator.getPayoutBlockReason(), creator.getChargebackCount());
    }
}
