package com.creator.settlement.risk.domain;

import lombok.Value;

/**
 * Another account already holding a tax id. {@code creatorId} is set only when the match came
 * from the creators table.
 */
@Value
public class DuplicateIdentity {

    String userId;
    String creatorId;
}
