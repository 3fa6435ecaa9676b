package com.creator.settlement.api;

import com.creator.settlement.core.PayoutBlockService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * Back-office block and unblock of creator payouts.
 */
@RestController
@RequestMapping("/api/v1/creators/{creatorId}/payout-block")
@RequiredArgsConstructor
@Tag(name = "Payout blocks", description = "Administrative payout blocks")
public class PayoutBlockController {

    private final PayoutBlockService payoutBlockService;

    @PostMapping
    @Operation(summary = "Block payouts", description = "Fails with 409 when payouts are already blocked.")
    public CreatorPayoutStateDto block(@PathVariable String creatorId, @Valid @RequestBody PayoutBlockRequestDto dto) {
        return CreatorPayoutStateDto.from(payoutBlockService.blockPayouts(creatorId, dto.getReason(), dto.getActorId()));
    }

    @DeleteMapping
    @Operation(summary = "Unblock payouts", description = "Fails with 409 when payouts are not blocked.")
    public CreatorPayoutStateDto unblock(@PathVariable String creatorId, @RequestParam String actorId) {
        return CreatorPayoutStateDto.from(payoutBlockService.unblockPayouts(creatorId, actorId));
    }
}
