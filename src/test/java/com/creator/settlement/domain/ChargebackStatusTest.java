package com.creator.settlement.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ChargebackStatusTest {

    @Test
    void pendingMayBeDisputedOrDecided() {
        assertThat(ChargebackStatus.PENDING.canTransitionTo(ChargebackStatus.DISPUTED)).isTrue();
        assertThat(ChargebackStatus.PENDING.canTransitionTo(ChargebackStatus.WON)).isTrue();
        assertThat(ChargebackStatus.PENDING.canTransitionTo(ChargebackStatus.LOST)).isTrue();
        assertThat(ChargebackStatus.DISPUTED.canTransitionTo(ChargebackStatus.PENDING)).isFalse();
    }

    @Test
    void finalStatusesOnlyRepeat() {
        assertThat(ChargebackStatus.WON.canTransitionTo(ChargebackStatus.WON)).isTrue();
        assertThat(ChargebackStatus.WON.canTransitionTo(ChargebackStatus.LOST)).isFalse();
        assertThat(ChargebackStatus.LOST.canTransitionTo(ChargebackStatus.DISPUTED)).isFalse();
        assertThat(ChargebackStatus.LOST.canTransitionTo(null)).isFalse();
    }
}
