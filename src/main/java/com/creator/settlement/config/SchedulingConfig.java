package com.creator.settlement.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Scheduling is only switched on together with the automatic payout sweep.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "settlement.payout.auto.enabled", havingValue = "true")
public class SchedulingConfig {
}
