package com.creator.settlement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the creator settlement and risk core. Provides:
 * <ul>
 *   <li>Creator balance ledger with atomic credit/debit</li>
 *   <li>Payout orchestration to PIX keys with compensation on gateway failure</li>
 *   <li>Velocity checks, identity/device risk signals and fraud flags</li>
 *   <li>Chargeback recording, escalation and penalties</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui.html</li>
 * </ul>
 */
@SpringBootApplication
public class SettlementCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(SettlementCoreApplication.class, args);
    }
}
