package com.creator.settlement;

import com.creator.settlement.adapters.MockSettlementGateway;
import com.creator.settlement.core.AutomaticPayoutJob;
import com.creator.settlement.core.LedgerService;
import com.creator.settlement.core.PayoutOrchestrator;
import com.creator.settlement.core.SettlementGateway;
import com.creator.settlement.risk.chargeback.ChargebackResolver;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full application context on H2. Redis is mocked; the Kafka producer only connects on the first
 * send, so no broker is needed.
 */
@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:settlement-context;DB_CLOSE_DELAY=-1",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
class SettlementCoreApplicationTests {

    @MockitoBean
    private StringRedisTemplate redisTemplate;

    @Autowired
    private ApplicationContext context;

    @Autowired
    private SettlementGateway settlementGateway;

    @Autowired
    private LedgerService ledgerService;

    @Test
    void contextLoadsWithMockGatewayAndNoSweep() {
        assertThat(settlementGateway).isInstanceOf(MockSettlementGateway.class);
        assertThat(context.getBean(PayoutOrchestrator.class)).isNotNull();
        assertThat(context.getBean(ChargebackResolver.class)).isNotNull();
        assertThat(context.getBean(CircuitBreakerRegistry.class).circuitBreaker("settlement-gateway")
                .getCircuitBreakerConfig().getMinimumNumberOfCalls()).isEqualTo(10);
        assertThat(context.getBeansOfType(AutomaticPayoutJob.class)).isEmpty();
    }

    @Test
    void ledgerWorksAgainstEmbeddedDatabase() {
        ledgerService.openBalance("c-context");
        ledgerService.credit("c-context", 2500);

        assertThat(ledgerService.tryDebit("c-context", 3000)).isFalse();
        assertThat(ledgerService.tryDebit("c-context", 2000)).isTrue();
        assertThat(ledgerService.getBalance("c-context").getAvailable()).isEqualTo(500);
    }
}
