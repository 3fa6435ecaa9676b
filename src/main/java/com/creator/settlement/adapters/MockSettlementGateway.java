package com.creator.settlement.adapters;

import com.creator.settlement.core.SettlementGateway;
import com.creator.settlement.core.SettlementGatewayException;
import com.creator.settlement.domain.TransferRequest;
import com.creator.settlement.domain.TransferResult;
import com.creator.settlement.domain.TransferStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory settlement gateway for local runs and demos. Transfers settle immediately, except:
 * amounts at or above {@link #REJECT_AMOUNT_THRESHOLD} come back FAILED, and a destination key of
 * {@link #TIMEOUT_KEY} throws as if the gateway timed out.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "settlement.gateway.provider", havingValue = "mock", matchIfMissing = true)
public class MockSettlementGateway implements SettlementGateway {

    static final BigDecimal REJECT_AMOUNT_THRESHOLD = new BigDecimal("50000.00");
    static final String TIMEOUT_KEY = "timeout@mock.test";

    private final Map<String, TransferResult> transfers = new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return "mock";
    }

    @Override
    public TransferResult transfer(TransferRequest request) {
        log.info("Mock gateway transfer: reference={} amount={} keyType={}",
                request.getExternalReference(), request.getAmountDecimal(), request.getDestinationKeyType());

        if (TIMEOUT_KEY.equalsIgnoreCase(request.getDestinationKey())) {
            throw new SettlementGatewayException("Simulated gateway timeout", new SocketTimeoutException("Read timed out"));
        }

        TransferStatus status = request.getAmountDecimal().compareTo(REJECT_AMOUNT_THRESHOLD) >= 0
                ? TransferStatus.FAILED
                : TransferStatus.DONE;
        TransferResult result = TransferResult.builder()
                .id("mock-tr-" + UUID.randomUUID())
                .status(status)
                .rawStatus(status.name())
                .build();
        transfers.put(result.getId(), result);
        return result;
    }

    @Override
    public TransferResult getTransfer(String transferId) {
        TransferResult result = transfers.get(transferId);
        if (result == null) {
            throw new SettlementGatewayException("Unknown transfer " + transferId, 404);
        }
        return result;
    }
}
