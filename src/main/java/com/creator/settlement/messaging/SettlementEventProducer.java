package com.creator.settlement.messaging;

import com.creator.settlement.persistence.entity.ChargebackEntity;
import com.creator.settlement.persistence.entity.FraudFlagEntity;
import com.creator.settlement.persistence.entity.PayoutEntity;
import com.creator.settlement.domain.PayoutStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes settlement events keyed by creator id so consumers see one creator's events in order.
 * Publishing is best-effort: a broker outage is logged and never fails the operation that
 * produced the event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettlementEventProducer {

    private final KafkaTemplate<String, SettlementEvent> kafkaTemplate;

    @Value("${settlement.kafka.topic.settlement-events:settlement-events}")
    private String topic;

    public void publishPayoutRequested(PayoutEntity payout) {
        publish(payoutEvent(SettlementEventType.PAYOUT_REQUESTED, payout));
    }

    public void publishPayoutResult(PayoutEntity payout) {
        SettlementEventType type;
        if (payout.getStatus() == PayoutStatus.COMPLETED) {
            type = SettlementEventType.PAYOUT_COMPLETED;
        } else if (payout.getStatus() == PayoutStatus.FAILED) {
            type = SettlementEventType.PAYOUT_FAILED;
        } else {
            type = SettlementEventType.PAYOUT_PROCESSING;
        }
        publish(payoutEvent(type, payout));
    }

    public void publishChargeback(ChargebackEntity chargeback, SettlementEventType type) {
        publish(SettlementEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(type)
                .creatorId(chargeback.getCreatorId())
                .aggregateId(chargeback.getId())
                .status(chargeback.getStatus().name())
                .amount(chargeback.getAmount())
                .timestamp(Instant.now())
                .build());
    }

    public void publishFraudFlag(FraudFlagEntity flag) {
        publish(SettlementEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(SettlementEventType.FRAUD_FLAG_RAISED)
                .creatorId(flag.getCreatorId())
                .aggregateId(flag.getId())
                .status(flag.getType().name())
                .reason(flag.getDescription())
                .timestamp(Instant.now())
                .build());
    }

    private SettlementEvent payoutEvent(SettlementEventType type, PayoutEntity payout) {
        return SettlementEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(type)
                .creatorId(payout.getCreatorId())
                .aggregateId(payout.getId())
                .status(payout.getStatus().name())
                .amount(payout.getAmount())
                .reason(payout.getFailedReason())
                .timestamp(Instant.now())
                .build();
    }

    private void publish(SettlementEvent event) {
        String key = event.getCreatorId() != null ? event.getCreatorId() : event.getAggregateId();
        log.debug("Publishing settlement event: key={}, eventId={}, type={}", key, event.getEventId(), event.getEventType());
        try {
            CompletableFuture<SendResult<String, SettlementEvent>> future = kafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish settlement event key={} eventId={} type={}",
                            key, event.getEventId(), event.getEventType(), ex);
                } else {
                    log.debug("Published settlement event eventId={} partition={} offset={}",
                            event.getEventId(),
                            result != null ? result.getRecordMetadata().partition() : null,
                            result != null ? result.getRecordMetadata().offset() : null);
                }
            });
        } catch (RuntimeException e) {
            // send() throws synchronously when metadata cannot be fetched within max.block.ms
            log.error("Kafka unavailable, dropping settlement event eventId={} type={}",
                    event.getEventId(), event.getEventType(), e);
        }
    }
}
