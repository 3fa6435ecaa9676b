package com.creator.settlement.config;

import com.creator.settlement.messaging.SettlementEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer for {@link SettlementEvent}. JSON values so non-Java consumers (notifications,
 * back-office) can read them.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${settlement.kafka.max-block-ms:5000}")
    private long maxBlockMs;

    @Bean
    public ProducerFactory<String, SettlementEvent> settlementEventProducerFactory() {
        // Own mapper, not a bean, so Spring Boot's ObjectMapper stays in charge of HTTP JSON
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        // Bound how long send() may block a payout request when the broker is down
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);

        Serializer<SettlementEvent> serializer = (topic, data) -> {
            if (data == null) {
                return null;
            }
            try {
                return objectMapper.writeValueAsBytes(data);
            } catch (Exception e) {
                log.error("Serialization failed for topic={} eventId={}", topic, data.getEventId(), e);
                throw new SerializationException("Failed to serialize SettlementEvent", e);
            }
        };
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), serializer);
    }

    @Bean
    public KafkaTemplate<String, SettlementEvent> settlementEventKafkaTemplate(
            ProducerFactory<String, SettlementEvent> settlementEventProducerFactory) {
        return new KafkaTemplate<>(settlementEventProducerFactory);
    }
}
