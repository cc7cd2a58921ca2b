package com.payment.reconciliation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payment.reconciliation.messaging.PaymentDomainEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer for payment domain events, serialized as plain JSON.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${payment.kafka.max-block-ms:5000}")
    private long maxBlockMs;

    @Bean(name = "paymentEventObjectMapper")
    public ObjectMapper paymentEventObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ProducerFactory<String, PaymentDomainEvent> paymentEventProducerFactory(
            @Qualifier("paymentEventObjectMapper") ObjectMapper objectMapper) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);

        Serializer<PaymentDomainEvent> serializer = new Serializer<PaymentDomainEvent>() {
            @Override
            public byte[] serialize(String topic, PaymentDomainEvent data) {
                if (data == null) {
                    return null;
                }
                try {
                    byte[] result = objectMapper.writeValueAsBytes(data);
                    log.debug("Serialized payment event: topic={} length={} eventId={}", topic, result.length, data.getEventId());
                    return result;
                } catch (IOException e) {
                    throw new SerializationException("Failed to serialize payment event " + data.getEventId(), e);
                }
            }
        };
        log.info("Payment event producer: bootstrapServers={} maxBlockMs={}", bootstrapServers, maxBlockMs);
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), serializer);
    }

    @Bean
    public KafkaTemplate<String, PaymentDomainEvent> paymentEventKafkaTemplate(
            ProducerFactory<String, PaymentDomainEvent> paymentEventProducerFactory) {
        return new KafkaTemplate<>(paymentEventProducerFactory);
    }
}
