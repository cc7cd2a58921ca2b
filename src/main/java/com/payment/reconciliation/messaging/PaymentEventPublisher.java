package com.payment.reconciliation.messaging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound channel for payment events: the Kafka topic plus every registered
 * {@link PaymentEventListener}. Only called once a state change is committed.
 */
@Slf4j
@Component
public class PaymentEventPublisher {

    private final KafkaTemplate<String, PaymentDomainEvent> kafkaTemplate;
    private final List<PaymentEventListener> listeners;

    @Value("${payment.kafka.topic.payment-events:payment-events}")
    private String topic = "payment-events";

    public PaymentEventPublisher(KafkaTemplate<String, PaymentDomainEvent> kafkaTemplate,
                                 List<PaymentEventListener> listeners) {
        this.kafkaTemplate = kafkaTemplate;
        this.listeners = listeners;
    }

    public void publish(PaymentDomainEvent event) {
        log.info("Publishing payment event: eventId={} type={} paymentId={} status={}",
                event.getEventId(), event.getEventType(), event.getPaymentId(), event.getStatus());
        send(event);
        for (PaymentEventListener listener : listeners) {
            try {
                listener.onPaymentEvent(event);
            } catch (RuntimeException e) {
                log.error("Payment event listener failed: listener={} eventId={}",
                        listener.getClass().getSimpleName(), event.getEventId(), e);
            }
        }
    }

    private void send(PaymentDomainEvent event) {
        CompletableFuture<SendResult<String, PaymentDomainEvent>> future;
        try {
            future = kafkaTemplate.send(topic, event.getPaymentId(), event);
        } catch (RuntimeException e) {
            log.error("Failed to publish payment event: eventId={} paymentId={}", event.getEventId(), event.getPaymentId(), e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish payment event: eventId={} paymentId={}",
                        event.getEventId(), event.getPaymentId(), ex);
            } else {
                log.debug("Published payment event: eventId={} partition={} offset={}",
                        event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}
