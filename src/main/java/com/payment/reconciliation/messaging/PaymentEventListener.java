package com.payment.reconciliation.messaging;

/**
 * In-process subscriber to committed payment events. Called synchronously
 * after the Kafka send is initiated; a failing listener does not affect the
 * others or the caller.
 */
public interface PaymentEventListener {

    void onPaymentEvent(PaymentDomainEvent event);
}
