package com.payment.reconciliation.messaging;

import com.payment.reconciliation.domain.PaymentStatus;

import java.util.Optional;

public enum PaymentEventType {
    PAYMENT_CREATED,
    PAYMENT_SUCCEEDED,
    PAYMENT_CANCELED,
    PAYMENT_REFUNDED,
    PAYMENT_FAILED;

    /**
     * Event emitted when a payment enters {@code status}. Intermediate states
     * ({@code pending}, {@code waiting_for_capture}) emit nothing.
     */
    public static Optional<PaymentEventType> forStatus(PaymentStatus status) {
        switch (status) {
            case SUCCEEDED:
                return Optional.of(PAYMENT_SUCCEEDED);
            case CANCELED:
                return Optional.of(PAYMENT_CANCELED);
            case REFUNDED:
            case PARTIALLY_REFUNDED:
                return Optional.of(PAYMENT_REFUNDED);
            case FAILED:
                return Optional.of(PAYMENT_FAILED);
            default:
                return Optional.empty();
        }
    }
}
