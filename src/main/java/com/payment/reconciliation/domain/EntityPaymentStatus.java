package com.payment.reconciliation.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Payment status as seen by the business entity (order, booking) being paid for.
 */
public enum EntityPaymentStatus {
    NOT_REQUIRED("not_required"),
    PENDING("pending"),
    PAID("paid"),
    FAILED("failed"),
    REFUNDED("refunded"),
    PARTIALLY_REFUNDED("partially_refunded");

    private final String value;

    EntityPaymentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static EntityPaymentStatus from(PaymentStatus status) {
        switch (status) {
            case SUCCEEDED:
                return PAID;
            case CANCELED:
            case FAILED:
                return FAILED;
            case REFUNDED:
                return REFUNDED;
            case PARTIALLY_REFUNDED:
                return PARTIALLY_REFUNDED;
            case PENDING:
            case WAITING_FOR_CAPTURE:
            default:
                return PENDING;
        }
    }
}
