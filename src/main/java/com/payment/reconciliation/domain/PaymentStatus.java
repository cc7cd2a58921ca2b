package com.payment.reconciliation.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a payment. Transitions only move forward:
 * pending → waiting_for_capture → succeeded → partially_refunded → refunded,
 * with canceled and failed as terminal exits before success.
 */
public enum PaymentStatus {
    PENDING("pending"),
    WAITING_FOR_CAPTURE("waiting_for_capture"),
    SUCCEEDED("succeeded"),
    CANCELED("canceled"),
    REFUNDED("refunded"),
    PARTIALLY_REFUNDED("partially_refunded"),
    FAILED("failed");

    private final String value;

    PaymentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether a payment currently in this status may move to {@code target}.
     * Re-entering the same status is not a transition and returns false.
     */
    public boolean canTransitionTo(PaymentStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    /** Statuses a payment can be canceled from. */
    public boolean isCancelable() {
        return this == PENDING || this == WAITING_FOR_CAPTURE;
    }

    /** Statuses that still hold money that can be returned. */
    public boolean isRefundable() {
        return this == SUCCEEDED || this == PARTIALLY_REFUNDED;
    }

    private Set<PaymentStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(WAITING_FOR_CAPTURE, SUCCEEDED, CANCELED, FAILED);
            case WAITING_FOR_CAPTURE:
                return EnumSet.of(SUCCEEDED, CANCELED, FAILED);
            case SUCCEEDED:
                return EnumSet.of(PARTIALLY_REFUNDED, REFUNDED);
            case PARTIALLY_REFUNDED:
                return EnumSet.of(REFUNDED);
            default:
                return EnumSet.noneOf(PaymentStatus.class);
        }
    }

    @JsonCreator
    public static PaymentStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PaymentStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown payment status: " + value);
    }
}
