package com.payment.reconciliation.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a payment is for.
 */
public enum PaymentTargetType {
    ORDER("order"),
    BOOKING("booking"),
    API_CALL("api_call"),
    FLOW_PAYMENT("flow_payment"),
    CUSTOM("custom");

    private final String value;

    PaymentTargetType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PaymentTargetType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Target type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (PaymentTargetType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown target type: " + value);
    }
}
