package com.payment.reconciliation.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The tenant-side party that collects money.
 */
public enum PaymentEntityType {
    SHOP("shop"),
    BOOKING_SYSTEM("booking_system"),
    CUSTOM_PAGE("custom_page"),
    BOT("bot");

    private final String value;

    PaymentEntityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Accepts both {@code booking_system} and the URL form {@code booking-system}. */
    @JsonCreator
    public static PaymentEntityType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (PaymentEntityType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + value);
    }
}
