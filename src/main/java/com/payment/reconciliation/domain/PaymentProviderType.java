package com.payment.reconciliation.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Supported payment gateways. Each type carries its wire name (used in URLs,
 * stored configs and the provider list of a tenant) and the settings fields
 * that are secrets and must be encrypted at rest.
 */
public enum PaymentProviderType {
    /** Card/aggregator with server-side idempotency keys (YooKassa API v3). */
    YOOKASSA("yookassa", "YooKassa", List.of("secretKey")),
    /** Bank acquiring gateway with token-signed requests (Tinkoff API v2). */
    TINKOFF("tinkoff", "Tinkoff", List.of("secretKey")),
    /** Redirect aggregator with MD5-signed result callbacks (Robokassa). */
    ROBOKASSA("robokassa", "Robokassa", List.of("password1", "password2", "password3", "password4")),
    /** Hosted checkout processor (Stripe Checkout Sessions). */
    STRIPE("stripe", "Stripe", List.of("secretKey", "webhookSecret")),
    /** USDT on the TRON network, matched on-chain by perturbed amount. */
    CRYPTO_TRC20("crypto_trc20", "USDT (TRC-20)", List.of("tronGridApiKey"));

    private final String wireName;
    private final String displayName;
    private final List<String> secretFields;

    PaymentProviderType(String wireName, String displayName, List<String> secretFields) {
        this.wireName = wireName;
        this.displayName = displayName;
        this.secretFields = secretFields;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getSecretFields() {
        return secretFields;
    }

    @JsonCreator
    public static PaymentProviderType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Payment provider is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (PaymentProviderType type : values()) {
            if (type.wireName.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported payment provider: " + value);
    }
}
