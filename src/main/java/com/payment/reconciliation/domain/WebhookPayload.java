package com.payment.reconciliation.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * An inbound provider notification as received: the raw body (needed for
 * HMAC verification) and its parsed fields (JSON object or form parameters).
 */
@Value
@Builder
public class WebhookPayload {

    String rawBody;
    @Builder.Default
    Map<String, Object> fields = Collections.emptyMap();

    public String field(String name) {
        Object value = fields.get(name);
        return value != null ? String.valueOf(value) : null;
    }
}
