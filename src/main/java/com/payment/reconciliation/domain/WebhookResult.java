package com.payment.reconciliation.domain;

import lombok.Value;

/**
 * What handling one notification did, plus the body the provider expects back.
 */
@Value
public class WebhookResult {

    /** Body to return to the provider; null means the default JSON acknowledgment. */
    String acknowledgment;
    String paymentId;
    PaymentStatus status;
    boolean applied;

    public static WebhookResult ignored(String acknowledgment) {
        return new WebhookResult(acknowledgment, null, null, false);
    }
}
