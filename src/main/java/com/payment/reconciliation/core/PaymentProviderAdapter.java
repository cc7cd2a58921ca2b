package com.payment.reconciliation.core;

import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.ProviderPaymentRequest;
import com.payment.reconciliation.domain.ProviderPaymentResult;
import com.payment.reconciliation.domain.ProviderRefundRequest;
import com.payment.reconciliation.domain.ProviderRefundResult;
import com.payment.reconciliation.domain.ProviderStatusInfo;
import com.payment.reconciliation.domain.ValidationResult;
import com.payment.reconciliation.domain.WebhookData;
import com.payment.reconciliation.domain.WebhookPayload;

import java.math.BigDecimal;

/**
 * Common capability interface over a payment gateway. One instance is bound
 * to one tenant's decrypted credentials and one mode (test or live); instances
 * are built by {@link ProviderFactory} and cached by {@link ProviderAdapterCache}.
 * <p>
 * A capability the gateway does not offer fails with
 * {@link com.payment.reconciliation.domain.PaymentErrorCode#NOT_SUPPORTED}.
 */
public interface PaymentProviderAdapter {

    PaymentProviderType getType();

    boolean isTestMode();

    /**
     * Confirms the credentials work with one low-risk live call (balance or
     * account lookup). Never attempts a payment.
     */
    ValidationResult validateConfig();

    /**
     * Creates a payment. Re-submitting the same idempotency key must not create a second charge.
     */
    ProviderPaymentResult createPayment(ProviderPaymentRequest request);

    ProviderStatusInfo getPaymentStatus(String externalId);

    ProviderStatusInfo cancelPayment(String externalId);

    /**
     * Captures an authorized payment. {@code amount} may be null to capture the full authorization.
     */
    ProviderStatusInfo capturePayment(String externalId, BigDecimal amount);

    ProviderRefundResult refund(ProviderRefundRequest request);

    boolean verifyWebhookSignature(WebhookPayload payload, String signature);

    /**
     * Verifies and normalizes a notification. Fails with
     * {@code WEBHOOK_VERIFICATION_FAILED} before reading any status from an unverified payload.
     */
    WebhookData parseWebhook(WebhookPayload payload, String signature);
}
