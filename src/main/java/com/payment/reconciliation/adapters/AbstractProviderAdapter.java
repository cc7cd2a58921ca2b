package com.payment.reconciliation.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.reconciliation.compliance.LogRedactor;
import com.payment.reconciliation.core.PaymentProviderAdapter;
import com.payment.reconciliation.core.ProviderCallExecutor;
import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.PaymentStatus;
import com.payment.reconciliation.domain.ProviderStatusInfo;
import com.payment.reconciliation.domain.WebhookData;
import com.payment.reconciliation.domain.WebhookPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Shared scaffolding for provider adapters: HTTP exchange, error translation
 * into {@link PaymentException}, retry and circuit breaking via
 * {@link ProviderCallExecutor}, and redacted error logging.
 * Concrete adapters supply request mapping and their status tables.
 */
@Slf4j
public abstract class AbstractProviderAdapter implements PaymentProviderAdapter {

    protected final RestTemplate restTemplate;
    protected final ProviderCallExecutor callExecutor;
    protected final boolean testMode;

    protected AbstractProviderAdapter(RestTemplate restTemplate, ProviderCallExecutor callExecutor, boolean testMode) {
        this.restTemplate = restTemplate;
        this.callExecutor = callExecutor;
        this.testMode = testMode;
    }

    @Override
    public boolean isTestMode() {
        return testMode;
    }

    /**
     * Default for gateways whose notifications carry no verifiable signature:
     * anything not explicitly verified is rejected.
     */
    @Override
    public boolean verifyWebhookSignature(WebhookPayload payload, String signature) {
        return false;
    }

    @Override
    public WebhookData parseWebhook(WebhookPayload payload, String signature) {
        throw PaymentException.notSupported(getType(), "Webhooks");
    }

    @Override
    public ProviderStatusInfo capturePayment(String externalId, BigDecimal amount) {
        throw PaymentException.notSupported(getType(), "Capture");
    }

    /**
     * Runs a provider call with error translation inside the retry loop, so
     * the retry policy sees typed, classified failures.
     */
    protected <T> T call(String operation, Supplier<T> supplier) {
        return callExecutor.execute(getType(), operation, () -> {
            try {
                return supplier.get();
            } catch (RestClientException e) {
                throw translate(operation, e);
            }
        });
    }

    protected JsonNode exchange(HttpMethod method, String url, HttpHeaders headers, Object body) {
        return restTemplate.exchange(url, method, new HttpEntity<>(body, headers), JsonNode.class).getBody();
    }

    protected PaymentException translate(String operation, RestClientException e) {
        PaymentProviderType type = getType();
        if (e instanceof ResourceAccessException) {
            log.warn("Provider network error: provider={} operation={} error={}", type.getWireName(), operation, e.getMessage());
            return new PaymentException(PaymentErrorCode.NETWORK_ERROR,
                    type.getDisplayName() + " is unreachable: " + e.getMessage(), type, true, e);
        }
        if (e instanceof HttpStatusCodeException) {
            HttpStatusCodeException http = (HttpStatusCodeException) e;
            String body = http.getResponseBodyAsString();
            int status = http.getStatusCode().value();
            log.warn("Provider call failed: provider={} operation={} httpStatus={} body={}",
                    type.getWireName(), operation, status, LogRedactor.redact(body));
            PaymentException specific = classifyError(http);
            if (specific != null) {
                return specific;
            }
            String message = providerMessage(body);
            if (status == 429) {
                return new PaymentException(PaymentErrorCode.RATE_LIMIT, message, type, true, e);
            }
            if (status == 401 || status == 403) {
                return new PaymentException(PaymentErrorCode.UNAUTHORIZED, message, type, false, e);
            }
            if (status == 404) {
                return new PaymentException(PaymentErrorCode.PAYMENT_NOT_FOUND, message, type, false, e);
            }
            if (status == 402) {
                return new PaymentException(PaymentErrorCode.PAYMENT_DECLINED, message, type, false, e);
            }
            return new PaymentException(PaymentErrorCode.PROVIDER_ERROR, message, type, false, e);
        }
        log.warn("Provider call failed: provider={} operation={} error={}", type.getWireName(), operation, e.getMessage());
        return new PaymentException(PaymentErrorCode.PROVIDER_ERROR, e.getMessage(), type, false, e);
    }

    /**
     * Hook for providers whose error bodies carry a finer classification than
     * the HTTP status. Return null to fall back to status-based mapping.
     */
    protected PaymentException classifyError(HttpStatusCodeException e) {
        return null;
    }

    /** Extracts the provider's human-readable message from an error body. */
    protected String providerMessage(String body) {
        String redacted = LogRedactor.redact(body);
        return getType().getDisplayName() + " error" + (redacted != null && !redacted.isBlank() ? ": " + redacted : "");
    }

    protected PaymentException providerError(String message) {
        return new PaymentException(PaymentErrorCode.PROVIDER_ERROR, message, getType());
    }

    protected PaymentException verificationFailed() {
        log.warn("Webhook signature verification failed: provider={}", getType().getWireName());
        return new PaymentException(PaymentErrorCode.WEBHOOK_VERIFICATION_FAILED,
                "Invalid webhook signature", getType());
    }

    protected ProviderStatusInfo statusInfo(String externalId, PaymentStatus status, String providerStatus) {
        return ProviderStatusInfo.builder()
                .externalId(externalId)
                .status(status)
                .providerStatus(providerStatus)
                .build();
    }

    protected static String text(JsonNode node, String field) {
        if (node == null || node.get(field) == null || node.get(field).isNull()) return null;
        return node.get(field).asText(null);
    }

    protected static BigDecimal decimal(JsonNode node, String field) {
        String value = text(node, field);
        return value != null && !value.isBlank() ? new BigDecimal(value) : null;
    }
}
