package com.payment.reconciliation.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.reconciliation.core.ProviderCallExecutor;
import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.PaymentStatus;
import com.payment.reconciliation.domain.ProviderPaymentRequest;
import com.payment.reconciliation.domain.ProviderPaymentResult;
import com.payment.reconciliation.domain.ProviderRefundRequest;
import com.payment.reconciliation.domain.ProviderRefundResult;
import com.payment.reconciliation.domain.ProviderStatusInfo;
import com.payment.reconciliation.domain.RefundStatus;
import com.payment.reconciliation.domain.ValidationResult;
import com.payment.reconciliation.domain.WebhookData;
import com.payment.reconciliation.domain.WebhookPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * YooKassa API v3. Basic auth with shopId/secretKey; every mutating call
 * carries an {@code Idempotence-Key} header, so retries never double-charge.
 * <p>
 * Notifications are unsigned. A notification is accepted only if it is
 * well-formed, and the status it reports is never trusted: the payment is
 * re-read from the API and that answer is what gets reconciled.
 */
@Slf4j
public class YooKassaAdapter extends AbstractProviderAdapter {

    static final Set<String> WEBHOOK_EVENTS = Set.of(
            "payment.waiting_for_capture", "payment.succeeded", "payment.canceled", "refund.succeeded");

    private static final int MAX_DESCRIPTION = 128;

    private final YooKassaSettings settings;
    private final String baseUrl;

    public YooKassaAdapter(YooKassaSettings settings, ProviderEndpoints endpoints, RestTemplate restTemplate,
                           ProviderCallExecutor callExecutor, boolean testMode) {
        super(restTemplate, callExecutor, testMode);
        this.settings = settings;
        this.baseUrl = endpoints.yookassa(testMode);
    }

    @Override
    public PaymentProviderType getType() {
        return PaymentProviderType.YOOKASSA;
    }

    @Override
    public ValidationResult validateConfig() {
        try {
            call("validateConfig", () -> exchange(HttpMethod.GET, baseUrl + "/me", headers(null), null));
            return ValidationResult.ok();
        } catch (PaymentException e) {
            if (e.getCode() == PaymentErrorCode.UNAUTHORIZED) {
                return ValidationResult.failed("Invalid shopId or secretKey");
            }
            return ValidationResult.failed("Could not verify YooKassa credentials: " + e.getMessage());
        }
    }

    @Override
    public ProviderPaymentResult createPayment(ProviderPaymentRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", amount(request.getAmount(), request.getCurrency()));
        body.put("capture", true);
        body.put("confirmation", Map.of("type", "redirect", "return_url", request.getReturnUrl()));
        if (request.getDescription() != null) {
            String description = request.getDescription();
            body.put("description", description.length() > MAX_DESCRIPTION ? description.substring(0, MAX_DESCRIPTION) : description);
        }
        Map<String, Object> metadata = new HashMap<>();
        if (request.getMetadata() != null) {
            request.getMetadata().forEach((k, v) -> metadata.put(k, String.valueOf(v)));
        }
        if (request.getOrderId() != null) {
            metadata.put("orderId", request.getOrderId());
        }
        body.put("metadata", metadata);

        String idempotenceKey = request.getIdempotencyKey() != null ? request.getIdempotencyKey() : UUID.randomUUID().toString();
        JsonNode response = call("createPayment",
                () -> exchange(HttpMethod.POST, baseUrl + "/payments", headers(idempotenceKey), body));

        String id = text(response, "id");
        log.info("YooKassa payment created: externalId={} status={} testMode={}", id, text(response, "status"), testMode);
        Map<String, Object> resultMetadata = new HashMap<>();
        resultMetadata.put("providerStatus", text(response, "status"));
        return ProviderPaymentResult.builder()
                .externalId(id)
                .status(mapStatus(response))
                .paymentUrl(text(response.path("confirmation"), "confirmation_url"))
                .amount(decimal(response.path("amount"), "value"))
                .currency(text(response.path("amount"), "currency"))
                .expiresAt(instant(text(response, "expires_at")))
                .metadata(resultMetadata)
                .build();
    }

    @Override
    public ProviderStatusInfo getPaymentStatus(String externalId) {
        JsonNode response = call("getPaymentStatus",
                () -> exchange(HttpMethod.GET, baseUrl + "/payments/" + externalId, headers(null), null));
        return toStatusInfo(response);
    }

    @Override
    public ProviderStatusInfo cancelPayment(String externalId) {
        String key = UUID.randomUUID().toString();
        JsonNode response = call("cancelPayment",
                () -> exchange(HttpMethod.POST, baseUrl + "/payments/" + externalId + "/cancel", headers(key), Map.of()));
        return toStatusInfo(response);
    }

    @Override
    public ProviderStatusInfo capturePayment(String externalId, BigDecimal amount) {
        String key = UUID.randomUUID().toString();
        Map<String, Object> body = new LinkedHashMap<>();
        if (amount != null) {
            ProviderStatusInfo current = getPaymentStatus(externalId);
            body.put("amount", amount(amount, current.getCurrency()));
        }
        JsonNode response = call("capturePayment",
                () -> exchange(HttpMethod.POST, baseUrl + "/payments/" + externalId + "/capture", headers(key), body));
        return toStatusInfo(response);
    }

    @Override
    public ProviderRefundResult refund(ProviderRefundRequest request) {
        BigDecimal amount = request.getAmount();
        String currency = request.getCurrency();
        if (amount == null || currency == null) {
            ProviderStatusInfo payment = getPaymentStatus(request.getExternalPaymentId());
            amount = amount != null ? amount : payment.getAmount();
            currency = currency != null ? currency : payment.getCurrency();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("payment_id", request.getExternalPaymentId());
        body.put("amount", amount(amount, currency));
        if (request.getReason() != null) {
            body.put("description", request.getReason());
        }
        String key = request.getIdempotencyKey() != null ? request.getIdempotencyKey() : UUID.randomUUID().toString();
        JsonNode response = call("refund", () -> exchange(HttpMethod.POST, baseUrl + "/refunds", headers(key), body));

        String status = text(response, "status");
        RefundStatus refundStatus = "succeeded".equals(status) ? RefundStatus.SUCCEEDED
                : "canceled".equals(status) ? RefundStatus.FAILED
                : RefundStatus.PENDING;
        return ProviderRefundResult.builder()
                .externalRefundId(text(response, "id"))
                .status(refundStatus)
                .amount(decimal(response.path("amount"), "value"))
                .currency(text(response.path("amount"), "currency"))
                .build();
    }

    @Override
    public boolean verifyWebhookSignature(WebhookPayload payload, String signature) {
        Object object = payload.getFields().get("object");
        String event = payload.field("event");
        if (!(object instanceof Map) || event == null || !WEBHOOK_EVENTS.contains(event)) {
            return false;
        }
        return ((Map<?, ?>) object).get("id") != null;
    }

    @Override
    public WebhookData parseWebhook(WebhookPayload payload, String signature) {
        if (!verifyWebhookSignature(payload, signature)) {
            throw verificationFailed();
        }
        String event = payload.field("event");
        Map<?, ?> object = (Map<?, ?>) payload.getFields().get("object");
        String paymentId = event.startsWith("refund.")
                ? String.valueOf(object.get("payment_id"))
                : String.valueOf(object.get("id"));

        ProviderStatusInfo authoritative = getPaymentStatus(paymentId);
        return WebhookData.builder()
                .event(event)
                .externalId(paymentId)
                .status(authoritative.getStatus())
                .amount(authoritative.getAmount())
                .metadata(authoritative.getMetadata())
                .rawPayload(payload.getFields())
                .build();
    }

    ProviderStatusInfo toStatusInfo(JsonNode payment) {
        Map<String, Object> metadata = new HashMap<>();
        BigDecimal refunded = decimal(payment.path("refunded_amount"), "value");
        if (refunded != null) {
            metadata.put("refundedAmount", refunded);
        }
        JsonNode cancellation = payment.path("cancellation_details");
        if (!cancellation.isMissingNode()) {
            metadata.put("cancellationReason", text(cancellation, "reason"));
        }
        return ProviderStatusInfo.builder()
                .externalId(text(payment, "id"))
                .status(mapStatus(payment))
                .providerStatus(text(payment, "status"))
                .amount(decimal(payment.path("amount"), "value"))
                .currency(text(payment.path("amount"), "currency"))
                .paidAt(instant(text(payment, "captured_at")))
                .metadata(metadata)
                .build();
    }

    /**
     * A succeeded payment with refunds reports its refund state through {@code refunded_amount}.
     */
    static PaymentStatus mapStatus(JsonNode payment) {
        String status = text(payment, "status");
        if (status == null) {
            return PaymentStatus.PENDING;
        }
        switch (status) {
            case "waiting_for_capture":
                return PaymentStatus.WAITING_FOR_CAPTURE;
            case "succeeded": {
                BigDecimal refunded = decimal(payment.path("refunded_amount"), "value");
                BigDecimal amount = decimal(payment.path("amount"), "value");
                if (refunded != null && refunded.signum() > 0 && amount != null) {
                    return refunded.compareTo(amount) >= 0 ? PaymentStatus.REFUNDED : PaymentStatus.PARTIALLY_REFUNDED;
                }
                return PaymentStatus.SUCCEEDED;
            }
            case "canceled":
                return PaymentStatus.CANCELED;
            case "pending":
            default:
                return PaymentStatus.PENDING;
        }
    }

    private HttpHeaders headers(String idempotenceKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(settings.getShopId(), settings.getSecretKey());
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (idempotenceKey != null) {
            headers.set("Idempotence-Key", idempotenceKey);
        }
        return headers;
    }

    private static Map<String, Object> amount(BigDecimal value, String currency) {
        Map<String, Object> amount = new LinkedHashMap<>();
        amount.put("value", value.setScale(2, RoundingMode.HALF_UP).toPlainString());
        amount.put("currency", currency);
        return amount;
    }

    private static Instant instant(String value) {
        return value != null ? Instant.parse(value) : null;
    }
}
