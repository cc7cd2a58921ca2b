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
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Tinkoff acquiring API v2. Amounts travel in kopecks. Requests and
 * notifications are signed with a {@code Token}: SHA-256 over the values of
 * all top-level scalar parameters plus {@code Password}, concatenated in key order.
 * Errors arrive as HTTP 200 with {@code Success=false}.
 */
@Slf4j
public class TinkoffAdapter extends AbstractProviderAdapter {

    /** ErrorCodes meaning the terminal key or password is wrong. */
    private static final Set<String> CREDENTIAL_ERRORS = Set.of("202", "204", "205", "501");
    private static final String ACK = "OK";

    private final TinkoffSettings settings;
    private final String baseUrl;
    private final Clock clock;

    public TinkoffAdapter(TinkoffSettings settings, ProviderEndpoints endpoints, RestTemplate restTemplate,
                          ProviderCallExecutor callExecutor, Clock clock, boolean testMode) {
        super(restTemplate, callExecutor, testMode);
        this.settings = settings;
        this.baseUrl = endpoints.tinkoff(testMode);
        this.clock = clock;
    }

    @Override
    public PaymentProviderType getType() {
        return PaymentProviderType.TINKOFF;
    }

    @Override
    public ValidationResult validateConfig() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("PaymentId", "0");
        JsonNode response;
        try {
            response = send("GetState", params);
        } catch (PaymentException e) {
            return ValidationResult.failed("Could not verify Tinkoff credentials: " + e.getMessage());
        }
        String errorCode = text(response, "ErrorCode");
        if (errorCode != null && CREDENTIAL_ERRORS.contains(errorCode)) {
            return ValidationResult.failed("Invalid terminalKey or secretKey: " + text(response, "Message"));
        }
        return ValidationResult.ok();
    }

    @Override
    public ProviderPaymentResult createPayment(ProviderPaymentRequest request) {
        String orderId = request.getOrderId() != null ? request.getOrderId()
                : request.getIdempotencyKey() != null ? request.getIdempotencyKey()
                : "order_" + clock.millis() + "_" + ThreadLocalRandom.current().nextInt(100000, 999999);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("Amount", toKopecks(request.getAmount()));
        params.put("OrderId", orderId);
        if (request.getDescription() != null) {
            params.put("Description", request.getDescription());
        }
        if (request.getReturnUrl() != null) {
            params.put("SuccessURL", request.getReturnUrl());
        }
        if (request.getCancelUrl() != null) {
            params.put("FailURL", request.getCancelUrl());
        }
        Map<String, String> data = new LinkedHashMap<>();
        if (request.getCustomer() != null) {
            if (request.getCustomer().getEmail() != null) data.put("Email", request.getCustomer().getEmail());
            if (request.getCustomer().getPhone() != null) data.put("Phone", request.getCustomer().getPhone());
        }
        if (request.getMetadata() != null) {
            request.getMetadata().forEach((k, v) -> data.put(k, String.valueOf(v)));
        }
        if (!data.isEmpty()) {
            params.put("DATA", data);
        }

        JsonNode response = send("Init", params);
        requireSuccess(response, "Init");

        String paymentId = text(response, "PaymentId");
        log.info("Tinkoff payment created: externalId={} orderId={} status={} testMode={}",
                paymentId, orderId, text(response, "Status"), testMode);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("orderId", orderId);
        metadata.put("providerStatus", text(response, "Status"));
        return ProviderPaymentResult.builder()
                .externalId(paymentId)
                .status(mapStatus(text(response, "Status")))
                .paymentUrl(text(response, "PaymentURL"))
                .amount(request.getAmount())
                .currency(request.getCurrency())
                .metadata(metadata)
                .build();
    }

    @Override
    public ProviderStatusInfo getPaymentStatus(String externalId) {
        JsonNode response = send("GetState", Map.of("PaymentId", externalId));
        requireSuccess(response, "GetState");
        return toStatusInfo(externalId, response);
    }

    @Override
    public ProviderStatusInfo cancelPayment(String externalId) {
        JsonNode response = send("Cancel", Map.of("PaymentId", externalId));
        requireSuccess(response, "Cancel");
        return toStatusInfo(externalId, response);
    }

    @Override
    public ProviderStatusInfo capturePayment(String externalId, BigDecimal amount) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("PaymentId", externalId);
        if (amount != null) {
            params.put("Amount", toKopecks(amount));
        }
        JsonNode response = send("Confirm", params);
        requireSuccess(response, "Confirm");
        return toStatusInfo(externalId, response);
    }

    /** Refunds go through Cancel; a partial refund passes Amount. */
    @Override
    public ProviderRefundResult refund(ProviderRefundRequest request) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("PaymentId", request.getExternalPaymentId());
        if (request.getAmount() != null) {
            params.put("Amount", toKopecks(request.getAmount()));
        }
        JsonNode response;
        try {
            response = send("Cancel", params);
        } catch (PaymentException e) {
            throw new PaymentException(PaymentErrorCode.REFUND_FAILED, e.getMessage(), getType(), e.isRetryable(), e);
        }
        if (!response.path("Success").asBoolean(false)) {
            throw new PaymentException(PaymentErrorCode.REFUND_FAILED, errorMessage(response), getType());
        }
        String status = text(response, "Status");
        RefundStatus refundStatus = "REFUNDING".equals(status) || "REVERSING".equals(status)
                ? RefundStatus.PENDING : RefundStatus.SUCCEEDED;
        BigDecimal original = fromKopecks(response.path("OriginalAmount"));
        BigDecimal remaining = fromKopecks(response.path("NewAmount"));
        BigDecimal refunded = request.getAmount() != null ? request.getAmount()
                : original != null && remaining != null ? original.subtract(remaining) : original;
        return ProviderRefundResult.builder()
                .externalRefundId(request.getExternalPaymentId() + "_" + clock.millis())
                .status(refundStatus)
                .amount(refunded)
                .currency(request.getCurrency())
                .build();
    }

    @Override
    public boolean verifyWebhookSignature(WebhookPayload payload, String signature) {
        String received = payload.field("Token");
        if (received == null) {
            return false;
        }
        if (!settings.getTerminalKey().equals(payload.field("TerminalKey"))) {
            return false;
        }
        String expected = token(payload.getFields());
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                received.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public WebhookData parseWebhook(WebhookPayload payload, String signature) {
        if (!verifyWebhookSignature(payload, signature)) {
            throw verificationFailed();
        }
        String status = payload.field("Status");
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("orderId", payload.field("OrderId"));
        metadata.put("providerStatus", status);
        if (payload.field("ErrorCode") != null) {
            metadata.put("errorCode", payload.field("ErrorCode"));
        }
        String amount = payload.field("Amount");
        return WebhookData.builder()
                .event("payment." + (status != null ? status.toLowerCase(Locale.ROOT) : "unknown"))
                .externalId(payload.field("PaymentId"))
                .status(mapStatus(status))
                .amount(amount != null ? new BigDecimal(amount).movePointLeft(2) : null)
                .metadata(metadata)
                .rawPayload(payload.getFields())
                .acknowledgment(ACK)
                .build();
    }

    static PaymentStatus mapStatus(String status) {
        if (status == null) {
            return PaymentStatus.PENDING;
        }
        switch (status) {
            case "AUTHORIZED":
                return PaymentStatus.WAITING_FOR_CAPTURE;
            case "CONFIRMED":
                return PaymentStatus.SUCCEEDED;
            case "REVERSED":
            case "CANCELED":
            case "DEADLINE_EXPIRED":
                return PaymentStatus.CANCELED;
            case "REFUNDED":
                return PaymentStatus.REFUNDED;
            case "PARTIAL_REFUNDED":
                return PaymentStatus.PARTIALLY_REFUNDED;
            case "REJECTED":
            case "AUTH_FAIL":
                return PaymentStatus.FAILED;
            case "NEW":
            case "FORM_SHOWED":
            case "AUTHORIZING":
            case "CONFIRMING":
            case "REVERSING":
            case "REFUNDING":
            default:
                return PaymentStatus.PENDING;
        }
    }

    /**
     * Token over top-level scalars only; nested objects (DATA, Receipt) and the Token itself are excluded.
     */
    String token(Map<String, Object> params) {
        Map<String, String> sorted = new TreeMap<>();
        params.forEach((key, value) -> {
            if (value == null || "Token".equals(key) || value instanceof Map || value instanceof List) {
                return;
            }
            sorted.put(key, String.valueOf(value));
        });
        sorted.put("Password", settings.getSecretKey());
        StringBuilder concatenated = new StringBuilder();
        sorted.values().forEach(concatenated::append);
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(concatenated.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private ProviderStatusInfo toStatusInfo(String externalId, JsonNode response) {
        String status = text(response, "Status");
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("providerStatus", status);
        return ProviderStatusInfo.builder()
                .externalId(externalId)
                .status(mapStatus(status))
                .providerStatus(status)
                .amount(fromKopecks(response.path("Amount")))
                .metadata(metadata)
                .build();
    }

    private JsonNode send(String method, Map<String, Object> params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("TerminalKey", settings.getTerminalKey());
        body.putAll(params);
        body.put("Token", token(body));
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return call(method, () -> exchange(HttpMethod.POST, baseUrl + "/" + method, headers, body));
    }

    private void requireSuccess(JsonNode response, String method) {
        if (response.path("Success").asBoolean(false)) {
            return;
        }
        String errorCode = text(response, "ErrorCode");
        String message = errorMessage(response);
        log.warn("Tinkoff call rejected: method={} errorCode={} message={}", method, errorCode, message);
        if (errorCode != null && CREDENTIAL_ERRORS.contains(errorCode)) {
            throw new PaymentException(PaymentErrorCode.UNAUTHORIZED, message, getType());
        }
        throw providerError(message);
    }

    private static String errorMessage(JsonNode response) {
        String message = text(response, "Message");
        String details = text(response, "Details");
        String base = message != null ? message : "Tinkoff request failed";
        return details != null && !details.isBlank() ? base + ": " + details : base;
    }

    static long toKopecks(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).movePointRight(2).longValueExact();
    }

    private static BigDecimal fromKopecks(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : BigDecimal.valueOf(node.asLong()).movePointLeft(2);
    }
}
