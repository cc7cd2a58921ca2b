package com.payment.reconciliation.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.reconciliation.core.ProviderCallExecutor;
import com.payment.reconciliation.domain.CurrencyPrecision;
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
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Stripe hosted checkout. A payment is a Checkout Session ({@code cs_...});
 * once paid it is backed by a PaymentIntent ({@code pi_...}) which is what
 * capture and refund operate on. Requests are form-encoded with an
 * {@code Idempotency-Key}. Webhooks are verified from the {@code Stripe-Signature}
 * header (HMAC-SHA256 over {@code t.rawBody}) within a timestamp tolerance.
 */
@Slf4j
public class StripeAdapter extends AbstractProviderAdapter {

    static final String MERCHANT_REFERENCE_KEY = "paymentReference";

    private final StripeSettings settings;
    private final String baseUrl;
    private final long toleranceSeconds;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StripeAdapter(StripeSettings settings, ProviderEndpoints endpoints, RestTemplate restTemplate,
                         ProviderCallExecutor callExecutor, ObjectMapper objectMapper, Clock clock, boolean testMode) {
        super(restTemplate, callExecutor, testMode);
        this.settings = settings;
        this.baseUrl = endpoints.getStripeBaseUrl();
        this.toleranceSeconds = endpoints.getStripeWebhookToleranceSeconds();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public PaymentProviderType getType() {
        return PaymentProviderType.STRIPE;
    }

    @Override
    public ValidationResult validateConfig() {
        try {
            call("validateConfig", () -> exchange(HttpMethod.GET, baseUrl + "/balance", headers(null), null));
            return ValidationResult.ok();
        } catch (PaymentException e) {
            if (e.getCode() == PaymentErrorCode.UNAUTHORIZED) {
                return ValidationResult.failed("Invalid Stripe secretKey");
            }
            return ValidationResult.failed("Could not verify Stripe credentials: " + e.getMessage());
        }
    }

    @Override
    public ProviderPaymentResult createPayment(ProviderPaymentRequest request) {
        String currency = request.getCurrency().toUpperCase(Locale.ROOT);
        long unitAmount = toMinorUnits(request.getAmount(), currency);
        String reference = request.getIdempotencyKey() != null ? request.getIdempotencyKey() : UUID.randomUUID().toString();

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("mode", "payment");
        form.add("line_items[0][price_data][currency]", currency.toLowerCase(Locale.ROOT));
        form.add("line_items[0][price_data][unit_amount]", String.valueOf(unitAmount));
        form.add("line_items[0][price_data][product_data][name]",
                request.getDescription() != null ? request.getDescription() : "Payment");
        form.add("line_items[0][quantity]", "1");
        form.add("success_url", request.getReturnUrl());
        form.add("cancel_url", request.getCancelUrl() != null ? request.getCancelUrl() : request.getReturnUrl());
        if (request.getCustomer() != null && request.getCustomer().getEmail() != null) {
            form.add("customer_email", request.getCustomer().getEmail());
        }
        Map<String, String> metadata = new HashMap<>();
        if (request.getMetadata() != null) {
            request.getMetadata().forEach((k, v) -> metadata.put(k, String.valueOf(v)));
        }
        if (request.getOrderId() != null) {
            metadata.put("orderId", request.getOrderId());
        }
        metadata.put(MERCHANT_REFERENCE_KEY, reference);
        metadata.forEach((k, v) -> {
            form.add("metadata[" + k + "]", v);
            form.add("payment_intent_data[metadata][" + k + "]", v);
        });
        if (settings.getAccountId() != null) {
            form.add("payment_intent_data[transfer_data][destination]", settings.getAccountId());
            if (settings.getApplicationFeePercent() != null) {
                long fee = BigDecimal.valueOf(unitAmount)
                        .multiply(settings.getApplicationFeePercent())
                        .divide(BigDecimal.valueOf(100), 0, RoundingMode.HALF_UP)
                        .longValue();
                form.add("payment_intent_data[application_fee_amount]", String.valueOf(fee));
            }
        }

        JsonNode session = call("createPayment",
                () -> exchange(HttpMethod.POST, baseUrl + "/checkout/sessions", headers(reference), form));
        String sessionId = text(session, "id");
        log.info("Stripe checkout session created: externalId={} testMode={}", sessionId, testMode);

        Map<String, Object> resultMetadata = new HashMap<>();
        resultMetadata.put("sessionId", sessionId);
        if (text(session, "payment_intent") != null) {
            resultMetadata.put("paymentIntentId", text(session, "payment_intent"));
        }
        long expiresAt = session.path("expires_at").asLong(0);
        return ProviderPaymentResult.builder()
                .externalId(sessionId)
                .status(PaymentStatus.PENDING)
                .paymentUrl(text(session, "url"))
                .amount(request.getAmount())
                .currency(currency)
                .expiresAt(expiresAt > 0 ? Instant.ofEpochSecond(expiresAt) : null)
                .metadata(resultMetadata)
                .build();
    }

    @Override
    public ProviderStatusInfo getPaymentStatus(String externalId) {
        if (isSession(externalId)) {
            JsonNode session = call("getPaymentStatus",
                    () -> exchange(HttpMethod.GET, baseUrl + "/checkout/sessions/" + externalId, headers(null), null));
            String status = text(session, "status");
            return ProviderStatusInfo.builder()
                    .externalId(externalId)
                    .providerReference(text(session, "payment_intent"))
                    .status(mapSessionStatus(status, text(session, "payment_status")))
                    .providerStatus(status)
                    .amount(fromMinorUnits(session.path("amount_total").asLong(0), text(session, "currency")))
                    .currency(upper(text(session, "currency")))
                    .build();
        }
        JsonNode intent = call("getPaymentStatus",
                () -> exchange(HttpMethod.GET, baseUrl + "/payment_intents/" + externalId, headers(null), null));
        return intentStatus(intent);
    }

    @Override
    public ProviderStatusInfo cancelPayment(String externalId) {
        if (isSession(externalId)) {
            JsonNode session = call("cancelPayment", () -> exchange(HttpMethod.POST,
                    baseUrl + "/checkout/sessions/" + externalId + "/expire", headers(UUID.randomUUID().toString()),
                    new LinkedMultiValueMap<String, String>()));
            return statusInfo(externalId, mapSessionStatus(text(session, "status"), text(session, "payment_status")),
                    text(session, "status"));
        }
        JsonNode intent = call("cancelPayment", () -> exchange(HttpMethod.POST,
                baseUrl + "/payment_intents/" + externalId + "/cancel", headers(UUID.randomUUID().toString()),
                new LinkedMultiValueMap<String, String>()));
        return intentStatus(intent);
    }

    @Override
    public ProviderStatusInfo capturePayment(String externalId, BigDecimal amount) {
        ProviderStatusInfo current = getPaymentStatus(externalId);
        String intentId = resolveIntent(externalId);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        if (amount != null) {
            form.add("amount_to_capture", String.valueOf(toMinorUnits(amount, current.getCurrency())));
        }
        JsonNode intent = call("capturePayment", () -> exchange(HttpMethod.POST,
                baseUrl + "/payment_intents/" + intentId + "/capture", headers(UUID.randomUUID().toString()), form));
        return intentStatus(intent);
    }

    @Override
    public ProviderRefundResult refund(ProviderRefundRequest request) {
        String intentId = resolveIntent(request.getExternalPaymentId());
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("payment_intent", intentId);
        if (request.getAmount() != null) {
            form.add("amount", String.valueOf(toMinorUnits(request.getAmount(), request.getCurrency())));
        }
        form.add("reason", "requested_by_customer");
        if (request.getReason() != null) {
            form.add("metadata[reason]", request.getReason());
        }
        String key = request.getIdempotencyKey() != null ? request.getIdempotencyKey() : UUID.randomUUID().toString();
        JsonNode refund = call("refund", () -> exchange(HttpMethod.POST, baseUrl + "/refunds", headers(key), form));

        String status = text(refund, "status");
        RefundStatus refundStatus = "succeeded".equals(status) ? RefundStatus.SUCCEEDED
                : "failed".equals(status) || "canceled".equals(status) ? RefundStatus.FAILED
                : RefundStatus.PENDING;
        String currency = upper(text(refund, "currency"));
        return ProviderRefundResult.builder()
                .externalRefundId(text(refund, "id"))
                .status(refundStatus)
                .amount(fromMinorUnits(refund.path("amount").asLong(0), currency))
                .currency(currency)
                .build();
    }

    @Override
    public boolean verifyWebhookSignature(WebhookPayload payload, String signature) {
        String secret = settings.getWebhookSecret();
        if (secret == null || secret.isBlank() || signature == null || payload.getRawBody() == null) {
            return false;
        }
        String timestamp = null;
        String v1 = null;
        for (String part : signature.split(",")) {
            String[] kv = part.split("=", 2);
            if (kv.length != 2) continue;
            if ("t".equals(kv[0].trim())) timestamp = kv[1].trim();
            if ("v1".equals(kv[0].trim()) && v1 == null) v1 = kv[1].trim();
        }
        if (timestamp == null || v1 == null) {
            return false;
        }
        long ts;
        try {
            ts = Long.parseLong(timestamp);
        } catch (NumberFormatException e) {
            log.warn("Stripe webhook carries a malformed timestamp");
            return false;
        }
        if (Math.abs(clock.instant().getEpochSecond() - ts) > toleranceSeconds) {
            log.warn("Stripe webhook timestamp outside tolerance: toleranceSeconds={}", toleranceSeconds);
            return false;
        }
        String computed = hmacSha256Hex(secret, timestamp + "." + payload.getRawBody());
        return MessageDigest.isEqual(computed.getBytes(StandardCharsets.UTF_8), v1.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public WebhookData parseWebhook(WebhookPayload payload, String signature) {
        if (!verifyWebhookSignature(payload, signature)) {
            throw verificationFailed();
        }
        JsonNode event;
        try {
            event = objectMapper.readTree(payload.getRawBody());
        } catch (JsonProcessingException e) {
            throw new PaymentException(PaymentErrorCode.WEBHOOK_VERIFICATION_FAILED,
                    "Stripe webhook body is not valid JSON", getType(), false, e);
        }
        String type = text(event, "type");
        JsonNode object = event.path("data").path("object");
        WebhookData.WebhookDataBuilder data = WebhookData.builder()
                .event(type)
                .rawPayload(payload.getFields())
                .merchantReference(text(object.path("metadata"), MERCHANT_REFERENCE_KEY));
        String currency = upper(text(object, "currency"));
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("eventId", text(event, "id"));

        switch (type != null ? type : "") {
            case "checkout.session.completed":
            case "checkout.session.async_payment_succeeded":
                return data.externalId(text(object, "id"))
                        .providerReference(text(object, "payment_intent"))
                        .status(mapSessionStatus(text(object, "status"), text(object, "payment_status")))
                        .amount(fromMinorUnits(object.path("amount_total").asLong(0), currency))
                        .metadata(metadata)
                        .build();
            case "checkout.session.async_payment_failed":
                return data.externalId(text(object, "id"))
                        .providerReference(text(object, "payment_intent"))
                        .status(PaymentStatus.FAILED)
                        .metadata(metadata)
                        .build();
            case "checkout.session.expired":
                return data.externalId(text(object, "id")).status(PaymentStatus.CANCELED).metadata(metadata).build();
            case "payment_intent.succeeded":
                return data.externalId(text(object, "id"))
                        .status(PaymentStatus.SUCCEEDED)
                        .amount(fromMinorUnits(object.path("amount_received").asLong(0), currency))
                        .metadata(metadata)
                        .build();
            case "payment_intent.amount_capturable_updated":
                return data.externalId(text(object, "id")).status(PaymentStatus.WAITING_FOR_CAPTURE).metadata(metadata).build();
            case "payment_intent.payment_failed":
                JsonNode lastError = object.path("last_payment_error");
                if (!lastError.isMissingNode()) {
                    metadata.put("errorCode", text(lastError, "code"));
                    metadata.put("errorMessage", text(lastError, "message"));
                }
                return data.externalId(text(object, "id")).status(PaymentStatus.FAILED).metadata(metadata).build();
            case "payment_intent.canceled":
                return data.externalId(text(object, "id")).status(PaymentStatus.CANCELED).metadata(metadata).build();
            case "charge.refunded": {
                long amount = object.path("amount").asLong(0);
                long refunded = object.path("amount_refunded").asLong(0);
                metadata.put("refundedAmount", fromMinorUnits(refunded, currency));
                return data.externalId(text(object, "payment_intent"))
                        .status(refunded >= amount ? PaymentStatus.REFUNDED : PaymentStatus.PARTIALLY_REFUNDED)
                        .amount(fromMinorUnits(amount, currency))
                        .metadata(metadata)
                        .build();
            }
            default:
                log.debug("Ignoring Stripe event type={}", type);
                return data.externalId(text(object, "id")).metadata(metadata).build();
        }
    }

    @Override
    protected PaymentException classifyError(HttpStatusCodeException e) {
        JsonNode error = readError(e.getResponseBodyAsString());
        if (error == null) {
            return null;
        }
        String type = text(error, "type");
        String code = text(error, "code");
        String message = text(error, "message") != null ? text(error, "message") : "Stripe error";
        if ("card_error".equals(type)) {
            return new PaymentException(PaymentErrorCode.PAYMENT_DECLINED, message, getType(), false, e);
        }
        if ("resource_missing".equals(code)) {
            return new PaymentException(PaymentErrorCode.PAYMENT_NOT_FOUND, message, getType(), false, e);
        }
        return null;
    }

    @Override
    protected String providerMessage(String body) {
        JsonNode error = readError(body);
        String message = error != null ? text(error, "message") : null;
        return message != null ? message : super.providerMessage(body);
    }

    static PaymentStatus mapSessionStatus(String status, String paymentStatus) {
        if ("complete".equals(status)) {
            return "unpaid".equals(paymentStatus) ? PaymentStatus.PENDING : PaymentStatus.SUCCEEDED;
        }
        if ("expired".equals(status)) {
            return PaymentStatus.CANCELED;
        }
        return PaymentStatus.PENDING;
    }

    static PaymentStatus mapIntentStatus(String status) {
        if (status == null) {
            return PaymentStatus.PENDING;
        }
        switch (status) {
            case "requires_capture":
                return PaymentStatus.WAITING_FOR_CAPTURE;
            case "succeeded":
                return PaymentStatus.SUCCEEDED;
            case "canceled":
                return PaymentStatus.CANCELED;
            case "requires_payment_method":
            case "requires_confirmation":
            case "requires_action":
            case "processing":
            default:
                return PaymentStatus.PENDING;
        }
    }

    private ProviderStatusInfo intentStatus(JsonNode intent) {
        String status = text(intent, "status");
        String currency = upper(text(intent, "currency"));
        return ProviderStatusInfo.builder()
                .externalId(text(intent, "id"))
                .status(mapIntentStatus(status))
                .providerStatus(status)
                .amount(fromMinorUnits(intent.path("amount").asLong(0), currency))
                .currency(currency)
                .build();
    }

    private String resolveIntent(String externalId) {
        if (!isSession(externalId)) {
            return externalId;
        }
        ProviderStatusInfo session = getPaymentStatus(externalId);
        if (session.getProviderReference() == null) {
            throw new PaymentException(PaymentErrorCode.PAYMENT_NOT_FOUND,
                    "Checkout session " + externalId + " has no payment yet", getType());
        }
        return session.getProviderReference();
    }

    private JsonNode readError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            return error.isMissingNode() ? null : error;
        } catch (JsonProcessingException e) {
            log.debug("Stripe error body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private HttpHeaders headers(String idempotencyKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(settings.getSecretKey());
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        if (idempotencyKey != null) {
            headers.set("Idempotency-Key", idempotencyKey);
        }
        return headers;
    }

    private static boolean isSession(String externalId) {
        return externalId != null && externalId.startsWith("cs_");
    }

    static long toMinorUnits(BigDecimal amount, String currency) {
        if (CurrencyPrecision.isZeroDecimal(currency)) {
            return amount.setScale(0, RoundingMode.HALF_UP).longValueExact();
        }
        return amount.setScale(2, RoundingMode.HALF_UP).movePointRight(2).longValueExact();
    }

    static BigDecimal fromMinorUnits(long minor, String currency) {
        if (CurrencyPrecision.isZeroDecimal(currency)) {
            return BigDecimal.valueOf(minor);
        }
        return BigDecimal.valueOf(minor).movePointLeft(2);
    }

    private static String upper(String value) {
        return value != null ? value.toUpperCase(Locale.ROOT) : null;
    }

    private static String hmacSha256Hex(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}
