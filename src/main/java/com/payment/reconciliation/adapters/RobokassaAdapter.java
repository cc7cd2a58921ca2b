package com.payment.reconciliation.adapters;

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
import com.payment.reconciliation.domain.ValidationResult;
import com.payment.reconciliation.domain.WebhookData;
import com.payment.reconciliation.domain.WebhookPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Robokassa redirect aggregator. Payments are signed links; no API call is
 * made at creation. Status comes from the OpStateExt XML service and from the
 * Result URL callback, which is MD5-signed and must be answered with
 * {@code OK<InvId>} verbatim. Refund, cancel and capture have no API.
 * <p>
 * In test mode password3/password4 replace password1/password2 when set.
 */
@Slf4j
public class RobokassaAdapter extends AbstractProviderAdapter {

    private static final Pattern RESULT_CODE = Pattern.compile("<Result>\\s*<Code>(\\d+)</Code>", Pattern.DOTALL);
    private static final Pattern STATE_CODE = Pattern.compile("<State>\\s*<Code>(\\d+)</Code>", Pattern.DOTALL);
    private static final Pattern OUT_SUM = Pattern.compile("<OutSum>([\\d.]+)</OutSum>");
    private static final String SHP_PREFIX = "Shp_";

    private final RobokassaSettings settings;
    private final ProviderEndpoints endpoints;
    private final SecureRandom random = new SecureRandom();

    public RobokassaAdapter(RobokassaSettings settings, ProviderEndpoints endpoints, RestTemplate restTemplate,
                            ProviderCallExecutor callExecutor, boolean testMode) {
        super(restTemplate, callExecutor, testMode);
        this.settings = settings;
        this.endpoints = endpoints;
    }

    @Override
    public PaymentProviderType getType() {
        return PaymentProviderType.ROBOKASSA;
    }

    @Override
    public ValidationResult validateConfig() {
        String xml;
        try {
            xml = opState("0");
        } catch (PaymentException e) {
            return ValidationResult.failed("Could not verify Robokassa credentials: " + e.getMessage());
        }
        String resultCode = firstGroup(RESULT_CODE, xml);
        // 0 = found, 3 = no such invoice; both prove the signature was accepted
        if ("0".equals(resultCode) || "3".equals(resultCode)) {
            return ValidationResult.ok();
        }
        return ValidationResult.failed("Robokassa rejected merchantLogin/password2 (result code " + resultCode + ")");
    }

    @Override
    public ProviderPaymentResult createPayment(ProviderPaymentRequest request) {
        String invoiceId = invoiceId(request.getOrderId());
        String outSum = request.getAmount().setScale(2, RoundingMode.HALF_UP).toPlainString();

        Map<String, String> shp = new TreeMap<>();
        if (request.getMetadata() != null) {
            request.getMetadata().forEach((k, v) -> shp.put(SHP_PREFIX + k, String.valueOf(v)));
        }
        String signature = md5(settings.getMerchantLogin() + ":" + outSum + ":" + invoiceId + ":" + paymentPassword()
                + shpSuffix(shp));

        UriComponentsBuilder url = UriComponentsBuilder.fromUriString(endpoints.getRobokassaPaymentUrl())
                .queryParam("MerchantLogin", settings.getMerchantLogin())
                .queryParam("OutSum", outSum)
                .queryParam("InvId", invoiceId)
                .queryParam("SignatureValue", signature)
                .queryParam("Culture", settings.getCulture() != null ? settings.getCulture() : "ru")
                .queryParam("Encoding", "utf-8");
        if (request.getDescription() != null) {
            url.queryParam("Description", request.getDescription());
        }
        if (request.getCustomer() != null && request.getCustomer().getEmail() != null) {
            url.queryParam("Email", request.getCustomer().getEmail());
        }
        if (testMode) {
            url.queryParam("IsTest", "1");
        }
        shp.forEach(url::queryParam);

        log.info("Robokassa payment link created: invoiceId={} outSum={} testMode={}", invoiceId, outSum, testMode);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("invoiceId", invoiceId);
        return ProviderPaymentResult.builder()
                .externalId(invoiceId)
                .status(PaymentStatus.PENDING)
                .paymentUrl(url.encode(StandardCharsets.UTF_8).toUriString())
                .amount(new BigDecimal(outSum))
                .currency(request.getCurrency())
                .metadata(metadata)
                .build();
    }

    @Override
    public ProviderStatusInfo getPaymentStatus(String externalId) {
        String xml = opState(externalId);
        String resultCode = firstGroup(RESULT_CODE, xml);
        if ("3".equals(resultCode)) {
            throw new PaymentException(PaymentErrorCode.PAYMENT_NOT_FOUND, "Robokassa invoice " + externalId + " not found", getType());
        }
        if (!"0".equals(resultCode)) {
            throw providerError("Robokassa OpStateExt failed with result code " + resultCode);
        }
        String stateCode = firstGroup(STATE_CODE, xml);
        String outSum = firstGroup(OUT_SUM, xml);
        return ProviderStatusInfo.builder()
                .externalId(externalId)
                .status(mapState(stateCode))
                .providerStatus(stateCode)
                .amount(outSum != null ? new BigDecimal(outSum) : null)
                .metadata(Map.of("stateCode", stateCode != null ? stateCode : ""))
                .build();
    }

    @Override
    public ProviderStatusInfo cancelPayment(String externalId) {
        throw PaymentException.notSupported(getType(), "Cancel");
    }

    @Override
    public ProviderRefundResult refund(ProviderRefundRequest request) {
        throw PaymentException.notSupported(getType(), "Refund");
    }

    @Override
    public boolean verifyWebhookSignature(WebhookPayload payload, String signature) {
        String outSum = payload.field("OutSum");
        String invoiceId = payload.field("InvId");
        String received = signature != null ? signature : payload.field("SignatureValue");
        if (outSum == null || invoiceId == null || received == null) {
            return false;
        }
        String expected = md5(outSum + ":" + invoiceId + ":" + resultPassword() + shpSuffix(shpFields(payload)));
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                received.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public WebhookData parseWebhook(WebhookPayload payload, String signature) {
        if (!verifyWebhookSignature(payload, signature)) {
            throw verificationFailed();
        }
        String invoiceId = payload.field("InvId");
        Map<String, Object> metadata = new HashMap<>();
        shpFields(payload).forEach((k, v) -> metadata.put(k.substring(SHP_PREFIX.length()), v));
        return WebhookData.builder()
                .event("payment.succeeded")
                .externalId(invoiceId)
                .status(PaymentStatus.SUCCEEDED)
                .amount(new BigDecimal(payload.field("OutSum")))
                .metadata(metadata)
                .rawPayload(payload.getFields())
                .acknowledgment("OK" + invoiceId)
                .build();
    }

    static PaymentStatus mapState(String stateCode) {
        if (stateCode == null) {
            return PaymentStatus.PENDING;
        }
        switch (stateCode) {
            case "10":
                return PaymentStatus.CANCELED;
            case "20":
                return PaymentStatus.WAITING_FOR_CAPTURE;
            case "50":
            case "100":
                return PaymentStatus.SUCCEEDED;
            case "60":
                return PaymentStatus.REFUNDED;
            case "5":
            case "80":
            default:
                return PaymentStatus.PENDING;
        }
    }

    private String opState(String invoiceId) {
        String signature = md5(settings.getMerchantLogin() + ":" + invoiceId + ":" + resultPassword());
        URI uri = UriComponentsBuilder.fromUriString(endpoints.getRobokassaApiUrl())
                .path("/OpStateExt")
                .queryParam("MerchantLogin", settings.getMerchantLogin())
                .queryParam("InvoiceID", invoiceId)
                .queryParam("Signature", signature)
                .encode(StandardCharsets.UTF_8)
                .build()
                .toUri();
        return call("OpStateExt", () -> restTemplate.getForObject(uri, String.class));
    }

    /** Robokassa invoice ids are positive 32-bit integers. */
    private String invoiceId(String orderId) {
        if (orderId != null && orderId.matches("^[1-9]\\d{0,8}$")) {
            return orderId;
        }
        return String.valueOf(1 + random.nextInt(Integer.MAX_VALUE - 1));
    }

    private String paymentPassword() {
        return testMode && settings.getPassword3() != null ? settings.getPassword3() : settings.getPassword1();
    }

    private String resultPassword() {
        return testMode && settings.getPassword4() != null ? settings.getPassword4() : settings.getPassword2();
    }

    private static Map<String, String> shpFields(WebhookPayload payload) {
        Map<String, String> shp = new TreeMap<>();
        payload.getFields().forEach((k, v) -> {
            if (k.startsWith(SHP_PREFIX) && v != null) {
                shp.put(k, String.valueOf(v));
            }
        });
        return shp;
    }

    private static String shpSuffix(Map<String, String> sortedShp) {
        StringBuilder suffix = new StringBuilder();
        sortedShp.forEach((k, v) -> suffix.append(':').append(k).append('=').append(v));
        return suffix.toString();
    }

    private static String firstGroup(Pattern pattern, String text) {
        if (text == null) return null;
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    static String md5(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
