package com.payment.reconciliation.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.reconciliation.core.PaymentTransactionService;
import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.WebhookPayload;
import com.payment.reconciliation.domain.WebhookResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound provider notifications. The path names the tenant and provider, so
 * the engine can load the right credentials before verifying the payload.
 * JSON bodies (YooKassa, Tinkoff, Stripe) and form or query parameters
 * (Robokassa result URL) are both accepted.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments/webhooks/{entityType}/{entityId}/{provider}")
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Provider payment notifications")
public class WebhookController {

    static final String STRIPE_SIGNATURE_HEADER = "Stripe-Signature";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final PaymentTransactionService transactionService;
    private final ObjectMapper objectMapper;

    @RequestMapping(method = RequestMethod.POST, consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "JSON webhook", description = "Verifies and applies a JSON notification.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Accepted. Body is the acknowledgment the provider expects"),
            @ApiResponse(responseCode = "401", description = "Signature verification failed")
    })
    public ResponseEntity<?> handleJson(@PathVariable String entityType,
                                        @PathVariable String entityId,
                                        @PathVariable String provider,
                                        @RequestBody String rawBody,
                                        @RequestHeader(value = STRIPE_SIGNATURE_HEADER, required = false) String signature) {
        WebhookPayload payload = WebhookPayload.builder()
                .rawBody(rawBody)
                .fields(parseJson(rawBody))
                .build();
        return dispatch(entityType, entityId, provider, payload, signature);
    }

    @RequestMapping(method = {RequestMethod.POST, RequestMethod.GET})
    @Operation(summary = "Form webhook", description = "Verifies and applies a notification sent as form or query parameters.")
    public ResponseEntity<?> handleForm(@PathVariable String entityType,
                                        @PathVariable String entityId,
                                        @PathVariable String provider,
                                        @RequestParam MultiValueMap<String, String> params) {
        Map<String, Object> fields = new LinkedHashMap<>();
        params.forEach((name, values) -> {
            if (!values.isEmpty()) {
                fields.put(name, values.get(0));
            }
        });
        String rawBody = UriComponentsBuilder.newInstance().queryParams(params).build().getQuery();
        WebhookPayload payload = WebhookPayload.builder()
                .rawBody(rawBody)
                .fields(fields)
                .build();
        return dispatch(entityType, entityId, provider, payload, null);
    }

    private ResponseEntity<?> dispatch(String entityType, String entityId, String provider,
                                       WebhookPayload payload, String signature) {
        PaymentProviderType providerType = PaymentProviderType.fromValue(provider);
        WebhookResult result = transactionService.handleWebhook(
                PaymentEntityType.fromValue(entityType), entityId, providerType, payload, signature);
        log.debug("Webhook handled: provider={} entityId={} paymentId={} status={} applied={}",
                providerType.getWireName(), entityId, result.getPaymentId(), result.getStatus(), result.isApplied());
        if (result.getAcknowledgment() != null) {
            return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(result.getAcknowledgment());
        }
        return ResponseEntity.ok(Map.of("received", true));
    }

    private Map<String, Object> parseJson(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new IllegalArgumentException("Webhook body is empty");
        }
        try {
            return objectMapper.readValue(rawBody, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook body is not a JSON object", e);
        }
    }
}
