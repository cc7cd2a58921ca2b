package com.payment.reconciliation.adapters;

import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentStatus;
import com.payment.reconciliation.domain.ProviderPaymentRequest;
import com.payment.reconciliation.domain.ProviderPaymentResult;
import com.payment.reconciliation.domain.ProviderRefundRequest;
import com.payment.reconciliation.domain.ProviderRefundResult;
import com.payment.reconciliation.domain.RefundStatus;
import com.payment.reconciliation.domain.WebhookData;
import com.payment.reconciliation.domain.WebhookPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TinkoffAdapterTest {

    private static final String SANDBOX = AdapterTestSupport.BASE_URL + "/tinkoff-test";

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private MockRestServiceServer server;
    private TinkoffAdapter adapter;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        TinkoffSettings settings = TinkoffSettings.builder()
                .terminalKey("1700000000DEMO")
                .secretKey("tinkoff-secret-1")
                .build();
        adapter = new TinkoffAdapter(settings, AdapterTestSupport.endpoints(), restTemplate,
                AdapterTestSupport.singleAttemptExecutor(), Clock.fixed(NOW, ZoneOffset.UTC), true);
    }

    @Test
    void initSendsAmountInKopecksWithToken() {
        server.expect(requestTo(SANDBOX + "/Init"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.TerminalKey").value("1700000000DEMO"))
                .andExpect(jsonPath("$.Amount").value(150000))
                .andExpect(jsonPath("$.OrderId").value("order-42"))
                .andExpect(jsonPath("$.Token").exists())
                .andRespond(withSuccess("""
                        {"Success":true,"ErrorCode":"0","Status":"NEW","PaymentId":"3093639567",
                         "PaymentURL":"https://securepay.tinkoff.ru/new/abc"}
                        """, MediaType.APPLICATION_JSON));

        ProviderPaymentResult result = adapter.createPayment(ProviderPaymentRequest.builder()
                .amount(new BigDecimal("1500.00"))
                .currency("RUB")
                .orderId("order-42")
                .build());

        assertThat(result.getExternalId()).isEqualTo("3093639567");
        assertThat(result.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(result.getPaymentUrl()).isEqualTo("https://securepay.tinkoff.ru/new/abc");
        server.verify();
    }

    @Test
    void rejectedInitBecomesProviderError() {
        server.expect(requestTo(SANDBOX + "/Init"))
                .andRespond(withSuccess("""
                        {"Success":false,"ErrorCode":"9999","Message":"Internal error","Details":"try later"}
                        """, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> adapter.createPayment(ProviderPaymentRequest.builder()
                .amount(BigDecimal.TEN).currency("RUB").orderId("o1").build()))
                .isInstanceOf(PaymentException.class)
                .hasMessage("Internal error: try later");
    }

    @Test
    void signedNotificationIsParsedAndAcknowledgedWithOk() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("TerminalKey", "1700000000DEMO");
        fields.put("OrderId", "order-42");
        fields.put("Success", true);
        fields.put("Status", "CONFIRMED");
        fields.put("PaymentId", 3093639567L);
        fields.put("ErrorCode", "0");
        fields.put("Amount", 150000);
        fields.put("Token", adapter.token(fields));

        WebhookData data = adapter.parseWebhook(WebhookPayload.builder().fields(fields).build(), null);

        assertThat(data.getExternalId()).isEqualTo("3093639567");
        assertThat(data.getStatus()).isEqualTo(PaymentStatus.SUCCEEDED);
        assertThat(data.getAmount()).isEqualByComparingTo("1500.00");
        assertThat(data.getAcknowledgment()).isEqualTo("OK");
    }

    @Test
    void uppercaseTokenIsAcceptedRegardlessOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("TerminalKey", "1700000000DEMO");
            fields.put("Status", "CONFIRMED");
            fields.put("PaymentId", "3093639567");
            fields.put("Token", adapter.token(fields).toUpperCase(Locale.ROOT));

            WebhookData data = adapter.parseWebhook(WebhookPayload.builder().fields(fields).build(), null);

            assertThat(data.getEvent()).isEqualTo("payment.confirmed");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void partialRefundIdComesFromInjectedClock() {
        server.expect(requestTo(SANDBOX + "/Cancel"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.Amount").value(50000))
                .andRespond(withSuccess("""
                        {"Success":true,"ErrorCode":"0","Status":"PARTIAL_REFUNDED","PaymentId":"3093639567",
                         "OriginalAmount":150000,"NewAmount":100000}
                        """, MediaType.APPLICATION_JSON));

        ProviderRefundResult result = adapter.refund(ProviderRefundRequest.builder()
                .externalPaymentId("3093639567")
                .amount(new BigDecimal("500.00"))
                .currency("RUB")
                .build());

        assertThat(result.getExternalRefundId()).isEqualTo("3093639567_" + NOW.toEpochMilli());
        assertThat(result.getStatus()).isEqualTo(RefundStatus.SUCCEEDED);
        assertThat(result.getAmount()).isEqualByComparingTo("500.00");
        server.verify();
    }

    @Test
    void tamperedNotificationIsRejected() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("TerminalKey", "1700000000DEMO");
        fields.put("Status", "CONFIRMED");
        fields.put("PaymentId", "3093639567");
        fields.put("Amount", 150000);
        fields.put("Token", adapter.token(fields));
        fields.put("Amount", 1);

        assertThatThrownBy(() -> adapter.parseWebhook(WebhookPayload.builder().fields(fields).build(), null))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getCode())
                .isEqualTo(PaymentErrorCode.WEBHOOK_VERIFICATION_FAILED);
    }

    @Test
    void mapsGatewayStatuses() {
        assertThat(TinkoffAdapter.mapStatus("AUTHORIZED")).isEqualTo(PaymentStatus.WAITING_FOR_CAPTURE);
        assertThat(TinkoffAdapter.mapStatus("PARTIAL_REFUNDED")).isEqualTo(PaymentStatus.PARTIALLY_REFUNDED);
        assertThat(TinkoffAdapter.mapStatus("REJECTED")).isEqualTo(PaymentStatus.FAILED);
        assertThat(TinkoffAdapter.mapStatus("DEADLINE_EXPIRED")).isEqualTo(PaymentStatus.CANCELED);
        assertThat(TinkoffAdapter.mapStatus("FORM_SHOWED")).isEqualTo(PaymentStatus.PENDING);
    }

    @Test
    void tokenIgnoresNestedObjects() {
        Map<String, Object> flat = new LinkedHashMap<>();
        flat.put("TerminalKey", "1700000000DEMO");
        flat.put("Amount", 100);
        Map<String, Object> nested = new LinkedHashMap<>(flat);
        nested.put("DATA", Map.of("Email", "a@b.c"));

        assertThat(adapter.token(nested)).isEqualTo(adapter.token(flat));
    }
}
