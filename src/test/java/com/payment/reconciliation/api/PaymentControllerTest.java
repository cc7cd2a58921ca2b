package com.payment.reconciliation.api;

import com.payment.reconciliation.core.PaymentTransactionService;
import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.PaymentStatus;
import com.payment.reconciliation.domain.PaymentTargetType;
import com.payment.reconciliation.persistence.entity.PaymentEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for PaymentController using MockMvc.
 */
@WebMvcTest(controllers = PaymentController.class)
class PaymentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PaymentTransactionService transactionService;

    @Test
    void createReturnsPaymentWithProviderUrl() throws Exception {
        when(transactionService.createPayment(any())).thenReturn(payment(PaymentStatus.PENDING));

        mockMvc.perform(post("/api/v1/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "entityType": "shop",
                                  "entityId": "shop-1",
                                  "targetType": "order",
                                  "targetId": "order-1",
                                  "provider": "robokassa",
                                  "amount": 1500,
                                  "currency": "RUB"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("pay-1"))
                .andExpect(jsonPath("$.provider").value("robokassa"))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.remainingAmount").value(1500))
                .andExpect(jsonPath("$.paymentUrl").value("https://auth.robokassa.ru/Merchant/Index.aspx?InvId=777"));
    }

    @Test
    void createRejectsMissingFields() throws Exception {
        mockMvc.perform(post("/api/v1/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "entityType": "shop",
                                  "targetType": "order",
                                  "targetId": "order-1",
                                  "provider": "robokassa",
                                  "amount": 0
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.entityId").value("entityId is required"))
                .andExpect(jsonPath("$.details.amount").value("amount must be positive"));

        verify(transactionService, never()).createPayment(any());
    }

    @Test
    void createRejectsUnknownProvider() throws Exception {
        mockMvc.perform(post("/api/v1/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "entityType": "shop",
                                  "entityId": "shop-1",
                                  "targetType": "order",
                                  "targetId": "order-1",
                                  "provider": "paypal",
                                  "amount": 10
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void declinedPaymentMapsTo402() throws Exception {
        when(transactionService.createPayment(any())).thenThrow(new PaymentException(
                PaymentErrorCode.PAYMENT_DECLINED, "Card declined", PaymentProviderType.STRIPE));

        mockMvc.perform(post("/api/v1/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "entityType": "shop",
                                  "entityId": "shop-1",
                                  "targetType": "order",
                                  "targetId": "order-1",
                                  "provider": "stripe",
                                  "amount": 10,
                                  "currency": "USD"
                                }
                                """))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.error").value("PAYMENT_DECLINED"))
                .andExpect(jsonPath("$.provider").value("stripe"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void targetPaymentParsesPathTypes() throws Exception {
        when(transactionService.createTargetPayment(eq(PaymentEntityType.SHOP), eq("shop-1"), eq(PaymentTargetType.ORDER),
                eq("order-1"), eq(PaymentProviderType.ROBOKASSA), isNull(), isNull(), isNull(), isNull()))
                .thenReturn(payment(PaymentStatus.PENDING));

        mockMvc.perform(post("/api/v1/payments/shop/shop-1/targets/order/order-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\": \"robokassa\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.targetId").value("order-1"));
    }

    @Test
    void unknownPaymentIs404() throws Exception {
        when(transactionService.getPayment("missing")).thenThrow(PaymentException.notFound("Payment missing"));

        mockMvc.perform(get("/api/v1/payments/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("PAYMENT_NOT_FOUND"));
    }

    @Test
    void listFiltersByStatus() throws Exception {
        when(transactionService.getPaymentsByEntity(PaymentEntityType.SHOP, "shop-1", PaymentStatus.SUCCEEDED, 0, 20))
                .thenReturn(new PageImpl<>(List.of(payment(PaymentStatus.SUCCEEDED)), PageRequest.of(0, 20), 1));

        mockMvc.perform(get("/api/v1/payments/entity/shop/shop-1").param("status", "succeeded"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.content[0].status").value("succeeded"));
    }

    @Test
    void refundWithoutBodyRefundsEverything() throws Exception {
        when(transactionService.refundPayment("pay-1", null, null)).thenReturn(payment(PaymentStatus.REFUNDED));

        mockMvc.perform(post("/api/v1/payments/pay-1/refund"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("refunded"));
    }

    @Test
    void partialRefundPassesAmount() throws Exception {
        when(transactionService.refundPayment("pay-1", new BigDecimal("500"), "damaged"))
                .thenReturn(payment(PaymentStatus.PARTIALLY_REFUNDED));

        mockMvc.perform(post("/api/v1/payments/pay-1/refund")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 500, \"reason\": \"damaged\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("partially_refunded"));
    }

    @Test
    void cancelOfSettledPaymentIs409() throws Exception {
        when(transactionService.cancelPayment("pay-1"))
                .thenThrow(PaymentException.invalidTransition(PaymentStatus.SUCCEEDED, PaymentStatus.CANCELED));

        mockMvc.perform(post("/api/v1/payments/pay-1/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_STATE_TRANSITION"))
                .andExpect(jsonPath("$.message").value("Cannot move payment from succeeded to canceled"));
    }

    private static PaymentEntity payment(PaymentStatus status) {
        return PaymentEntity.builder()
                .id("pay-1")
                .externalId("777")
                .provider(PaymentProviderType.ROBOKASSA)
                .entityType(PaymentEntityType.SHOP)
                .entityId("shop-1")
                .targetType(PaymentTargetType.ORDER)
                .targetId("order-1")
                .amount(new BigDecimal("1500"))
                .currency("RUB")
                .status(status)
                .paymentUrl("https://auth.robokassa.ru/Merchant/Index.aspx?InvId=777")
                .createdAt(Instant.parse("2024-05-01T12:00:00Z"))
                .build();
    }
}
