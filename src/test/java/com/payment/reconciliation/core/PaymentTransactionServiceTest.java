package com.payment.reconciliation.core;

import com.payment.reconciliation.crypto.PendingCryptoPaymentView;
import com.payment.reconciliation.domain.CreatePaymentCommand;
import com.payment.reconciliation.domain.EntityPaymentStatus;
import com.payment.reconciliation.domain.PaymentConfig;
import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentErrorCode;
import com.payment.reconciliation.domain.PaymentException;
import com.payment.reconciliation.domain.PaymentModuleSettings;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.PaymentStatus;
import com.payment.reconciliation.domain.PaymentTargetType;
import com.payment.reconciliation.domain.ProviderPaymentResult;
import com.payment.reconciliation.domain.ProviderRefundResult;
import com.payment.reconciliation.domain.ProviderStatusInfo;
import com.payment.reconciliation.domain.RefundStatus;
import com.payment.reconciliation.domain.WebhookData;
import com.payment.reconciliation.domain.WebhookPayload;
import com.payment.reconciliation.domain.WebhookResult;
import com.payment.reconciliation.messaging.PaymentDomainEvent;
import com.payment.reconciliation.messaging.PaymentEventPublisher;
import com.payment.reconciliation.messaging.PaymentEventType;
import com.payment.reconciliation.persistence.entity.PaymentEntity;
import com.payment.reconciliation.persistence.entity.StatusHistoryEntry;
import com.payment.reconciliation.persistence.repository.PaymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Engine tests against an in-memory payment table and a mocked provider adapter.
 */
class PaymentTransactionServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String SHOP = "shop-1";

    private final Map<String, PaymentEntity> table = new ConcurrentHashMap<>();

    private PaymentRepository repository;
    private PaymentConfigService configService;
    private IdempotencyService idempotencyService;
    private PaymentEventPublisher eventPublisher;
    private PaymentTargetGateway orderGateway;
    private PaymentProviderAdapter adapter;
    private PaymentTransactionService service;

    @BeforeEach
    void setUp() {
        repository = mock(PaymentRepository.class);
        when(repository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(table.get((String) inv.getArgument(0))));
        when(repository.saveAndFlush(any(PaymentEntity.class))).thenAnswer(inv -> store(inv.getArgument(0)));
        when(repository.save(any(PaymentEntity.class))).thenAnswer(inv -> store(inv.getArgument(0)));
        when(repository.findByProviderAndExternalId(any(), anyString())).thenAnswer(inv -> table.values().stream()
                .filter(p -> p.getProvider() == inv.getArgument(0) && p.getExternalId().equals(inv.getArgument(1)))
                .findFirst());

        configService = mock(PaymentConfigService.class);
        when(configService.getConfigInternal(PaymentEntityType.SHOP, SHOP)).thenReturn(config(true));

        adapter = mock(PaymentProviderAdapter.class);
        when(adapter.getType()).thenReturn(PaymentProviderType.ROBOKASSA);
        ProviderFactory providerFactory = mock(ProviderFactory.class);
        when(providerFactory.create(any(), any(), anyBoolean())).thenReturn(adapter);

        idempotencyService = mock(IdempotencyService.class);
        eventPublisher = mock(PaymentEventPublisher.class);
        orderGateway = mock(PaymentTargetGateway.class);
        when(orderGateway.getTargetType()).thenReturn(PaymentTargetType.ORDER);

        service = new PaymentTransactionService(
                repository,
                configService,
                providerFactory,
                new ProviderAdapterCache(),
                idempotencyService,
                eventPublisher,
                new PaymentLockRegistry(16),
                mock(PendingCryptoPaymentView.class),
                new TransactionTemplate(mock(PlatformTransactionManager.class)),
                Clock.fixed(NOW, ZoneOffset.UTC),
                List.of(orderGateway));
    }

    @Test
    void createdPaymentIsPendingWithOneHistoryEntry() {
        when(adapter.createPayment(any())).thenReturn(ProviderPaymentResult.builder()
                .externalId("777")
                .status(PaymentStatus.PENDING)
                .paymentUrl("https://auth.robokassa.ru/Merchant/Index.aspx?InvId=777")
                .build());

        PaymentEntity payment = service.createPayment(command("order-1", "1500"));

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(payment.getExternalId()).isEqualTo("777");
        assertThat(payment.getCurrency()).isEqualTo("RUB");
        assertThat(payment.getStatusHistory()).hasSize(1);
        assertThat(payment.getMetadata()).containsEntry("targetId", "order-1").containsEntry("entityType", "shop");
        assertThat(payment.getIdempotencyKey()).startsWith("robokassa_");
        verify(idempotencyService).remember(payment);
        verify(orderGateway).setPaymentStatus("order-1", payment.getId(), EntityPaymentStatus.PENDING);
        assertThat(publishedTypes()).containsExactly(PaymentEventType.PAYMENT_CREATED);
    }

    @Test
    void disabledTenantIsRejectedBeforeProviderCall() {
        when(configService.getConfigInternal(PaymentEntityType.SHOP, SHOP)).thenReturn(config(false));

        assertThatThrownBy(() -> service.createPayment(command("order-1", "1500")))
                .isInstanceOf(PaymentException.class)
                .hasMessage("Payments are disabled for shop shop-1");
        verify(adapter, never()).createPayment(any());
    }

    @Test
    void providerMustBeEnabledForTenant() {
        CreatePaymentCommand stripe = command("order-1", "1500").toBuilder().provider(PaymentProviderType.STRIPE).build();

        assertThatThrownBy(() -> service.createPayment(stripe))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getCode())
                .isEqualTo(PaymentErrorCode.INVALID_CONFIG);
    }

    @Test
    void amountAboveTenantMaximumIsRejected() {
        PaymentConfig limited = config(true).toBuilder()
                .settings(PaymentModuleSettings.builder().maxAmount(new BigDecimal("1000")).build())
                .build();
        when(configService.getConfigInternal(PaymentEntityType.SHOP, SHOP)).thenReturn(limited);

        assertThatThrownBy(() -> service.createPayment(command("order-1", "1500")))
                .isInstanceOf(PaymentException.class)
                .hasMessage("Amount must be at most 1000");
        verify(adapter, never()).createPayment(any());
    }

    @Test
    void amountFinerThanMinorUnitIsRejectedBeforeProviderCall() {
        assertThatThrownBy(() -> service.createPayment(command("order-1", "100.005")))
                .isInstanceOf(PaymentException.class)
                .hasMessage("Amount 100.005 has more than 2 decimal places for RUB")
                .extracting(e -> ((PaymentException) e).getCode())
                .isEqualTo(PaymentErrorCode.INVALID_AMOUNT);
        verify(adapter, never()).createPayment(any());
    }

    @Test
    void trailingZerosDoNotCountAsExtraPrecision() {
        when(adapter.createPayment(any())).thenReturn(ProviderPaymentResult.builder()
                .externalId("780").status(PaymentStatus.PENDING).build());

        PaymentEntity payment = service.createPayment(command("order-1", "1500.0000"));

        assertThat(payment.getAmount()).isEqualByComparingTo("1500");
    }

    @Test
    void repeatedIdempotencyKeyReturnsExistingPayment() {
        PaymentEntity existing = seed("777", PaymentStatus.PENDING);
        existing.setIdempotencyKey("client-key");
        when(idempotencyService.find(PaymentProviderType.ROBOKASSA, "client-key"))
                .thenReturn(Optional.of(IdempotencyService.toRecord(existing)));

        PaymentEntity result = service.createPayment(command("order-1", "1500").toBuilder()
                .idempotencyKey("client-key").build());

        assertThat(result.getId()).isEqualTo(existing.getId());
        verify(adapter, never()).createPayment(any());
    }

    @Test
    void successfulWebhookMarksPaymentPaid() {
        PaymentEntity payment = seed("777", PaymentStatus.PENDING);
        when(adapter.parseWebhook(any(), any())).thenReturn(webhook("777", PaymentStatus.SUCCEEDED));

        WebhookResult result = service.handleWebhook(PaymentEntityType.SHOP, SHOP, PaymentProviderType.ROBOKASSA,
                WebhookPayload.builder().rawBody("InvId=777").build(), null);

        assertThat(result.isApplied()).isTrue();
        assertThat(result.getAcknowledgment()).isEqualTo("OK777");
        PaymentEntity stored = table.get(payment.getId());
        assertThat(stored.getStatus()).isEqualTo(PaymentStatus.SUCCEEDED);
        assertThat(stored.getPaidAt()).isEqualTo(NOW);
        assertThat(stored.getStatusHistory()).hasSize(2);
        verify(orderGateway).setPaymentStatus("order-1", payment.getId(), EntityPaymentStatus.PAID);

        ArgumentCaptor<PaymentDomainEvent> event = ArgumentCaptor.forClass(PaymentDomainEvent.class);
        verify(eventPublisher).publish(event.capture());
        assertThat(event.getValue().getEventType()).isEqualTo(PaymentEventType.PAYMENT_SUCCEEDED);
        assertThat(event.getValue().getPreviousStatus()).isEqualTo(PaymentStatus.PENDING);
    }

    @Test
    void duplicateWebhookChangesNothingButRedeliversStatus() {
        PaymentEntity payment = seed("777", PaymentStatus.PENDING);
        when(adapter.parseWebhook(any(), any())).thenReturn(webhook("777", PaymentStatus.SUCCEEDED));
        WebhookPayload payload = WebhookPayload.builder().rawBody("InvId=777").build();

        service.handleWebhook(PaymentEntityType.SHOP, SHOP, PaymentProviderType.ROBOKASSA, payload, null);
        WebhookResult second = service.handleWebhook(PaymentEntityType.SHOP, SHOP, PaymentProviderType.ROBOKASSA, payload, null);

        assertThat(second.isApplied()).isFalse();
        assertThat(table.get(payment.getId()).getStatusHistory()).hasSize(2);
        verify(eventPublisher, times(1)).publish(any());
        verify(orderGateway, times(2)).setPaymentStatus("order-1", payment.getId(), EntityPaymentStatus.PAID);
    }

    @Test
    void lateStatusNeverRegressesPayment() {
        PaymentEntity payment = seed("777", PaymentStatus.SUCCEEDED);
        when(adapter.parseWebhook(any(), any())).thenReturn(webhook("777", PaymentStatus.PENDING));

        WebhookResult result = service.handleWebhook(PaymentEntityType.SHOP, SHOP, PaymentProviderType.ROBOKASSA,
                WebhookPayload.builder().rawBody("InvId=777").build(), null);

        assertThat(result.isApplied()).isFalse();
        assertThat(table.get(payment.getId()).getStatus()).isEqualTo(PaymentStatus.SUCCEEDED);
        verify(eventPublisher, never()).publish(any());
    }

    @Test
    void webhookForUnknownPaymentIsAcknowledged() {
        when(adapter.parseWebhook(any(), any())).thenReturn(webhook("999", PaymentStatus.SUCCEEDED));

        WebhookResult result = service.handleWebhook(PaymentEntityType.SHOP, SHOP, PaymentProviderType.ROBOKASSA,
                WebhookPayload.builder().rawBody("InvId=999").build(), null);

        assertThat(result.getPaymentId()).isNull();
        assertThat(result.isApplied()).isFalse();
        assertThat(result.getAcknowledgment()).isEqualTo("OK999");
    }

    @Test
    void webhookOnAnotherTenantsPathIsIgnored() {
        PaymentEntity payment = seed("777", PaymentStatus.PENDING);
        when(configService.getConfigInternal(PaymentEntityType.SHOP, "shop-2")).thenReturn(config(true).toBuilder()
                .entityId("shop-2").build());
        when(adapter.parseWebhook(any(), any())).thenReturn(webhook("777", PaymentStatus.SUCCEEDED));

        WebhookResult result = service.handleWebhook(PaymentEntityType.SHOP, "shop-2", PaymentProviderType.ROBOKASSA,
                WebhookPayload.builder().rawBody("InvId=777").build(), null);

        assertThat(result.isApplied()).isFalse();
        assertThat(table.get(payment.getId()).getStatus()).isEqualTo(PaymentStatus.PENDING);
    }

    @Test
    void partialThenFullRefund() {
        PaymentEntity payment = seed("777", PaymentStatus.SUCCEEDED);
        when(adapter.refund(any())).thenReturn(refund("r-1", "500"), refund("r-2", "1000"));

        PaymentEntity partial = service.refundPayment(payment.getId(), new BigDecimal("500"), "damaged item");

        assertThat(partial.getStatus()).isEqualTo(PaymentStatus.PARTIALLY_REFUNDED);
        assertThat(partial.getRefundedAmount()).isEqualByComparingTo("500");
        assertThat(partial.getRemainingAmount()).isEqualByComparingTo("1000");
        assertThat(partial.getRefunds()).hasSize(1);
        verify(orderGateway).setPaymentStatus("order-1", payment.getId(), EntityPaymentStatus.PARTIALLY_REFUNDED);

        PaymentEntity full = service.refundPayment(payment.getId(), null, null);

        assertThat(full.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        assertThat(full.getRemainingAmount()).isEqualByComparingTo("0");
        assertThat(full.getRefunds()).hasSize(2);
    }

    @Test
    void refundAboveRemainingAmountIsRejected() {
        PaymentEntity payment = seed("777", PaymentStatus.SUCCEEDED);

        assertThatThrownBy(() -> service.refundPayment(payment.getId(), new BigDecimal("2000"), null))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getCode())
                .isEqualTo(PaymentErrorCode.INVALID_AMOUNT);
        verify(adapter, never()).refund(any());
    }

    @Test
    void refundFinerThanMinorUnitIsRejected() {
        PaymentEntity payment = seed("777", PaymentStatus.SUCCEEDED);

        assertThatThrownBy(() -> service.refundPayment(payment.getId(), new BigDecimal("10.005"), null))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getCode())
                .isEqualTo(PaymentErrorCode.INVALID_AMOUNT);
        verify(adapter, never()).refund(any());
    }

    @Test
    void pendingRefundIsSettledWhenProviderReportsIt() {
        PaymentEntity payment = seed("777", PaymentStatus.SUCCEEDED);
        when(adapter.refund(any())).thenReturn(ProviderRefundResult.builder()
                .externalRefundId("r-1")
                .status(RefundStatus.PENDING)
                .amount(new BigDecimal("500"))
                .currency("RUB")
                .build());

        PaymentEntity afterRequest = service.refundPayment(payment.getId(), new BigDecimal("500"), "damaged item");

        assertThat(afterRequest.getStatus()).isEqualTo(PaymentStatus.SUCCEEDED);
        assertThat(afterRequest.getRefundedAmount()).isEqualByComparingTo("0");
        assertThat(afterRequest.getRefunds()).extracting(r -> r.getStatus()).containsExactly(RefundStatus.PENDING);

        assertThatThrownBy(() -> service.refundPayment(payment.getId(), new BigDecimal("1500"), null))
                .isInstanceOf(PaymentException.class)
                .hasMessage("Refund amount must be positive and at most 1000");

        Map<String, Object> reported = new HashMap<>();
        reported.put("refundedAmount", "500.00");
        when(adapter.parseWebhook(any(), any())).thenReturn(WebhookData.builder()
                .event("refund.succeeded")
                .externalId("777")
                .status(PaymentStatus.PARTIALLY_REFUNDED)
                .metadata(reported)
                .acknowledgment("OK777")
                .build());

        service.handleWebhook(PaymentEntityType.SHOP, SHOP, PaymentProviderType.ROBOKASSA,
                WebhookPayload.builder().rawBody("{}").build(), null);

        PaymentEntity stored = table.get(payment.getId());
        assertThat(stored.getStatus()).isEqualTo(PaymentStatus.PARTIALLY_REFUNDED);
        assertThat(stored.getRefundedAmount()).isEqualByComparingTo("500");
        assertThat(stored.getRefunds()).hasSize(1);
        assertThat(stored.getRefunds().get(0).getStatus()).isEqualTo(RefundStatus.SUCCEEDED);
        assertThat(stored.getRefunds().get(0).getExternalRefundId()).isEqualTo("r-1");
        assertThat(stored.getRefunds().get(0).isProviderReported()).isFalse();
    }

    @Test
    void reportedFullRefundSettlesPendingAndRecordsTheRest() {
        PaymentEntity payment = seed("777", PaymentStatus.SUCCEEDED);
        when(adapter.refund(any())).thenReturn(ProviderRefundResult.builder()
                .externalRefundId("r-1").status(RefundStatus.PENDING).amount(new BigDecimal("500")).build());
        service.refundPayment(payment.getId(), new BigDecimal("500"), null);
        when(adapter.parseWebhook(any(), any())).thenReturn(webhook("777", PaymentStatus.REFUNDED));

        service.handleWebhook(PaymentEntityType.SHOP, SHOP, PaymentProviderType.ROBOKASSA,
                WebhookPayload.builder().rawBody("InvId=777").build(), null);

        PaymentEntity stored = table.get(payment.getId());
        assertThat(stored.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        assertThat(stored.getRefundedAmount()).isEqualByComparingTo("1500");
        assertThat(stored.getRefunds()).hasSize(2);
        assertThat(stored.getRefunds()).allMatch(r -> r.getStatus() == RefundStatus.SUCCEEDED);
        assertThat(stored.getRefunds()).filteredOn(r -> r.isProviderReported())
                .extracting(r -> r.getAmount().stripTrailingZeros().toPlainString())
                .containsExactly("1000");
    }

    @Test
    void concurrentWebhookAndPollApplyOneTransition() throws Exception {
        PaymentEntity payment = seed("777", PaymentStatus.PENDING);
        when(adapter.parseWebhook(any(), any())).thenReturn(webhook("777", PaymentStatus.SUCCEEDED));
        when(adapter.getPaymentStatus("777")).thenReturn(ProviderStatusInfo.builder()
                .externalId("777").status(PaymentStatus.SUCCEEDED).build());
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        doAnswer(inv -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(50);
            inFlight.decrementAndGet();
            return null;
        }).when(orderGateway).setPaymentStatus(anyString(), anyString(), any());

        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> webhook = pool.submit(() -> {
                ready.countDown();
                start.await();
                return service.handleWebhook(PaymentEntityType.SHOP, SHOP, PaymentProviderType.ROBOKASSA,
                        WebhookPayload.builder().rawBody("InvId=777").build(), null);
            });
            Future<?> poll = pool.submit(() -> {
                ready.countDown();
                start.await();
                return service.checkPaymentStatus(payment.getId());
            });
            assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
            start.countDown();
            webhook.get(5, TimeUnit.SECONDS);
            poll.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        PaymentEntity stored = table.get(payment.getId());
        assertThat(stored.getStatus()).isEqualTo(PaymentStatus.SUCCEEDED);
        assertThat(stored.getStatusHistory()).hasSize(2);
        assertThat(maxInFlight.get()).isEqualTo(1);
        ArgumentCaptor<PaymentDomainEvent> events = ArgumentCaptor.forClass(PaymentDomainEvent.class);
        verify(eventPublisher, times(1)).publish(events.capture());
        assertThat(events.getValue().getEventType()).isEqualTo(PaymentEventType.PAYMENT_SUCCEEDED);
    }

    @Test
    void pendingPaymentCannotBeRefunded() {
        PaymentEntity payment = seed("777", PaymentStatus.PENDING);

        assertThatThrownBy(() -> service.refundPayment(payment.getId(), null, null))
                .isInstanceOf(PaymentException.class)
                .hasMessage("Cannot move payment from pending to refunded");
    }

    @Test
    void strictUpdateRejectsDisallowedMove() {
        seed("777", PaymentStatus.SUCCEEDED);

        assertThatThrownBy(() -> service.updatePaymentStatus(PaymentProviderType.ROBOKASSA, "777",
                PaymentStatus.CANCELED, "manual", null))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getCode())
                .isEqualTo(PaymentErrorCode.INVALID_STATE_TRANSITION);
    }

    @Test
    void strictUpdateOfCurrentStatusIsNoOp() {
        PaymentEntity payment = seed("777", PaymentStatus.PENDING);

        PaymentEntity result = service.updatePaymentStatus(PaymentProviderType.ROBOKASSA, "777",
                PaymentStatus.PENDING, "again", null);

        assertThat(result.getStatusHistory()).hasSize(1);
        assertThat(table.get(payment.getId()).getStatus()).isEqualTo(PaymentStatus.PENDING);
    }

    @Test
    void cancelRecordsUserReason() {
        PaymentEntity payment = seed("777", PaymentStatus.PENDING);
        when(adapter.cancelPayment("777")).thenReturn(ProviderStatusInfo.builder()
                .externalId("777").status(PaymentStatus.CANCELED).build());

        PaymentEntity canceled = service.cancelPayment(payment.getId());

        assertThat(canceled.getStatus()).isEqualTo(PaymentStatus.CANCELED);
        assertThat(canceled.getCanceledAt()).isEqualTo(NOW);
        assertThat(lastHistory(canceled).getReason()).isEqualTo("canceled by user");
        verify(orderGateway).setPaymentStatus("order-1", payment.getId(), EntityPaymentStatus.FAILED);
    }

    @Test
    void pollingReconcilesProviderStatus() {
        PaymentEntity payment = seed("777", PaymentStatus.PENDING);
        Instant paidAt = NOW.minusSeconds(90);
        when(adapter.getPaymentStatus("777")).thenReturn(ProviderStatusInfo.builder()
                .externalId("777").status(PaymentStatus.SUCCEEDED).paidAt(paidAt).build());

        PaymentEntity checked = service.checkPaymentStatus(payment.getId());

        assertThat(checked.getStatus()).isEqualTo(PaymentStatus.SUCCEEDED);
        assertThat(checked.getPaidAt()).isEqualTo(paidAt);
        assertThat(lastHistory(checked).getReason()).isEqualTo("status check");
    }

    @Test
    void terminalPaymentIsNotPolled() {
        PaymentEntity payment = seed("777", PaymentStatus.REFUNDED);

        service.checkPaymentStatus(payment.getId());

        verify(adapter, never()).getPaymentStatus(any());
    }

    @Test
    void expiredCryptoInvoiceIsCanceled() {
        PaymentEntity payment = seed("TXYZ-1", PaymentStatus.PENDING);
        payment.setProvider(PaymentProviderType.CRYPTO_TRC20);

        PaymentEntity expired = service.expireCryptoPayment(payment.getId());

        assertThat(expired.getStatus()).isEqualTo(PaymentStatus.CANCELED);
        assertThat(expired.getMetadata()).containsEntry("reason", "expired");
        assertThat(lastHistory(expired).getReason()).isEqualTo("expired");
    }

    @Test
    void confirmedTransferSettlesCryptoInvoice() {
        PaymentEntity payment = seed("TXYZ-2", PaymentStatus.PENDING);
        payment.setProvider(PaymentProviderType.CRYPTO_TRC20);
        Instant blockTime = NOW.minusSeconds(30);

        PaymentEntity paid = service.confirmCryptoPayment(payment.getId(), "abc123", blockTime, new BigDecimal("16.1842"));

        assertThat(paid.getStatus()).isEqualTo(PaymentStatus.SUCCEEDED);
        assertThat(paid.getOnChainTransactionId()).isEqualTo("abc123");
        assertThat(paid.getPaidAt()).isEqualTo(blockTime);
        assertThat(paid.getMetadata()).containsEntry("receivedAmount", "16.1842");
    }

    @Test
    void targetPaymentChargesAmountOwed() {
        when(orderGateway.amountOwed("order-9")).thenReturn(Optional.of(new BigDecimal("2490")));
        when(orderGateway.ownerId("order-9")).thenReturn(Optional.of("owner-1"));
        when(adapter.createPayment(any())).thenReturn(ProviderPaymentResult.builder()
                .externalId("778").status(PaymentStatus.PENDING).build());

        PaymentEntity payment = service.createTargetPayment(PaymentEntityType.SHOP, SHOP, PaymentTargetType.ORDER,
                "order-9", PaymentProviderType.ROBOKASSA, null, null, null, null);

        assertThat(payment.getAmount()).isEqualByComparingTo("2490");
        assertThat(payment.getDescription()).isEqualTo("Payment for order order-9");
    }

    @Test
    void targetOfAnotherOwnerIsDenied() {
        when(orderGateway.amountOwed("order-9")).thenReturn(Optional.of(new BigDecimal("2490")));
        when(orderGateway.ownerId("order-9")).thenReturn(Optional.of("someone-else"));

        assertThatThrownBy(() -> service.createTargetPayment(PaymentEntityType.SHOP, SHOP, PaymentTargetType.ORDER,
                "order-9", PaymentProviderType.ROBOKASSA, null, null, null, null))
                .isInstanceOf(PaymentException.class)
                .hasMessage("Order order-9 does not belong to this shop");
        verify(adapter, never()).createPayment(any());
    }

    @Test
    void targetTypeWithoutGatewayIsRejected() {
        assertThatThrownBy(() -> service.createTargetPayment(PaymentEntityType.SHOP, SHOP, PaymentTargetType.BOOKING,
                "b-1", PaymentProviderType.ROBOKASSA, null, null, null, null))
                .isInstanceOf(PaymentException.class)
                .hasMessage("Payments are not available for booking targets");
    }

    private PaymentEntity store(PaymentEntity payment) {
        table.put(payment.getId(), payment);
        return payment;
    }

    private PaymentEntity seed(String externalId, PaymentStatus status) {
        PaymentEntity payment = PaymentEntity.builder()
                .id("pay-" + externalId)
                .externalId(externalId)
                .provider(PaymentProviderType.ROBOKASSA)
                .entityType(PaymentEntityType.SHOP)
                .entityId(SHOP)
                .targetType(PaymentTargetType.ORDER)
                .targetId("order-1")
                .amount(new BigDecimal("1500"))
                .currency("RUB")
                .status(status)
                .createdAt(NOW.minusSeconds(600))
                .build();
        payment.getStatusHistory().add(StatusHistoryEntry.builder()
                .status(status)
                .changedAt(NOW.minusSeconds(600))
                .reason("seed")
                .build());
        return store(payment);
    }

    private static PaymentConfig config(boolean enabled) {
        return PaymentConfig.builder()
                .entityType(PaymentEntityType.SHOP)
                .entityId(SHOP)
                .ownerId("owner-1")
                .enabled(enabled)
                .testMode(false)
                .settings(PaymentModuleSettings.defaults())
                .providers(List.of("robokassa", "crypto_trc20"))
                .providerSettings(Map.of(
                        "robokassa", Map.of("merchantLogin", "demo-shop", "password1", "password-one", "password2", "password-two"),
                        "crypto_trc20", Map.of("walletAddress", "TXYZ")))
                .build();
    }

    private static CreatePaymentCommand command(String targetId, String amount) {
        return CreatePaymentCommand.builder()
                .entityType(PaymentEntityType.SHOP)
                .entityId(SHOP)
                .targetType(PaymentTargetType.ORDER)
                .targetId(targetId)
                .provider(PaymentProviderType.ROBOKASSA)
                .amount(new BigDecimal(amount))
                .build();
    }

    private static WebhookData webhook(String externalId, PaymentStatus status) {
        return WebhookData.builder()
                .event("result")
                .externalId(externalId)
                .status(status)
                .acknowledgment("OK" + externalId)
                .build();
    }

    private static ProviderRefundResult refund(String id, String amount) {
        return ProviderRefundResult.builder()
                .externalRefundId(id)
                .status(RefundStatus.SUCCEEDED)
                .amount(new BigDecimal(amount))
                .currency("RUB")
                .build();
    }

    private static StatusHistoryEntry lastHistory(PaymentEntity payment) {
        return payment.getStatusHistory().get(payment.getStatusHistory().size() - 1);
    }

    private List<PaymentEventType> publishedTypes() {
        ArgumentCaptor<PaymentDomainEvent> events = ArgumentCaptor.forClass(PaymentDomainEvent.class);
        verify(eventPublisher).publish(events.capture());
        return events.getAllValues().stream().map(PaymentDomainEvent::getEventType).collect(Collectors.toList());
    }
}
