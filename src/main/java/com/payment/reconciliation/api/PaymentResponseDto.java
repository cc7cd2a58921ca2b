package com.payment.reconciliation.api;

import com.payment.reconciliation.domain.PaymentStatus;
import com.payment.reconciliation.domain.RefundStatus;
import com.payment.reconciliation.persistence.entity.PaymentEntity;
import com.payment.reconciliation.persistence.entity.PaymentRefundEntity;
import com.payment.reconciliation.persistence.entity.StatusHistoryEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST view of a payment.
 */
@Value
@Builder
public class PaymentResponseDto {

    String id;
    String externalId;
    String provider;
    String entityType;
    String entityId;
    String targetType;
    String targetId;
    BigDecimal amount;
    String currency;
    BigDecimal refundedAmount;
    BigDecimal remainingAmount;
    PaymentStatus status;
    String description;
    String paymentUrl;
    boolean testMode;
    Map<String, Object> metadata;
    List<StatusChange> statusHistory;
    List<Refund> refunds;
    String onChainTransactionId;
    Instant paidAt;
    Instant canceledAt;
    Instant expiresAt;
    Instant createdAt;
    Instant updatedAt;

    public static PaymentResponseDto from(PaymentEntity payment) {
        if (payment == null) {
            throw new IllegalArgumentException("Payment cannot be null");
        }
        return PaymentResponseDto.builder()
                .id(payment.getId())
                .externalId(payment.getExternalId())
                .provider(payment.getProvider().getWireName())
                .entityType(payment.getEntityType().getValue())
                .entityId(payment.getEntityId())
                .targetType(payment.getTargetType().getValue())
                .targetId(payment.getTargetId())
                .amount(payment.getAmount())
                .currency(payment.getCurrency())
                .refundedAmount(payment.getRefundedAmount())
                .remainingAmount(payment.getRemainingAmount())
                .status(payment.getStatus())
                .description(payment.getDescription())
                .paymentUrl(payment.getPaymentUrl())
                .testMode(payment.isTestMode())
                .metadata(payment.getMetadata())
                .statusHistory(payment.getStatusHistory().stream().map(StatusChange::from).collect(Collectors.toList()))
                .refunds(payment.getRefunds().stream().map(Refund::from).collect(Collectors.toList()))
                .onChainTransactionId(payment.getOnChainTransactionId())
                .paidAt(payment.getPaidAt())
                .canceledAt(payment.getCanceledAt())
                .expiresAt(payment.getExpiresAt())
                .createdAt(payment.getCreatedAt())
                .updatedAt(payment.getUpdatedAt())
                .build();
    }

    @Value
    public static class StatusChange {
        PaymentStatus status;
        PaymentStatus previousStatus;
        Instant changedAt;
        String reason;

        static StatusChange from(StatusHistoryEntry entry) {
            return new StatusChange(entry.getStatus(), entry.getPreviousStatus(), entry.getChangedAt(), entry.getReason());
        }
    }

    @Value
    public static class Refund {
        String id;
        String externalRefundId;
        BigDecimal amount;
        RefundStatus status;
        String reason;
        boolean providerReported;
        Instant createdAt;

        static Refund from(PaymentRefundEntity refund) {
            return new Refund(refund.getId(), refund.getExternalRefundId(), refund.getAmount(), refund.getStatus(),
                    refund.getReason(), refund.isProviderReported(), refund.getCreatedAt());
        }
    }
}
