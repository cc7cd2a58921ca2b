package com.payment.reconciliation.persistence.entity;

import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.PaymentStatus;
import com.payment.reconciliation.domain.PaymentTargetType;
import com.payment.reconciliation.persistence.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One attempt to collect money through a provider. Status changes only
 * through the transaction service; {@link #statusHistory} is append-only and
 * its last entry always equals {@link #status}.
 */
@Entity
@Table(name = "payments",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_payment_provider_external_id", columnNames = {"provider", "external_id"}),
        @UniqueConstraint(name = "uk_payment_on_chain_tx", columnNames = {"on_chain_transaction_id"})
    },
    indexes = {
        @Index(name = "idx_payment_entity_status", columnList = "entity_type, entity_id, status"),
        @Index(name = "idx_payment_target", columnList = "target_type, target_id"),
        @Index(name = "idx_payment_provider_status", columnList = "provider, status"),
        @Index(name = "idx_payment_provider_reference", columnList = "provider, provider_reference"),
        @Index(name = "idx_payment_idempotency_key", columnList = "idempotency_key"),
        @Index(name = "idx_payment_created_at", columnList = "created_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, length = 32)
    private PaymentProviderType provider;

    /** Secondary provider id (e.g. the payment intent behind a checkout session). */
    @Column(name = "provider_reference")
    private String providerReference;

    @Column(name = "idempotency_key")
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 32)
    private PaymentEntityType entityType;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_type", nullable = false, length = 32)
    private PaymentTargetType targetType;

    @Column(name = "target_id", nullable = false)
    private String targetId;

    @Column(name = "owner_id")
    private String ownerId;

    @Column(name = "amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 8)
    private String currency;

    @Builder.Default
    @Column(name = "refunded_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal refundedAmount = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private PaymentStatus status;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "payment_url", length = 2000)
    private String paymentUrl;

    @Column(name = "test_mode", nullable = false)
    private boolean testMode;

    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", length = 8000)
    private Map<String, Object> metadata = new HashMap<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "payment_status_history", joinColumns = @JoinColumn(name = "payment_id"))
    @OrderColumn(name = "position")
    private List<StatusHistoryEntry> statusHistory = new ArrayList<>();

    @Builder.Default
    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @JoinColumn(name = "payment_id")
    @OrderColumn(name = "position")
    private List<PaymentRefundEntity> refunds = new ArrayList<>();

    /** Transfer that settled an on-chain payment; unique so one transfer settles one invoice. */
    @Column(name = "on_chain_transaction_id")
    private String onChainTransactionId;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "canceled_at")
    private Instant canceledAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "error_code", length = 64)
    private String errorCode;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Transient
    public BigDecimal getRemainingAmount() {
        return amount.subtract(refundedAmount != null ? refundedAmount : BigDecimal.ZERO);
    }

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
