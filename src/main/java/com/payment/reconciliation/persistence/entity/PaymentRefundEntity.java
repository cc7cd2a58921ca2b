package com.payment.reconciliation.persistence.entity;

import com.payment.reconciliation.domain.RefundStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A refund against a payment, initiated here or reported by the provider.
 */
@Entity
@Table(name = "payment_refunds", indexes = {
    @Index(name = "idx_refund_payment_id", columnList = "payment_id"),
    @Index(name = "idx_refund_external_id", columnList = "external_refund_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRefundEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "external_refund_id")
    private String externalRefundId;

    @Column(name = "amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RefundStatus status;

    @Column(name = "reason", length = 500)
    private String reason;

    /** True when the refund was observed from the provider rather than requested through the engine. */
    @Column(name = "provider_reported", nullable = false)
    private boolean providerReported;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
