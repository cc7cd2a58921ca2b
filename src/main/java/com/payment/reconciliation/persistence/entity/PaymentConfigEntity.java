package com.payment.reconciliation.persistence.entity;

import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentModuleSettings;
import com.payment.reconciliation.persistence.converter.ModuleSettingsConverter;
import com.payment.reconciliation.persistence.converter.ProviderSettingsConverter;
import com.payment.reconciliation.persistence.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Payment settings of one tenant entity. Secret fields inside
 * {@link #providerSettings} are stored encrypted.
 */
@Entity
@Table(name = "payment_configs",
    uniqueConstraints = @UniqueConstraint(name = "uk_payment_config_entity", columnNames = {"entity_type", "entity_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentConfigEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 32)
    private PaymentEntityType entityType;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Column(name = "owner_id")
    private String ownerId;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Builder.Default
    @Column(name = "test_mode", nullable = false)
    private boolean testMode = true;

    @Builder.Default
    @Convert(converter = ModuleSettingsConverter.class)
    @Column(name = "settings", length = 4000)
    private PaymentModuleSettings settings = PaymentModuleSettings.defaults();

    /** Wire names of the providers the tenant has activated. */
    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(name = "providers", length = 1000)
    private List<String> providers = new ArrayList<>();

    @Builder.Default
    @Convert(converter = ProviderSettingsConverter.class)
    @Column(name = "provider_settings", length = 16000)
    private Map<String, Map<String, Object>> providerSettings = new HashMap<>();

    @Version
    @Column(name = "version")
    private Long version;

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
