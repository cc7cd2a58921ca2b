package com.payment.reconciliation.core;

import com.payment.reconciliation.domain.PaymentConfig;
import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Adapters keyed by (tenant, provider, test mode). Owned by the transaction
 * service.
 * <p>
 * Each entry remembers the config revision (version and update time) it was
 * built from, and is served only to callers holding that same revision. A
 * caller that read the config just before a save can therefore not leave an
 * adapter with superseded credentials behind for later callers.
 * {@link #invalidate} drops a tenant's entries once its config is saved or deleted.
 */
@Slf4j
@Component
public class ProviderAdapterCache {

    private final Map<Key, Entry> adapters = new ConcurrentHashMap<>();

    public PaymentProviderAdapter get(PaymentConfig config, PaymentProviderType provider, boolean testMode,
                                      Supplier<PaymentProviderAdapter> factory) {
        Key key = new Key(config.getEntityType(), config.getEntityId(), provider, testMode);
        String revision = revisionOf(config);
        Entry entry = adapters.compute(key, (k, current) -> {
            if (current != null && current.revision.equals(revision)) {
                return current;
            }
            if (current != null) {
                log.debug("Rebuilding adapter for new config revision: entityType={} entityId={} provider={} revision={}",
                        k.entityType.getValue(), k.entityId, provider.getWireName(), revision);
            }
            return new Entry(revision, factory.get());
        });
        return entry.adapter;
    }

    public void invalidate(PaymentEntityType entityType, String entityId) {
        int before = adapters.size();
        adapters.keySet().removeIf(k -> k.entityType == entityType && k.entityId.equals(entityId));
        log.debug("Adapter cache invalidated: entityType={} entityId={} evicted={}",
                entityType.getValue(), entityId, before - adapters.size());
    }

    public int size() {
        return adapters.size();
    }

    static String revisionOf(PaymentConfig config) {
        return config.getVersion() + "@" + config.getUpdatedAt();
    }

    private static final class Entry {
        private final String revision;
        private final PaymentProviderAdapter adapter;

        private Entry(String revision, PaymentProviderAdapter adapter) {
            this.revision = revision;
            this.adapter = adapter;
        }
    }

    private static final class Key {
        private final PaymentEntityType entityType;
        private final String entityId;
        private final PaymentProviderType provider;
        private final boolean testMode;

        private Key(PaymentEntityType entityType, String entityId, PaymentProviderType provider, boolean testMode) {
            this.entityType = entityType;
            this.entityId = entityId;
            this.provider = provider;
            this.testMode = testMode;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key key = (Key) o;
            return testMode == key.testMode && entityType == key.entityType
                    && entityId.equals(key.entityId) && provider == key.provider;
        }

        @Override
        public int hashCode() {
            return Objects.hash(entityType, entityId, provider, testMode);
        }
    }
}
