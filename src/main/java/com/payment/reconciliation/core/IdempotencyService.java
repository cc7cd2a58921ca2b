package com.payment.reconciliation.core;

import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.persistence.entity.PaymentEntity;
import com.payment.reconciliation.persistence.repository.PaymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Client-side idempotency for payment creation. A key already seen for a
 * provider resolves to the payment it created, so a retried request never
 * reaches the provider twice. Redis is the fast path and the {@code payments}
 * table the durable fallback; when both are unavailable the lookup fails open.
 */
@Slf4j
@Service
public class IdempotencyService {

    private static final String KEY_PREFIX = "payment:idempotency:";

    private final RedisTemplate<String, IdempotencyRecord> redisTemplate;
    private final PaymentRepository paymentRepository;
    private final Duration ttl;

    public IdempotencyService(RedisTemplate<String, IdempotencyRecord> redisTemplate,
                              PaymentRepository paymentRepository,
                              @Value("${payment.idempotency.ttl-hours:24}") long ttlHours) {
        this.redisTemplate = redisTemplate;
        this.paymentRepository = paymentRepository;
        this.ttl = Duration.ofHours(ttlHours);
    }

    public Optional<IdempotencyRecord> find(PaymentProviderType provider, String idempotencyKey) {
        String key = redisKey(provider, idempotencyKey);
        try {
            IdempotencyRecord cached = redisTemplate.opsForValue().get(key);
            if (cached != null) {
                log.debug("Idempotency hit in Redis: provider={} key={}", provider.getWireName(), idempotencyKey);
                return Optional.of(cached);
            }
        } catch (SerializationException e) {
            log.error("Idempotency cache entry unreadable, falling back to database: key={}", idempotencyKey, e);
        } catch (RuntimeException e) {
            log.warn("Idempotency cache read failed (Redis unavailable), falling back to database: key={} error={}",
                    idempotencyKey, e.getMessage());
        }

        try {
            Optional<PaymentEntity> existing = paymentRepository.findFirstByProviderAndIdempotencyKey(provider, idempotencyKey);
            if (existing.isPresent()) {
                IdempotencyRecord record = toRecord(existing.get());
                log.debug("Idempotency hit in database: provider={} key={} paymentId={}",
                        provider.getWireName(), idempotencyKey, record.getPaymentId());
                store(record, idempotencyKey);
                return Optional.of(record);
            }
        } catch (RuntimeException e) {
            log.error("Database idempotency check failed: key={} error={}", idempotencyKey, e.getMessage());
        }
        return Optional.empty();
    }

    public void remember(PaymentEntity payment) {
        if (payment.getIdempotencyKey() == null) {
            return;
        }
        store(toRecord(payment), payment.getIdempotencyKey());
    }

    private void store(IdempotencyRecord record, String idempotencyKey) {
        try {
            redisTemplate.opsForValue().set(redisKey(record.getProvider(), idempotencyKey), record, ttl);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency record: key={} error={}", idempotencyKey, e.getMessage());
        }
    }

    static IdempotencyRecord toRecord(PaymentEntity payment) {
        return IdempotencyRecord.builder()
                .paymentId(payment.getId())
                .provider(payment.getProvider())
                .externalId(payment.getExternalId())
                .status(payment.getStatus())
                .createdAt(payment.getCreatedAt())
                .build();
    }

    private static String redisKey(PaymentProviderType provider, String idempotencyKey) {
        return KEY_PREFIX + provider.getWireName() + ":" + idempotencyKey;
    }
}
