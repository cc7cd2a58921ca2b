package com.payment.reconciliation.persistence.repository;

import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.domain.PaymentProviderType;
import com.payment.reconciliation.domain.PaymentStatus;
import com.payment.reconciliation.domain.PaymentTargetType;
import com.payment.reconciliation.persistence.entity.PaymentEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, String> {

    Optional<PaymentEntity> findByProviderAndExternalId(PaymentProviderType provider, String externalId);

    Optional<PaymentEntity> findFirstByProviderAndProviderReference(PaymentProviderType provider, String providerReference);

    Optional<PaymentEntity> findFirstByProviderAndIdempotencyKey(PaymentProviderType provider, String idempotencyKey);

    Optional<PaymentEntity> findFirstByIdempotencyKey(String idempotencyKey);

    Page<PaymentEntity> findByEntityTypeAndEntityId(PaymentEntityType entityType, String entityId, Pageable pageable);

    Page<PaymentEntity> findByEntityTypeAndEntityIdAndStatus(PaymentEntityType entityType, String entityId,
                                                             PaymentStatus status, Pageable pageable);

    Optional<PaymentEntity> findFirstByTargetTypeAndTargetIdOrderByCreatedAtDesc(PaymentTargetType targetType, String targetId);

    List<PaymentEntity> findByProviderAndStatusOrderByCreatedAtAsc(PaymentProviderType provider, PaymentStatus status);

    boolean existsByOnChainTransactionId(String onChainTransactionId);

    @Query("SELECT COUNT(p) FROM PaymentEntity p WHERE p.provider = :provider AND p.status = :status")
    long countByProviderAndStatus(@Param("provider") PaymentProviderType provider, @Param("status") PaymentStatus status);
}
