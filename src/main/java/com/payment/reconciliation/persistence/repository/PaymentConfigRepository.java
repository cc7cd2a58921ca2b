package com.payment.reconciliation.persistence.repository;

import com.payment.reconciliation.domain.PaymentEntityType;
import com.payment.reconciliation.persistence.entity.PaymentConfigEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PaymentConfigRepository extends JpaRepository<PaymentConfigEntity, String> {

    Optional<PaymentConfigEntity> findByEntityTypeAndEntityId(PaymentEntityType entityType, String entityId);
}
