package com.payment.reconciliation.compliance;

import com.payment.reconciliation.messaging.PaymentDomainEvent;
import com.payment.reconciliation.messaging.PaymentEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * One audit line per committed payment state change. Carries identifiers and
 * amounts only; customer data and provider payloads never reach this log.
 */
@Slf4j
@Component
public class ComplianceAuditLogger implements PaymentEventListener {

    @Override
    public void onPaymentEvent(PaymentDomainEvent event) {
        log.info("[AUDIT] {} paymentId={} provider={} externalId={} entity={}:{} target={}:{} status={} previousStatus={} amount={} refundedAmount={} currency={} reason={} testMode={}",
                event.getEventType(),
                event.getPaymentId(),
                event.getProvider(),
                LogRedactor.shorten(event.getExternalId()),
                event.getEntityType(),
                event.getEntityId(),
                event.getTargetType(),
                event.getTargetId(),
                event.getStatus() != null ? event.getStatus().getValue() : null,
                event.getPreviousStatus() != null ? event.getPreviousStatus().getValue() : null,
                event.getAmount(),
                event.getRefundedAmount(),
                event.getCurrency(),
                event.getReason(),
                event.isTestMode());
    }
}
