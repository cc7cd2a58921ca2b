package com.payment.reconciliation.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PaymentConfigStatus {

    boolean enabled;
    boolean testMode;
    List<String> providers;
    List<String> configuredProviders;
    String currency;
}
