package com.payment.reconciliation.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Describes a supported provider for configuration screens.
 */
@Value
@Builder
public class ProviderInfo {

    String name;
    String displayName;
    List<String> requiredFields;
    List<String> secretFields;
    List<String> currencies;
    boolean supportsRefunds;
    boolean supportsWebhooks;
    boolean supportsCapture;
}
