package com.payment.reconciliation.vault;

import lombok.Value;

/**
 * Display form of a secret: partially redacted text plus whether a value is configured at all.
 */
@Value
public class MaskedSecret {

    String display;
    boolean set;
}
