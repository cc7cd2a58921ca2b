package com.payment.reconciliation.crypto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CryptoMonitorStats {

    boolean enabled;
    boolean running;
    int pendingPayments;
    int watchedAddresses;
    Instant lastTickAt;
    long ticks;
    long confirmed;
    long expired;
    long lookupFailures;
}
