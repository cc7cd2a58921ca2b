package com.payment.reconciliation.compliance;

import java.util.regex.Pattern;

/**
 * Redacts secrets and card numbers from provider responses so they are safe to include in logs.
 * Provider request bodies are never logged; only (redacted, truncated) error bodies are.
 */
public final class LogRedactor {

    private static final int MAX_LENGTH = 500;
    private static final String REDACTED = "***";

    private static final Pattern JSON_SECRET = Pattern.compile(
            "(\"(?:secretKey|secret_key|password\\d?|Password|Token|token|api_key|apiKey|client_secret|webhookSecret|SignatureValue)\"\\s*:\\s*\")([^\"]*)(\")");
    private static final Pattern FORM_SECRET = Pattern.compile(
            "((?:^|[&?])(?:password\\d?|Password|Token|SignatureValue|secret_key)=)([^&]*)");
    private static final Pattern CARD_NUMBER = Pattern.compile("\\b\\d{13,19}\\b");

    private LogRedactor() {}

    /** Masks known secret fields and PAN-like digit runs, then truncates. */
    public static String redact(String text) {
        if (text == null || text.isBlank()) return text;
        String result = JSON_SECRET.matcher(text).replaceAll("$1" + REDACTED + "$3");
        result = FORM_SECRET.matcher(result).replaceAll("$1" + REDACTED);
        result = CARD_NUMBER.matcher(result).replaceAll("****");
        return truncate(result);
    }

    public static String truncate(String text) {
        if (text == null || text.length() <= MAX_LENGTH) return text;
        return text.substring(0, MAX_LENGTH) + "...(truncated)";
    }

    /** Returns a safe-to-log form of an identifier such as a wallet address ("TXyz...abcd"). */
    public static String shorten(String identifier) {
        if (identifier == null || identifier.length() <= 10) return identifier;
        return identifier.substring(0, 4) + "..." + identifier.substring(identifier.length() - 4);
    }
}
