package com.payment.reconciliation.vault;

import com.payment.reconciliation.domain.PaymentProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Encrypts, decrypts and masks provider secret fields.
 * <p>
 * Cipher is AES-256-GCM with a fresh 96-bit nonce per value. The key is the
 * SHA-256 digest of the process-wide master secret, derived once at startup.
 * Encrypted values are self-describing:
 * {@code enc:v1:<base64 nonce>:<base64 tag>:<base64 ciphertext>}.
 * <p>
 * Which fields are secret is declared per provider by
 * {@link PaymentProviderType#getSecretFields()}.
 */
@Slf4j
@Component
public class CredentialVault {

    static final String PREFIX = "enc:v1:";
    static final String MASK = "••••";
    static final String FULL_MASK = "••••••••";
    static final String SET_FLAG_PREFIX = "_";
    static final String SET_FLAG_SUFFIX = "Set";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_BYTES = 12;
    private static final int TAG_BYTES = 16;

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public CredentialVault(@Value("${payment.vault.master-key:}") String masterKey) {
        if (masterKey == null || masterKey.isBlank()) {
            throw new IllegalStateException("payment.vault.master-key (PAYMENT_ENCRYPTION_KEY) must be set");
        }
        this.key = new SecretKeySpec(sha256(masterKey), "AES");
        log.info("Credential vault initialized: cipher=AES-256-GCM format=enc:v1");
    }

    public String encryptField(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Cannot encrypt a null value");
        }
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BYTES * 8, nonce));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_BYTES);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_BYTES, sealed.length);
            Base64.Encoder encoder = Base64.getEncoder();
            return PREFIX + encoder.encodeToString(nonce) + ":" + encoder.encodeToString(tag) + ":"
                    + encoder.encodeToString(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    public String decryptField(String value) {
        byte[][] parts = parse(value);
        if (parts == null) {
            throw new DecryptionException("Value is not in encrypted format");
        }
        byte[] nonce = parts[0];
        byte[] tag = parts[1];
        byte[] ciphertext = parts[2];
        byte[] sealed = new byte[ciphertext.length + tag.length];
        System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
        System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BYTES * 8, nonce));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Failed to decrypt secret field", e);
        }
    }

    public boolean isEncrypted(String value) {
        return parse(value) != null;
    }

    /**
     * First and last four characters kept; short values are fully masked.
     */
    public MaskedSecret maskForDisplay(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return new MaskedSecret(null, false);
        }
        if (plaintext.length() <= 8) {
            return new MaskedSecret(FULL_MASK, true);
        }
        return new MaskedSecret(plaintext.substring(0, 4) + MASK + plaintext.substring(plaintext.length() - 4), true);
    }

    public boolean isMaskedValue(String value) {
        return value != null && value.contains(MASK);
    }

    /** Encrypts every declared secret field that is not already encrypted. */
    public Map<String, Object> encryptSecrets(PaymentProviderType provider, Map<String, Object> settings) {
        Map<String, Object> result = new HashMap<>(settings);
        for (String field : provider.getSecretFields()) {
            Object value = result.get(field);
            if (value instanceof String && !((String) value).isEmpty() && !isEncrypted((String) value)) {
                result.put(field, encryptField((String) value));
            }
        }
        return result;
    }

    /** Decrypts every declared secret field that is encrypted; plaintext values pass through. */
    public Map<String, Object> decryptSecrets(PaymentProviderType provider, Map<String, Object> settings) {
        Map<String, Object> result = new HashMap<>(settings);
        for (String field : provider.getSecretFields()) {
            Object value = result.get(field);
            if (value instanceof String && isEncrypted((String) value)) {
                result.put(field, decryptField((String) value));
            }
        }
        return result;
    }

    /**
     * Replaces each secret field with its masked display form and adds an
     * {@code _<field>Set} flag, so a form can show "configured" without the value.
     */
    public Map<String, Object> maskSecrets(PaymentProviderType provider, Map<String, Object> settings) {
        Map<String, Object> result = new HashMap<>(settings);
        for (String field : provider.getSecretFields()) {
            Object value = result.get(field);
            if (!(value instanceof String) || ((String) value).isEmpty()) {
                continue;
            }
            MaskedSecret masked;
            String stored = (String) value;
            if (isEncrypted(stored)) {
                try {
                    masked = maskForDisplay(decryptField(stored));
                } catch (DecryptionException e) {
                    log.warn("Stored secret could not be decrypted for masking: provider={} field={}",
                            provider.getWireName(), field);
                    masked = new MaskedSecret(FULL_MASK, true);
                }
            } else {
                masked = maskForDisplay(stored);
            }
            result.put(field, masked.getDisplay());
            result.put(setFlag(field), masked.isSet());
        }
        return result;
    }

    /**
     * Merges an incoming settings blob over the stored one. For secret fields,
     * an empty, missing or masked incoming value keeps the stored value; any
     * other value is a new plaintext secret. {@code _<field>Set} flags are dropped.
     */
    public Map<String, Object> mergeOnUpdate(PaymentProviderType provider,
                                             Map<String, Object> existing,
                                             Map<String, Object> incoming) {
        Map<String, Object> merged = new HashMap<>(incoming != null ? incoming : Map.of());
        Map<String, Object> current = existing != null ? existing : Map.of();
        for (String field : provider.getSecretFields()) {
            Object value = merged.get(field);
            boolean keepExisting = value == null
                    || (value instanceof String && (((String) value).isEmpty() || isMaskedValue((String) value)));
            if (keepExisting) {
                if (current.get(field) != null) {
                    merged.put(field, current.get(field));
                } else {
                    merged.remove(field);
                }
            }
            merged.remove(setFlag(field));
        }
        return merged;
    }

    private static String setFlag(String field) {
        return SET_FLAG_PREFIX + field + SET_FLAG_SUFFIX;
    }

    private static byte[][] parse(String value) {
        if (value == null || !value.startsWith(PREFIX)) {
            return null;
        }
        String[] parts = value.substring(PREFIX.length()).split(":", -1);
        if (parts.length != 3) {
            return null;
        }
        try {
            Base64.Decoder decoder = Base64.getDecoder();
            byte[] nonce = decoder.decode(parts[0]);
            byte[] tag = decoder.decode(parts[1]);
            byte[] ciphertext = decoder.decode(parts[2]);
            if (nonce.length != NONCE_BYTES || tag.length != TAG_BYTES) {
                return null;
            }
            return new byte[][]{nonce, tag, ciphertext};
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static byte[] sha256(String secret) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
