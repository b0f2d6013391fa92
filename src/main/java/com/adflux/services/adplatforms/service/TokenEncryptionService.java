package com.adflux.services.adplatforms.service;

import com.adflux.services.adplatforms.config.AdPlatformsProperties;
import com.adflux.services.adplatforms.exception.AdPlatformException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * AES-256-GCM encryption of platform tokens at rest.
 * Only active with the persisted token store.
 */
@Component
@ConditionalOnProperty(prefix = "adplatforms.auth", name = "storage", havingValue = "jpa")
@Slf4j
public class TokenEncryptionService {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH_BYTES = 12;     // 96-bit nonce
    private static final int GCM_TAG_LENGTH_BITS = 128;
    private static final String ENCRYPTED_PREFIX = "ENC:";
    private static final String ERROR_CODE = "TOKEN_ENCRYPTION_ERROR";

    private final SecretKey secretKey;
    private final SecureRandom secureRandom = new SecureRandom();

    @Autowired
    public TokenEncryptionService(AdPlatformsProperties properties) {
        this(properties.getAuth().getEncryptionKey());
    }

    /**
     * @param encryptionKeyHex 32-byte AES key as 64 hex chars (TOKEN_ENCRYPTION_KEY)
     */
    public TokenEncryptionService(String encryptionKeyHex) {
        if (encryptionKeyHex == null || encryptionKeyHex.isBlank()) {
            throw new IllegalStateException(
                    "TOKEN_ENCRYPTION_KEY is not set. Generate one with: openssl rand -hex 32");
        }
        if (encryptionKeyHex.length() != 64) {
            throw new IllegalStateException(
                    "TOKEN_ENCRYPTION_KEY must be a 32-byte key encoded as 64 hex chars. " +
                            "Current length: " + encryptionKeyHex.length() + " chars.");
        }
        this.secretKey = new SecretKeySpec(HexFormat.of().parseHex(encryptionKeyHex), "AES");
        log.info("TokenEncryptionService initialized with AES-256-GCM");
    }

    /**
     * Returns "ENC:&lt;base64(iv + ciphertext)&gt;". A fresh IV is used on every call.
     */
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isBlank()) {
            throw new AdPlatformException("Cannot encrypt null or blank token", ERROR_CODE);
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH_BYTES];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] combined = new byte[iv.length + ciphertext.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(ciphertext, 0, combined, iv.length, ciphertext.length);
            return ENCRYPTED_PREFIX + Base64.getEncoder().encodeToString(combined);

        } catch (GeneralSecurityException ex) {
            // Never log the plaintext token on failure
            throw new AdPlatformException("Token encryption failed: " + ex.getMessage(), ERROR_CODE, ex);
        }
    }

    /**
     * Values without the "ENC:" prefix are treated as legacy plaintext and returned as-is.
     */
    public String decrypt(String storedValue) {
        if (storedValue == null || storedValue.isBlank()) {
            throw new AdPlatformException("Cannot decrypt null or blank stored token", ERROR_CODE);
        }
        if (!isEncrypted(storedValue)) {
            log.warn("Decrypting legacy plaintext token; it will be re-encrypted on next save");
            return storedValue;
        }

        try {
            byte[] combined = Base64.getDecoder().decode(storedValue.substring(ENCRYPTED_PREFIX.length()));
            byte[] iv = new byte[GCM_IV_LENGTH_BYTES];
            byte[] ciphertext = new byte[combined.length - GCM_IV_LENGTH_BYTES];
            System.arraycopy(combined, 0, iv, 0, iv.length);
            System.arraycopy(combined, iv.length, ciphertext, 0, ciphertext.length);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);

        } catch (AEADBadTagException ex) {
            throw new AdPlatformException(
                    "Token decryption failed: authentication tag mismatch (wrong key or corrupted data)", ERROR_CODE, ex);
        } catch (GeneralSecurityException | IllegalArgumentException ex) {
            throw new AdPlatformException("Token decryption failed: " + ex.getMessage(), ERROR_CODE, ex);
        }
    }

    public boolean isEncrypted(String storedValue) {
        return storedValue != null && storedValue.startsWith(ENCRYPTED_PREFIX);
    }
}
