package io.urlcrypt.core.protect;

import io.urlcrypt.core.error.InvalidCiphertextException;
import io.urlcrypt.core.error.ProtectorConfigException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AES-256-GCM protector provider.
 *
 * <p>Each purpose gets its own subkey, {@code HMAC-SHA256(masterKey, "url-crypt:" + purpose)},
 * and the purpose is also bound as GCM additional authenticated data. Token layout before
 * encoding:
 *
 * <pre>
 * version (1 byte, 0x01) ‖ IV (12 bytes) ‖ ciphertext ‖ GCM tag (16 bytes)
 * </pre>
 *
 * encoded as base64url without padding, so tokens are safe as path segments and query values
 * without escaping.
 */
public final class AesGcmProtectorProvider implements ProtectorProvider {

    private static final Logger LOG = LoggerFactory.getLogger(AesGcmProtectorProvider.class);

    static final byte VERSION = 0x01;
    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final String KDF_ALGORITHM = "HmacSHA256";
    private static final String KDF_PREFIX = "url-crypt:";
    private static final int KEY_LENGTH = 32;
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 16;
    private static final int MIN_TOKEN_LENGTH = 1 + GCM_IV_LENGTH + GCM_TAG_LENGTH;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final byte[] masterKey;
    private final SecureRandom random;

    /**
     * @param masterKey 256-bit master key
     * @throws ProtectorConfigException if the key is not exactly 32 bytes
     */
    public AesGcmProtectorProvider(byte[] masterKey) {
        this(masterKey, new SecureRandom());
    }

    AesGcmProtectorProvider(byte[] masterKey, SecureRandom random) {
        if (masterKey == null || masterKey.length != KEY_LENGTH) {
            throw new ProtectorConfigException("master key must be " + KEY_LENGTH + " bytes (256 bits), got "
                    + (masterKey == null ? "none" : masterKey.length + " bytes"));
        }
        this.masterKey = masterKey.clone();
        this.random = random;
    }

    /**
     * Creates a provider from a base64 (standard or URL-safe alphabet) master key. A {@code null}
     * or blank key yields an ephemeral random key: tokens then only survive the life of this
     * process.
     *
     * @throws ProtectorConfigException if the key is not valid base64 or not 256 bits long
     */
    public static AesGcmProtectorProvider fromBase64(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            return ephemeral();
        }
        String trimmed = base64Key.trim();
        byte[] key;
        try {
            key = trimmed.indexOf('-') >= 0 || trimmed.indexOf('_') >= 0
                    ? Base64.getUrlDecoder().decode(trimmed)
                    : Base64.getDecoder().decode(trimmed);
        } catch (IllegalArgumentException e) {
            throw new ProtectorConfigException("master key is not valid base64", e);
        }
        return new AesGcmProtectorProvider(key);
    }

    /** Creates a provider with a random key that lives only as long as this process. */
    public static AesGcmProtectorProvider ephemeral() {
        LOG.warn("No master key configured; using an ephemeral random key. "
                + "Tokens will not survive a restart and are not shared between instances.");
        SecureRandom random = new SecureRandom();
        byte[] key = new byte[KEY_LENGTH];
        random.nextBytes(key);
        return new AesGcmProtectorProvider(key, random);
    }

    /** Generates a new random master key, base64-encoded, suitable for configuration. */
    public static String generateMasterKey() {
        byte[] key = new byte[KEY_LENGTH];
        new SecureRandom().nextBytes(key);
        return Base64.getEncoder().encodeToString(key);
    }

    @Override
    public Protector createProtector(String purpose) {
        Objects.requireNonNull(purpose, "purpose must not be null");
        if (purpose.isBlank()) {
            throw new IllegalArgumentException("purpose must not be blank");
        }
        return new AesGcmProtector(purpose, deriveSubkey(purpose), random);
    }

    private SecretKey deriveSubkey(String purpose) {
        try {
            Mac mac = Mac.getInstance(KDF_ALGORITHM);
            mac.init(new SecretKeySpec(masterKey, KDF_ALGORITHM));
            byte[] subkey = mac.doFinal((KDF_PREFIX + purpose).getBytes(StandardCharsets.UTF_8));
            return new SecretKeySpec(subkey, "AES");
        } catch (GeneralSecurityException e) {
            throw new ProtectorConfigException("cannot derive subkey for purpose '" + purpose + "'", e);
        }
    }

    /** Protector bound to one purpose. Stateless apart from its key; a fresh Cipher per call. */
    static final class AesGcmProtector implements Protector {

        private final String purpose;
        private final byte[] aad;
        private final SecretKey key;
        private final SecureRandom random;

        AesGcmProtector(String purpose, SecretKey key, SecureRandom random) {
            this.purpose = purpose;
            this.aad = purpose.getBytes(StandardCharsets.UTF_8);
            this.key = key;
            this.random = random;
        }

        @Override
        public String encrypt(String plaintext) {
            Objects.requireNonNull(plaintext, "plaintext must not be null");
            byte[] iv = new byte[GCM_IV_LENGTH];
            random.nextBytes(iv);
            try {
                Cipher cipher = Cipher.getInstance(ALGORITHM);
                cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
                cipher.updateAAD(aad);
                byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
                ByteBuffer token = ByteBuffer.allocate(1 + iv.length + sealed.length);
                token.put(VERSION).put(iv).put(sealed);
                return ENCODER.encodeToString(token.array());
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("AES-GCM encryption failed for purpose '" + purpose + "'", e);
            }
        }

        @Override
        public String decrypt(String token) {
            if (token == null || token.isEmpty()) {
                throw new InvalidCiphertextException("token is empty");
            }
            byte[] raw;
            try {
                raw = DECODER.decode(token);
            } catch (IllegalArgumentException e) {
                throw new InvalidCiphertextException("token is not base64url", e);
            }
            if (raw.length < MIN_TOKEN_LENGTH) {
                throw new InvalidCiphertextException("token is truncated");
            }
            if (raw[0] != VERSION) {
                throw new InvalidCiphertextException("unsupported token version " + raw[0]);
            }
            byte[] iv = Arrays.copyOfRange(raw, 1, 1 + GCM_IV_LENGTH);
            try {
                Cipher cipher = Cipher.getInstance(ALGORITHM);
                cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
                cipher.updateAAD(aad);
                byte[] plain = cipher.doFinal(raw, 1 + GCM_IV_LENGTH, raw.length - 1 - GCM_IV_LENGTH);
                return new String(plain, StandardCharsets.UTF_8);
            } catch (GeneralSecurityException e) {
                throw new InvalidCiphertextException("token failed authentication for purpose '" + purpose + "'", e);
            }
        }

        @Override
        public String toString() {
            return "AesGcmProtector[" + purpose + "]";
        }
    }
}
