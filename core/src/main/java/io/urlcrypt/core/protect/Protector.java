package io.urlcrypt.core.protect;

import io.urlcrypt.core.error.InvalidCiphertextException;

/**
 * Opaque authenticated encryption of single string values under a fixed purpose.
 *
 * <p>Implementations MUST be thread-safe; one instance is shared by every request.
 */
public interface Protector {

    /**
     * Encrypts a plaintext into a URL-safe token. May be non-deterministic.
     *
     * @param plaintext the value to protect, never {@code null}
     * @return the token
     */
    String encrypt(String plaintext);

    /**
     * Decrypts a token produced by {@link #encrypt} under the same purpose.
     *
     * @param token the token
     * @return the plaintext
     * @throws InvalidCiphertextException if the token is {@code null}, empty, malformed, truncated,
     *                                    tampered with, or was produced under another purpose
     */
    String decrypt(String token);
}
