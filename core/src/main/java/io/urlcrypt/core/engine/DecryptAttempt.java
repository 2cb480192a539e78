package io.urlcrypt.core.engine;

import io.urlcrypt.core.error.InvalidCiphertextException;
import io.urlcrypt.core.model.DecryptionOutcome;
import io.urlcrypt.core.protect.Protector;
import org.slf4j.Logger;

/** Single decryption attempt shared by the strategies. Never throws for a bad token. */
final class DecryptAttempt {

    private DecryptAttempt() {
        // utility class
    }

    /**
     * @return {@code DECRYPTED} with the plaintext, or {@code PASSTHROUGH_UNCHANGED} with the
     *         original value
     */
    static DecryptionOutcome attempt(
            Protector protector, String value, String label, Logger log, boolean showFullCryptographicException) {
        try {
            return DecryptionOutcome.decrypted(protector.decrypt(value));
        } catch (InvalidCiphertextException e) {
            if (log.isDebugEnabled()) {
                if (showFullCryptographicException) {
                    log.debug("Could not decrypt {}; keeping original value", label, e);
                } else {
                    log.debug("Could not decrypt {}; keeping original value ({})", label, e.getMessage());
                }
            }
            return DecryptionOutcome.passthrough(value);
        }
    }
}
