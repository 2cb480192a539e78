package io.urlcrypt.core.model;

import java.util.Objects;

/**
 * Classification of one decryption attempt. {@code value} is the plaintext for {@link
 * Kind#DECRYPTED} and the original input for every other kind.
 */
public record DecryptionOutcome(Kind kind, String value) {

    /** The four possible outcomes of a single attempt. */
    public enum Kind {
        DECRYPTED,
        PASSTHROUGH_UNCHANGED,
        FAILED_IGNORABLE,
        FAILED_REPORTABLE
    }

    public DecryptionOutcome {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static DecryptionOutcome decrypted(String plaintext) {
        return new DecryptionOutcome(Kind.DECRYPTED, plaintext);
    }

    public static DecryptionOutcome passthrough(String original) {
        return new DecryptionOutcome(Kind.PASSTHROUGH_UNCHANGED, original);
    }

    public static DecryptionOutcome failedIgnorable(String original) {
        return new DecryptionOutcome(Kind.FAILED_IGNORABLE, original);
    }

    public static DecryptionOutcome failedReportable(String original) {
        return new DecryptionOutcome(Kind.FAILED_REPORTABLE, original);
    }

    public boolean isDecrypted() {
        return kind == Kind.DECRYPTED;
    }

    public boolean isReportable() {
        return kind == Kind.FAILED_REPORTABLE;
    }
}
