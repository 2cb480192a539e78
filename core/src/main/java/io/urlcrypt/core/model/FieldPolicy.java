package io.urlcrypt.core.model;

import java.util.Objects;

/**
 * Resolved, flattened decision record for one encrypted field discovered in a {@link TargetShape}.
 *
 * @param name                 the wire name the field is bound from (query key)
 * @param ignoreFailureWarning whether a failed decryption of this field is suppressed from the
 *                             aggregated warning
 */
public record FieldPolicy(String name, boolean ignoreFailureWarning) {

    public FieldPolicy {
        Objects.requireNonNull(name, "name must not be null");
    }
}
