package io.urlcrypt.core.model;

import java.util.Objects;

/**
 * One member of a {@link TargetShape}. A member is either a leaf ({@code composite == null}) or a
 * composite whose own members are walked recursively.
 *
 * @param name          declared member name
 * @param wireName      wire-name override used for binding, or {@code null} to use {@code name}
 * @param encrypted     whether the leaf carries the encrypted marker
 * @param ignoreWarning whether a failed decryption of this leaf is suppressed from warnings
 * @param composite     nested shape, or {@code null} for a leaf
 */
public record ShapeMember(String name, String wireName, boolean encrypted, boolean ignoreWarning, TargetShape composite) {

    public ShapeMember {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("member name must not be blank");
        }
        if (wireName != null && wireName.isBlank()) {
            wireName = null;
        }
        if (composite != null && encrypted) {
            throw new IllegalArgumentException("composite member '" + name + "' cannot be marked encrypted");
        }
    }

    /** A plain, unencrypted leaf. */
    public static ShapeMember plain(String name) {
        return new ShapeMember(name, null, false, false, null);
    }

    /** An encrypted leaf bound under its declared name, reporting failures. */
    public static ShapeMember encrypted(String name) {
        return new ShapeMember(name, null, true, false, null);
    }

    /** An encrypted leaf with an optional wire-name override and warning suppression flag. */
    public static ShapeMember encrypted(String name, String wireName, boolean ignoreWarning) {
        return new ShapeMember(name, wireName, true, ignoreWarning, null);
    }

    /** A composite member whose shape is walked recursively. */
    public static ShapeMember composite(String name, TargetShape shape) {
        Objects.requireNonNull(shape, "shape must not be null");
        return new ShapeMember(name, null, false, false, shape);
    }

    public boolean isComposite() {
        return composite != null;
    }

    /** The name a request binds this member from: the wire-name override if set, else the name. */
    public String effectiveName() {
        return wireName != null ? wireName : name;
    }
}
