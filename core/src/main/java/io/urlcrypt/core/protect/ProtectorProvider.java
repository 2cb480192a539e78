package io.urlcrypt.core.protect;

/** Creates {@link Protector} instances bound to a purpose. */
public interface ProtectorProvider {

    /**
     * Creates a protector for the given purpose. Tokens produced under one purpose never decrypt
     * under another.
     *
     * @param purpose namespacing string, never blank
     */
    Protector createProtector(String purpose);
}
