package io.urlcrypt.core.model;

/** The two interchangeable query decryption variants. */
public enum QueryStrategyKind {
    /** Decrypt every value; keep the original on failure; never report. */
    GREEDY,
    /** Decrypt only shape-declared fields; classify and report failures. */
    SCHEMA_DRIVEN
}
