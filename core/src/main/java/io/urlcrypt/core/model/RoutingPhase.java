package io.urlcrypt.core.model;

/**
 * Position in the host pipeline at which query decryption runs. Before routing no binding is
 * known, so only the greedy variant is safe.
 */
public enum RoutingPhase {
    PRE_ROUTING,
    POST_ROUTING
}
