package com.purchasingpower.hsn.knowledge;

/**
 * Optional capabilities a {@link GraphStore} backend may expose.
 *
 * <p>Callers ask for a capability instead of checking the backend type.
 *
 * @since 1.0.0
 */
public enum GraphCapability {

    /**
     * Hop-by-hop traversal is a local, in-process operation, cheap enough to
     * run per retrieved candidate.
     */
    DIRECT_TRAVERSAL,

    /**
     * Writes are durable and transactional (external graph database).
     */
    TRANSACTIONAL
}
