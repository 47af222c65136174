package com.purchasingpower.hsn.knowledge;

/**
 * Relationship traversal direction.
 *
 * <p>{@code INCOMING} yields predecessors, {@code OUTGOING} successors.
 *
 * @since 1.0.0
 */
public enum RelationshipDirection {
    INCOMING,
    OUTGOING,
    BOTH
}
