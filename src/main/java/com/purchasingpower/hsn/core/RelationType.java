package com.purchasingpower.hsn.core;

/**
 * Relationship types of the taxonomy graph.
 *
 * <p>{@code HAS_*} relations form the hierarchy forest. {@code SIBLING_OF} and
 * {@code SIMILAR_TO} are enrichment edges added after the hierarchy exists.
 *
 * @since 1.0.0
 */
public enum RelationType {
    HAS_HEADING(true),
    HAS_SUBHEADING(true),
    HAS_CODE(true),
    SIBLING_OF(false),
    SIMILAR_TO(false);

    private final boolean hierarchy;

    RelationType(boolean hierarchy) {
        this.hierarchy = hierarchy;
    }

    public boolean isHierarchy() {
        return hierarchy;
    }
}
