package com.purchasingpower.hsn.query;

/**
 * What the user is asking for in one turn.
 */
public enum QueryIntent {
    /**
     * Query contains an 8-digit HSN code.
     */
    DIRECT_LOOKUP,

    /**
     * Answer to a pending disambiguation prompt.
     */
    SELECTION,

    /**
     * Broad question about a category rather than a product.
     */
    SUMMARIZATION,

    /**
     * Product description to classify.
     */
    CLASSIFICATION
}
