package com.purchasingpower.hsn.core;

/**
 * Why a turn produced no result.
 */
public enum NoResultReason {
    /**
     * Direct lookup of a code that is not indexed.
     */
    CODE_NOT_FOUND,

    /**
     * Best retrieval score below the relevance threshold.
     */
    LOW_CONFIDENCE
}
