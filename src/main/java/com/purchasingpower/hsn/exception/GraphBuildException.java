package com.purchasingpower.hsn.exception;

/**
 * The knowledge base could not be built from the processed documents.
 *
 * @since 1.0.0
 */
public class GraphBuildException extends HsnClassifierException {

    public GraphBuildException(String message) {
        super(message);
    }

    public GraphBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
