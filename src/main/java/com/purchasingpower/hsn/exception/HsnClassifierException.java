package com.purchasingpower.hsn.exception;

/**
 * Base of all exceptions raised by the classifier.
 *
 * @since 1.0.0
 */
public class HsnClassifierException extends RuntimeException {

    public HsnClassifierException(String message) {
        super(message);
    }

    public HsnClassifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
