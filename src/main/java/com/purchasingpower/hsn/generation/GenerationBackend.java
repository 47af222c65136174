package com.purchasingpower.hsn.generation;

/**
 * Text generation for the classification summary.
 *
 * <p>Retry, circuit breaking and fallback messages are the backend's concern.
 * Callers see either generated text or an exception.
 *
 * @since 1.0.0
 */
public interface GenerationBackend {

    String generate(String prompt);

    String name();
}
