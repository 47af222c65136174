package com.purchasingpower.hsn.exception;

/**
 * Invalid configuration, such as an unknown backend or strategy name.
 * Raised while the application context starts, never per turn.
 *
 * @since 1.0.0
 */
public class ConfigurationException extends HsnClassifierException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConfigurationException unknownOption(String property, String value, Object supported) {
        return new ConfigurationException(
                "Unsupported value '" + value + "' for " + property + ". Supported: " + supported);
    }
}
