package io.sagescan.config;

import io.sagescan.SageScanException;

/**
 * Raised when configuration cannot be loaded or holds invalid values.
 */
public class ConfigurationException extends SageScanException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
