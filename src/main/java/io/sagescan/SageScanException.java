package io.sagescan;

/**
 * Base exception for all sage-scan errors.
 */
public class SageScanException extends RuntimeException {

    public SageScanException(String message) {
        super(message);
    }

    public SageScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
