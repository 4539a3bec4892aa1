package io.sagescan.enrich;

import io.sagescan.SageScanException;

/**
 * Raised when the text-generation service cannot be reached or answers with an error.
 */
public class EnrichmentException extends SageScanException {

    public EnrichmentException(String message) {
        super(message);
    }

    public EnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
