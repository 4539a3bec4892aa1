package io.sagescan.engine;

import io.sagescan.SageScanException;

/**
 * Raised when a run is aborted by interrupting the calling thread.
 * No partial result is produced.
 */
public class AnalysisCancelledException extends SageScanException {

    public AnalysisCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
