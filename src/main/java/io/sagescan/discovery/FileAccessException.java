package io.sagescan.discovery;

import io.sagescan.SageScanException;

/**
 * Raised when a file or directory cannot be read.
 */
public class FileAccessException extends SageScanException {

    private final String filePath;

    public FileAccessException(String message, String filePath) {
        super(filePath + ": " + message);
        this.filePath = filePath;
    }

    public FileAccessException(String message, String filePath, Throwable cause) {
        super(filePath + ": " + message, cause);
        this.filePath = filePath;
    }

    public String filePath() {
        return filePath;
    }
}
