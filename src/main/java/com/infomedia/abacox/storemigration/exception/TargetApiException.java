package com.infomedia.abacox.storemigration.exception;

/**
 * Raised when the target platform rejects a write or cannot be reached.
 */
public class TargetApiException extends RuntimeException {

    public TargetApiException(String message) {
        super(message);
    }

    public TargetApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
