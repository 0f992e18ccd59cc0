package com.infomedia.abacox.storemigration.exception;

/**
 * Raised when a call to the source platform API fails after the rate-limit retry was spent.
 */
public class SourceApiException extends RuntimeException {

    public SourceApiException(String message) {
        super(message);
    }

    public SourceApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
