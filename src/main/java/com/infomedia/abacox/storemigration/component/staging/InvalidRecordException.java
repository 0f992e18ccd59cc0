package com.infomedia.abacox.storemigration.component.staging;

/**
 * A single source record cannot be staged (not an object, or no natural id). The record is
 * counted as failed; the rest of its page is unaffected.
 */
public class InvalidRecordException extends RuntimeException {

    public InvalidRecordException(String message) {
        super(message);
    }
}
