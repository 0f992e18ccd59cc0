package com.infomedia.abacox.storemigration.exception;

/**
 * A staging batch could not be committed. The whole batch has been rolled back.
 */
public class StagingWriteException extends RuntimeException {

    private final int batchSize;

    public StagingWriteException(String message, int batchSize, Throwable cause) {
        super(message, cause);
        this.batchSize = batchSize;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
