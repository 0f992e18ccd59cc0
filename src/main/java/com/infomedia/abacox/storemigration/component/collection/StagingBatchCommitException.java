package com.infomedia.abacox.storemigration.component.collection;

import lombok.Getter;

/**
 * A fetched page could not be committed to staging. Fatal for the run; the page's records are
 * already counted as failed in the partial result.
 */
@Getter
public class StagingBatchCommitException extends RuntimeException {

    private final CollectionResult partialResult;

    public StagingBatchCommitException(String message, CollectionResult partialResult, Throwable cause) {
        super(message, cause);
        this.partialResult = partialResult;
    }
}
