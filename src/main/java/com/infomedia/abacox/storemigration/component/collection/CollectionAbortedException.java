package com.infomedia.abacox.storemigration.component.collection;

import lombok.Getter;

/**
 * Too many consecutive pages failed to fetch.
 */
@Getter
public class CollectionAbortedException extends RuntimeException {

    private final CollectionResult partialResult;

    public CollectionAbortedException(String message, CollectionResult partialResult, Throwable cause) {
        super(message, cause);
        this.partialResult = partialResult;
    }
}
