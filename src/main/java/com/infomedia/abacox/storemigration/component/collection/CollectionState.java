package com.infomedia.abacox.storemigration.component.collection;

/**
 * States of one collection run. A run ends in {@link #DONE}, {@link #STOPPED} or {@link #ABORTED}.
 */
public enum CollectionState {
    IDLE,
    FETCHING,
    PAGE_EMPTY,
    PAGE_ERROR,
    PAGE_OK,
    CONTINUE,
    DONE,
    STOPPED,
    ABORTED
}
