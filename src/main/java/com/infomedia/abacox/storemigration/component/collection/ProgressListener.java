package com.infomedia.abacox.storemigration.component.collection;

import java.util.Map;

/**
 * Receives status snapshots from a running loop, on the loop's own thread.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = status -> { };

    void onProgress(Map<String, Object> status);
}
