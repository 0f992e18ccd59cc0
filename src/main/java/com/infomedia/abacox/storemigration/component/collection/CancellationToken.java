package com.infomedia.abacox.storemigration.component.collection;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop request shared between a running loop and whoever controls it. Loops poll
 * it at iteration boundaries only.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public static CancellationToken none() {
        return new CancellationToken();
    }
}
