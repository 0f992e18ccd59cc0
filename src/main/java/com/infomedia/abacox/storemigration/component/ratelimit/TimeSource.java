package com.infomedia.abacox.storemigration.component.ratelimit;

import java.time.Duration;

/**
 * Monotonic clock plus blocking sleep. Swapped for a manual implementation in tests so that
 * throttling and politeness pauses can be verified without real waiting.
 */
public interface TimeSource {

    TimeSource SYSTEM = new TimeSource() {
        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
            }
        }
    };

    long nanoTime();

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeps, converting an interrupt into an unchecked failure after restoring the interrupt flag.
     */
    default void sleepUninterruptedly(Duration duration) {
        try {
            sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while sleeping for " + duration, e);
        }
    }
}
