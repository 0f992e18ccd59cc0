package com.infomedia.abacox.storemigration.component.ratelimit;

/**
 * Throttles outbound API calls. Every external request acquires a permit first.
 * <p>
 * The feedback hooks are no-ops for static limiters; {@link AdaptiveRateLimiter} uses them
 * to move its steady-state rate.
 */
public interface RateLimiter {

    /**
     * Blocks the caller until the next request may be issued.
     */
    void acquire();

    /**
     * Current allowed rate in requests per second.
     */
    double getRate();

    default void onSuccess() {
    }

    /**
     * @param retryAfterSeconds cooldown requested by the server, or null when none was sent
     */
    default void onRateLimited(Integer retryAfterSeconds) {
    }

    default void onError() {
    }
}
