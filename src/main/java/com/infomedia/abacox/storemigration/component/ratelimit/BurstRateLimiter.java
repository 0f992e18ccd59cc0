package com.infomedia.abacox.storemigration.component.ratelimit;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket: up to {@code burstSize} requests pass immediately, after which permits are
 * refilled at the sustained rate.
 */
public class BurstRateLimiter implements RateLimiter {

    private final ReentrantLock lock = new ReentrantLock();
    private final TimeSource timeSource;
    private final double requestsPerSecond;
    private final int burstSize;

    private double tokens;
    private long lastRefillNanos;

    public BurstRateLimiter(double requestsPerSecond, int burstSize) {
        this(requestsPerSecond, burstSize, TimeSource.SYSTEM);
    }

    public BurstRateLimiter(double requestsPerSecond, int burstSize, TimeSource timeSource) {
        if (!(requestsPerSecond > 0)) {
            throw new IllegalArgumentException("requestsPerSecond must be positive: " + requestsPerSecond);
        }
        if (burstSize < 1) {
            throw new IllegalArgumentException("burstSize must be at least 1: " + burstSize);
        }
        this.requestsPerSecond = requestsPerSecond;
        this.burstSize = burstSize;
        this.timeSource = timeSource;
        this.tokens = burstSize;
        this.lastRefillNanos = timeSource.nanoTime();
    }

    @Override
    public void acquire() {
        lock.lock();
        try {
            long now = timeSource.nanoTime();
            double elapsedSeconds = (now - lastRefillNanos) / 1_000_000_000.0;
            tokens = Math.min(burstSize, tokens + elapsedSeconds * requestsPerSecond);
            lastRefillNanos = now;

            if (tokens >= 1) {
                tokens -= 1;
                return;
            }

            double waitSeconds = (1 - tokens) / requestsPerSecond;
            timeSource.sleepUninterruptedly(Duration.ofNanos((long) (waitSeconds * 1_000_000_000L)));
            tokens = 0;
            lastRefillNanos = timeSource.nanoTime();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public double getRate() {
        return requestsPerSecond;
    }
}
