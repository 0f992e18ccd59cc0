package com.infomedia.abacox.storemigration.component.ratelimit;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Grants permits no closer together than {@code 1 / requestsPerSecond}. The lock is held while
 * sleeping so concurrent callers queue up behind each other instead of bursting together.
 */
public class FixedRateLimiter implements RateLimiter {

    private final ReentrantLock lock = new ReentrantLock();
    private final TimeSource timeSource;

    private double requestsPerSecond;
    private long minIntervalNanos;
    private long lastPermitNanos;
    private boolean permitIssued;

    public FixedRateLimiter(double requestsPerSecond) {
        this(requestsPerSecond, TimeSource.SYSTEM);
    }

    public FixedRateLimiter(double requestsPerSecond, TimeSource timeSource) {
        this.timeSource = timeSource;
        applyRate(requestsPerSecond);
    }

    @Override
    public void acquire() {
        lock.lock();
        try {
            long now = timeSource.nanoTime();
            if (permitIssued) {
                long waitNanos = lastPermitNanos + minIntervalNanos - now;
                if (waitNanos > 0) {
                    timeSource.sleepUninterruptedly(Duration.ofNanos(waitNanos));
                    now = timeSource.nanoTime();
                }
            }
            lastPermitNanos = now;
            permitIssued = true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public double getRate() {
        lock.lock();
        try {
            return requestsPerSecond;
        } finally {
            lock.unlock();
        }
    }

    public void updateRate(double requestsPerSecond) {
        lock.lock();
        try {
            applyRate(requestsPerSecond);
        } finally {
            lock.unlock();
        }
    }

    private void applyRate(double rate) {
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new IllegalArgumentException("requestsPerSecond must be a positive finite number: " + rate);
        }
        this.requestsPerSecond = rate;
        this.minIntervalNanos = (long) (1_000_000_000L / rate);
    }
}
