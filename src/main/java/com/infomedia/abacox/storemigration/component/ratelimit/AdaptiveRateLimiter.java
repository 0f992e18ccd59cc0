package com.infomedia.abacox.storemigration.component.ratelimit;

import lombok.extern.log4j.Log4j2;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Rate limiter that backs off when the server signals throttling and recovers gradually on success.
 * <ul>
 *     <li>success: rate x1.1, capped at the maximum</li>
 *     <li>rate limited with a server cooldown: rate = 1 / retryAfter, capped at the maximum</li>
 *     <li>rate limited without a cooldown: rate x0.5, floored at the minimum</li>
 *     <li>other error: rate x0.8, floored at the minimum</li>
 * </ul>
 */
@Log4j2
public class AdaptiveRateLimiter implements RateLimiter {

    public static final double DEFAULT_MIN_RATE = 0.1;
    public static final double DEFAULT_MAX_RATE = 10.0;

    private static final double SUCCESS_FACTOR = 1.1;
    private static final double RATE_LIMITED_FACTOR = 0.5;
    private static final double ERROR_FACTOR = 0.8;

    private final ReentrantLock lock = new ReentrantLock();
    private final FixedRateLimiter baseLimiter;
    private final double minRate;
    private final double maxRate;
    private double currentRate;

    public AdaptiveRateLimiter(double initialRate) {
        this(initialRate, DEFAULT_MIN_RATE, DEFAULT_MAX_RATE, TimeSource.SYSTEM);
    }

    public AdaptiveRateLimiter(double initialRate, double minRate, double maxRate, TimeSource timeSource) {
        if (!(minRate > 0) || maxRate < minRate) {
            throw new IllegalArgumentException("Invalid adaptive rate bounds: min=" + minRate + ", max=" + maxRate);
        }
        this.minRate = minRate;
        this.maxRate = maxRate;
        this.currentRate = clamp(initialRate);
        this.baseLimiter = new FixedRateLimiter(currentRate, timeSource);
    }

    @Override
    public void acquire() {
        baseLimiter.acquire();
    }

    @Override
    public double getRate() {
        lock.lock();
        try {
            return currentRate;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onSuccess() {
        lock.lock();
        try {
            double newRate = Math.min(maxRate, currentRate * SUCCESS_FACTOR);
            if (newRate != currentRate) {
                setRate(newRate);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onRateLimited(Integer retryAfterSeconds) {
        lock.lock();
        try {
            double newRate;
            if (retryAfterSeconds != null && retryAfterSeconds > 0) {
                // The server's cooldown wins over the configured floor.
                newRate = Math.min(maxRate, 1.0 / retryAfterSeconds);
            } else {
                newRate = Math.max(minRate, currentRate * RATE_LIMITED_FACTOR);
            }
            log.warn("Rate limited by server (retryAfter={}s). Lowering rate {} -> {} req/s",
                    retryAfterSeconds, currentRate, newRate);
            setRate(newRate);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onError() {
        lock.lock();
        try {
            double newRate = Math.max(minRate, currentRate * ERROR_FACTOR);
            if (newRate != currentRate) {
                setRate(newRate);
            }
        } finally {
            lock.unlock();
        }
    }

    public double getMinRate() {
        return minRate;
    }

    public double getMaxRate() {
        return maxRate;
    }

    private void setRate(double newRate) {
        currentRate = newRate;
        baseLimiter.updateRate(newRate);
    }

    private double clamp(double rate) {
        return Math.max(minRate, Math.min(maxRate, rate));
    }
}
