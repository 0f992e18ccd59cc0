package com.infomedia.abacox.storemigration.component.ratelimit;

import com.infomedia.abacox.storemigration.component.easyhttp.EasyHttpException;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs one API request behind a rate limiter.
 * <p>
 * A 429 response is retried exactly once, after sleeping for the server's Retry-After (or the
 * configured default). Any other failure, and a second 429, propagate to the caller.
 */
@Log4j2
public class RateLimitedCall {

    private final RateLimiter rateLimiter;
    private final TimeSource timeSource;
    private final Duration defaultRetryAfter;

    public RateLimitedCall(RateLimiter rateLimiter, TimeSource timeSource, Duration defaultRetryAfter) {
        this.rateLimiter = rateLimiter;
        this.timeSource = timeSource;
        this.defaultRetryAfter = defaultRetryAfter;
    }

    public <T> T execute(String description, Supplier<T> request) {
        try {
            return attempt(request);
        } catch (EasyHttpException e) {
            if (!e.isRateLimited()) {
                throw e;
            }
            Duration wait = e.getRetryAfterSeconds() != null
                    ? Duration.ofSeconds(e.getRetryAfterSeconds())
                    : defaultRetryAfter;
            log.warn("Rate limit exceeded on {}, waiting {} seconds before a single retry",
                    description, wait.toSeconds());
            timeSource.sleepUninterruptedly(wait);
            return attempt(request);
        }
    }

    private <T> T attempt(Supplier<T> request) {
        rateLimiter.acquire();
        try {
            T result = request.get();
            rateLimiter.onSuccess();
            return result;
        } catch (EasyHttpException e) {
            if (e.isRateLimited()) {
                rateLimiter.onRateLimited(e.getRetryAfterSeconds());
            } else {
                rateLimiter.onError();
            }
            throw e;
        }
    }
}
