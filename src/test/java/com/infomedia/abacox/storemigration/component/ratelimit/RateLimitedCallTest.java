package com.infomedia.abacox.storemigration.component.ratelimit;

import com.infomedia.abacox.storemigration.component.easyhttp.EasyHttpException;
import com.infomedia.abacox.storemigration.support.ManualTimeSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RateLimitedCallTest {

    private final ManualTimeSource time = new ManualTimeSource();
    private final RateLimiter limiter = mock(RateLimiter.class);
    private final RateLimitedCall call = new RateLimitedCall(limiter, time, Duration.ofSeconds(2));

    @Test
    void successfulCallAcquiresOnePermit() {
        String result = call.execute("GET /customers", () -> "ok");

        assertThat(result).isEqualTo("ok");
        verify(limiter, times(1)).acquire();
        verify(limiter).onSuccess();
        assertThat(time.getSleeps()).isEmpty();
    }

    @Test
    void throttledCallIsRetriedOnceAfterTheServerCooldown() {
        AtomicInteger attempts = new AtomicInteger();

        String result = call.execute("GET /customers", () -> {
            if (attempts.getAndIncrement() == 0) {
                throw new EasyHttpException("Too Many Requests", 429, "", 3);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(2);
        assertThat(time.getSleeps()).containsExactly(Duration.ofSeconds(3));
        verify(limiter, times(2)).acquire();
        verify(limiter).onRateLimited(3);
        verify(limiter).onSuccess();
    }

    @Test
    void missingRetryAfterUsesTheDefaultCooldown() {
        AtomicInteger attempts = new AtomicInteger();

        call.execute("GET /customers", () -> {
            if (attempts.getAndIncrement() == 0) {
                throw new EasyHttpException("Too Many Requests", 429, "");
            }
            return "ok";
        });

        assertThat(time.getSleeps()).containsExactly(Duration.ofSeconds(2));
        verify(limiter).onRateLimited(null);
    }

    @Test
    void secondThrottleIsPropagated() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> call.execute("GET /customers", () -> {
            attempts.incrementAndGet();
            throw new EasyHttpException("Too Many Requests", 429, "", 1);
        })).isInstanceOf(EasyHttpException.class)
                .satisfies(e -> assertThat(((EasyHttpException) e).isRateLimited()).isTrue());

        assertThat(attempts).hasValue(2);
        verify(limiter, times(2)).onRateLimited(1);
    }

    @Test
    void otherFailuresAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> call.execute("GET /customers", () -> {
            attempts.incrementAndGet();
            throw new EasyHttpException("Server Error", 500, "boom");
        })).isInstanceOf(EasyHttpException.class);

        assertThat(attempts).hasValue(1);
        verify(limiter).onError();
        verify(limiter, never()).onRateLimited(any());
        assertThat(time.getSleeps()).isEmpty();
    }
}
