package com.infomedia.abacox.storemigration.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infomedia.abacox.storemigration.component.easyhttp.EasyHttpClient;
import com.infomedia.abacox.storemigration.component.ratelimit.AdaptiveRateLimiter;
import com.infomedia.abacox.storemigration.component.ratelimit.BurstRateLimiter;
import com.infomedia.abacox.storemigration.component.ratelimit.FixedRateLimiter;
import com.infomedia.abacox.storemigration.component.ratelimit.RateLimitedCall;
import com.infomedia.abacox.storemigration.component.ratelimit.RateLimiter;
import com.infomedia.abacox.storemigration.component.ratelimit.TimeSource;
import com.infomedia.abacox.storemigration.component.sourceapi.SourceApi;
import com.infomedia.abacox.storemigration.component.sourceapi.SourceApiClient;
import com.infomedia.abacox.storemigration.component.targetapi.TargetApi;
import com.infomedia.abacox.storemigration.component.targetapi.TargetApiClient;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

@Configuration
@Log4j2
public class ApiClientConfiguration {

    @Value("${store-migration.source.base-url}")
    private String sourceBaseUrl;

    @Value("${store-migration.source.api-key}")
    private String sourceApiKey;

    @Value("${store-migration.source.api-secret:}")
    private String sourceApiSecret;

    @Value("${store-migration.target.base-url}")
    private String targetBaseUrl;

    @Value("${store-migration.target.api-key}")
    private String targetApiKey;

    @Value("${store-migration.target.password}")
    private String targetPassword;

    @Value("${store-migration.http.connect-timeout-seconds:10}")
    private long connectTimeoutSeconds;

    @Value("${store-migration.http.read-timeout-seconds:30}")
    private long readTimeoutSeconds;

    @Value("${store-migration.http.logging-level:NONE}")
    private EasyHttpClient.LoggingLevel loggingLevel;

    @Value("${store-migration.rate-limit.source.mode:adaptive}")
    private String sourceLimiterMode;

    @Value("${store-migration.rate-limit.source.requests-per-second:2.0}")
    private double sourceRequestsPerSecond;

    @Value("${store-migration.rate-limit.source.retry-after-default-seconds:60}")
    private long sourceRetryAfterDefault;

    @Value("${store-migration.rate-limit.target.mode:adaptive}")
    private String targetLimiterMode;

    @Value("${store-migration.rate-limit.target.requests-per-second:2.0}")
    private double targetRequestsPerSecond;

    @Value("${store-migration.rate-limit.target.retry-after-default-seconds:2}")
    private long targetRetryAfterDefault;

    @Value("${store-migration.rate-limit.min-rate:0.1}")
    private double minRate;

    @Value("${store-migration.rate-limit.max-rate:10.0}")
    private double maxRate;

    @Value("${store-migration.rate-limit.burst-size:5}")
    private int burstSize;

    @Bean
    public SourceApi sourceApi(ObjectMapper objectMapper, TimeSource timeSource) {
        // The source accepts the API key as secret when none is configured
        String secret = sourceApiSecret == null || sourceApiSecret.isBlank() ? sourceApiKey : sourceApiSecret;
        EasyHttpClient client = httpClient(sourceBaseUrl, sourceApiKey, secret, objectMapper);
        RateLimiter limiter = rateLimiter("source", sourceLimiterMode, sourceRequestsPerSecond, timeSource);
        return new SourceApiClient(client,
                new RateLimitedCall(limiter, timeSource, Duration.ofSeconds(sourceRetryAfterDefault)));
    }

    @Bean
    public TargetApi targetApi(ObjectMapper objectMapper, TimeSource timeSource) {
        EasyHttpClient client = httpClient(targetBaseUrl, targetApiKey, targetPassword, objectMapper);
        RateLimiter limiter = rateLimiter("target", targetLimiterMode, targetRequestsPerSecond, timeSource);
        return new TargetApiClient(client,
                new RateLimitedCall(limiter, timeSource, Duration.ofSeconds(targetRetryAfterDefault)));
    }

    private EasyHttpClient httpClient(String baseUrl, String username, String password, ObjectMapper objectMapper) {
        return EasyHttpClient.builder()
                .baseUrl(baseUrl)
                .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                .basicAuth(username, password)
                .loggingLevel(loggingLevel)
                .objectMapper(objectMapper)
                .build();
    }

    private RateLimiter rateLimiter(String api, String mode, double requestsPerSecond, TimeSource timeSource) {
        RateLimiter limiter = switch (mode.trim().toLowerCase(Locale.ROOT)) {
            case "fixed" -> new FixedRateLimiter(requestsPerSecond, timeSource);
            case "burst" -> new BurstRateLimiter(requestsPerSecond, burstSize, timeSource);
            case "adaptive" -> new AdaptiveRateLimiter(requestsPerSecond, minRate, maxRate, timeSource);
            default -> throw new IllegalArgumentException("Unknown rate limiter mode for " + api + " API: " + mode);
        };
        log.info("Using {} rate limiter for {} API at {} requests/second", mode, api, requestsPerSecond);
        return limiter;
    }
}
