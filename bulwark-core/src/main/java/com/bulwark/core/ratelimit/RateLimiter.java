package com.bulwark.core.ratelimit;

import com.bulwark.core.error.SecurityError;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Fixed-window request counter keyed by client fingerprint.
 *
 * <p>
 * Each key is updated through an atomic compute on the backing concurrent map,
 * so concurrent requests from the same client never lose increments while
 * different clients never contend on a shared lock. A fixed window keeps one
 * small state object per client; bursts straddling a window boundary can
 * reach up to twice the limit.
 * </p>
 *
 * <p>
 * Idle clients are evicted after two windows without a request.
 * </p>
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final int maxRequests;
    private final long windowMs;
    private final Clock clock;
    private final Cache<String, RateLimitState> states;

    public RateLimiter(int maxRequests, long windowMs) {
        this(maxRequests, windowMs, Clock.systemUTC());
    }

    public RateLimiter(int maxRequests, long windowMs, Clock clock) {
        if (maxRequests <= 0) {
            throw SecurityError.config("rateLimitRequests must be positive, got " + maxRequests);
        }
        if (windowMs <= 0) {
            throw SecurityError.config("rateLimitWindowMs must be positive, got " + windowMs);
        }
        this.maxRequests = maxRequests;
        this.windowMs = windowMs;
        this.clock = clock;
        this.states = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofMillis(windowMs).multipliedBy(2))
                .build();
    }

    /**
     * Count a request for this client.
     *
     * @return true if the request is within the limit of the current window
     */
    public boolean tryAcquire(String fingerprint) {
        long now = clock.millis();
        RateLimitState state = states.asMap().compute(fingerprint, (key, existing) -> {
            if (existing == null || now - existing.getWindowStart() > windowMs) {
                return new RateLimitState(1, now);
            }
            return existing.increment();
        });

        boolean allowed = state.getRequestCount() <= maxRequests;
        if (!allowed) {
            log.debug("[Bulwark] Rate limit exceeded for client {}: {}/{} in window",
                    abbreviate(fingerprint), state.getRequestCount(), maxRequests);
        }
        return allowed;
    }

    /**
     * Milliseconds until the client's current window closes; 0 for unknown clients.
     */
    public long timeUntilReset(String fingerprint) {
        RateLimitState state = states.getIfPresent(fingerprint);
        if (state == null) {
            return 0;
        }
        return Math.max(0, windowMs - (clock.millis() - state.getWindowStart()));
    }

    /** Current state of a client, or null if it has not been seen (or was evicted). */
    public RateLimitState getState(String fingerprint) {
        return states.getIfPresent(fingerprint);
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public long getWindowMs() {
        return windowMs;
    }

    private static String abbreviate(String fingerprint) {
        return fingerprint != null && fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }
}
