package com.bulwark.core.ratelimit;

/**
 * Request count of one client within its current fixed window.
 * Immutable; the limiter swaps in a new instance on every request.
 */
public final class RateLimitState {

    private final long requestCount;
    private final long windowStart;

    RateLimitState(long requestCount, long windowStart) {
        this.requestCount = requestCount;
        this.windowStart = windowStart;
    }

    public long getRequestCount() {
        return requestCount;
    }

    /** Epoch millis at which the current window opened. */
    public long getWindowStart() {
        return windowStart;
    }

    RateLimitState increment() {
        return new RateLimitState(requestCount + 1, windowStart);
    }

    @Override
    public String toString() {
        return "RateLimitState{requestCount=" + requestCount + ", windowStart=" + windowStart + '}';
    }
}
