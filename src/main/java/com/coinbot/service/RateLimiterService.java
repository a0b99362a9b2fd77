package com.coinbot.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Process-wide rate limiter for outbound market-data and exchange calls.
 * <p>
 * Two sliding windows must both grant a permit: one per {@link ApiType} and one global.
 * Defaults stay well under the public Binance limit of 1200 request weight per minute.
 * Callers block for at most the acquire timeout; a miss surfaces as
 * {@link RateLimitExceededException}, which the engine treats as a transient failure.
 */
@Service
@Slf4j
public class RateLimiterService {

    private static final int DEFAULT_PER_API_LIMIT = 8;
    private static final int DEFAULT_GLOBAL_LIMIT = 15;
    private static final long WINDOW_MS = 1000;
    private static final long ACQUIRE_TIMEOUT_MS = 5000;

    public enum ApiType {
        KLINES,         // candle history
        TICKER,         // last price
        ORDER,          // open/close orders
        ACCOUNT         // balance queries
    }

    private final Map<ApiType, SlidingWindow> apiWindows = new EnumMap<>(ApiType.class);
    private final SlidingWindow globalWindow;
    private final long acquireTimeoutMs;

    @Autowired
    public RateLimiterService() {
        this(DEFAULT_PER_API_LIMIT, DEFAULT_GLOBAL_LIMIT, WINDOW_MS, ACQUIRE_TIMEOUT_MS);
    }

    public RateLimiterService(int perApiLimit, int globalLimit, long windowMs, long acquireTimeoutMs) {
        this.globalWindow = new SlidingWindow(globalLimit, windowMs);
        for (ApiType type : ApiType.values()) {
            apiWindows.put(type, new SlidingWindow(perApiLimit, windowMs));
        }
        this.acquireTimeoutMs = acquireTimeoutMs;
        log.info("RateLimiterService initialized with per-API limit: {}/{}ms, global limit: {}/{}ms",
                perApiLimit, windowMs, globalLimit, windowMs);
    }

    /**
     * Blocks until both windows grant a permit or the default timeout elapses.
     *
     * @return true if a permit was acquired
     */
    public boolean acquire(ApiType apiType) {
        return acquire(apiType, acquireTimeoutMs);
    }

    public boolean acquire(ApiType apiType, long timeoutMs) {
        long start = System.currentTimeMillis();
        long deadline = start + timeoutMs;
        try {
            while (true) {
                if (tryAcquire(apiType)) {
                    if (log.isTraceEnabled()) {
                        log.trace("Rate limit permit acquired for {} in {}ms", apiType, System.currentTimeMillis() - start);
                    }
                    return true;
                }
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    log.warn("Rate limit timeout after {}ms for API type: {}", timeoutMs, apiType);
                    return false;
                }
                Thread.sleep(Math.min(25, remaining));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Rate limit acquisition interrupted for API type: {}", apiType);
            return false;
        }
    }

    /**
     * Non-blocking attempt. A global permit is only consumed when the per-API window also has room.
     */
    public boolean tryAcquire(ApiType apiType) {
        SlidingWindow apiWindow = apiWindows.get(apiType);
        synchronized (globalWindow) {
            long now = System.currentTimeMillis();
            if (!globalWindow.hasRoom(now) || !apiWindow.hasRoom(now)) {
                return false;
            }
            globalWindow.record(now);
            apiWindow.record(now);
            return true;
        }
    }

    /**
     * Runs {@code call} after acquiring a permit.
     *
     * @throws RateLimitExceededException if no permit could be acquired in time
     */
    public <T, E extends Exception> T executeWithRateLimit(ApiType apiType, ApiCall<T, E> call) throws E {
        if (!acquire(apiType)) {
            throw new RateLimitExceededException("Rate limit exceeded for API type: " + apiType);
        }
        return call.execute();
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        long now = System.currentTimeMillis();
        synchronized (globalWindow) {
            stats.put("globalRequestsInWindow", globalWindow.count(now));
            Map<String, Integer> perApi = new LinkedHashMap<>();
            apiWindows.forEach((type, window) -> perApi.put(type.name(), window.count(now)));
            stats.put("perApiRequestsInWindow", perApi);
        }
        return stats;
    }

    @FunctionalInterface
    public interface ApiCall<T, E extends Exception> {
        T execute() throws E;
    }

    public static class RateLimitExceededException extends RuntimeException {
        public RateLimitExceededException(String message) {
            super(message);
        }
    }

    /**
     * Ring of the last {@code maxRequests} grant timestamps. Guarded by the global window's monitor.
     */
    private static final class SlidingWindow {
        private final long[] grants;
        private final long windowMs;
        private int next;

        SlidingWindow(int maxRequests, long windowMs) {
            if (maxRequests < 1) {
                throw new IllegalArgumentException("maxRequests must be >= 1");
            }
            this.grants = new long[maxRequests];
            this.windowMs = windowMs;
        }

        // The slot about to be overwritten holds the oldest grant
        boolean hasRoom(long now) {
            return grants[next] <= now - windowMs;
        }

        void record(long now) {
            grants[next] = now;
            next = (next + 1) % grants.length;
        }

        int count(long now) {
            int count = 0;
            for (long grant : grants) {
                if (grant > now - windowMs) {
                    count++;
                }
            }
            return count;
        }
    }
}
