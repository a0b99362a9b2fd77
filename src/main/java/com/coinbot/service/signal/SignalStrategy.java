package com.coinbot.service.signal;

import com.coinbot.model.Signal;

/**
 * Pluggable signal source.
 * <p>
 * Implementations share no state with the engine. They may block on network I/O and may be
 * slow; the scheduler runs them on worker threads and never invokes the same (strategy, coin)
 * pair twice concurrently.
 */
public interface SignalStrategy {

    /**
     * Unique registry name, e.g. "rsi_1h". Used as the signal source and as the key of
     * the check interval.
     */
    String getName();

    /**
     * Candle interval the strategy reads, e.g. "1h".
     */
    String getTimeframe();

    /**
     * Evaluates {@code coin} now.
     *
     * @return a signal (HOLD when no rule fires), or null when data is insufficient or unavailable
     */
    Signal generate(String coin);

    default String getDescription() {
        return getName();
    }
}
