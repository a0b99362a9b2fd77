package com.coinbot.service.signal;

import com.coinbot.exception.FetchException;
import com.coinbot.model.Candle;
import com.coinbot.model.Signal;
import com.coinbot.model.SignalAction;
import com.coinbot.service.marketdata.MarketDataClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Base class for strategies that read candles from a {@link MarketDataClient}.
 * <p>
 * Each instance spaces its own outbound requests by at least {@code minRequestInterval};
 * concurrent callers of the same instance wait their turn. Fetch failures are logged and
 * mapped to a null signal.
 */
@Slf4j
public abstract class AbstractCandleStrategy implements SignalStrategy {

    private final String name;
    private final String timeframe;
    private final MarketDataClient marketData;
    private final long minRequestIntervalNanos;
    protected final Clock clock;

    private final Object throttleLock = new Object();
    private long lastRequestNanos;
    private boolean anyRequest;

    protected AbstractCandleStrategy(String name, String timeframe, MarketDataClient marketData,
                                     Duration minRequestInterval, Clock clock) {
        this.name = name;
        this.timeframe = timeframe;
        this.marketData = marketData;
        this.minRequestIntervalNanos = minRequestInterval.toNanos();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getTimeframe() {
        return timeframe;
    }

    @Override
    public final Signal generate(String coin) {
        try {
            return evaluate(coin);
        } catch (FetchException e) {
            log.warn("{}: market data unavailable for {}: {}", name, coin, e.getMessage());
            return null;
        }
    }

    /**
     * Strategy-specific evaluation.
     *
     * @return the signal, or null when there is not enough data
     */
    protected abstract Signal evaluate(String coin) throws FetchException;

    protected List<Candle> fetchCandles(String coin, int limit) throws FetchException {
        throttle();
        return marketData.fetchCandles(coin, timeframe, limit);
    }

    protected double fetchPrice(String coin) throws FetchException {
        throttle();
        return marketData.fetchPrice(coin);
    }

    /**
     * Builds an actionable signal, degrading to HOLD when the computed strength is not positive.
     */
    protected Signal signal(String coin, SignalAction action, double strength, Map<String, Object> metadata) {
        if (action == SignalAction.HOLD || !(strength > 0.0)) {
            return Signal.hold(coin, clock.instant(), name, metadata);
        }
        return Signal.actionable(coin, action, strength, clock.instant(), name, metadata);
    }

    private void throttle() throws FetchException {
        if (minRequestIntervalNanos <= 0) {
            return;
        }
        synchronized (throttleLock) {
            if (anyRequest) {
                long waitNanos = lastRequestNanos + minRequestIntervalNanos - System.nanoTime();
                if (waitNanos > 0) {
                    try {
                        Thread.sleep(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new FetchException(name + ": interrupted while throttling", e);
                    }
                }
            }
            lastRequestNanos = System.nanoTime();
            anyRequest = true;
        }
    }
}
