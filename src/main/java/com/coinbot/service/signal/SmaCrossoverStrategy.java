package com.coinbot.service.signal;

import com.coinbot.exception.FetchException;
import com.coinbot.model.Candle;
import com.coinbot.model.Signal;
import com.coinbot.model.SignalAction;
import com.coinbot.service.marketdata.MarketDataClient;
import com.coinbot.util.IndicatorUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short/long SMA crossover. A fresh cross emits BUY (golden) or SELL (death); while the
 * averages stay separated the trend is signalled once per coin until the direction flips.
 */
@Slf4j
public class SmaCrossoverStrategy extends AbstractCandleStrategy {

    private static final int EXTRA_CANDLES = 50;

    private final int shortPeriod;
    private final int longPeriod;

    // Last trend direction signalled per coin
    private final Map<String, SignalAction> lastTrend = new ConcurrentHashMap<>();

    public SmaCrossoverStrategy(String name, String timeframe, MarketDataClient marketData,
                                Duration minRequestInterval, Clock clock, int shortPeriod, int longPeriod) {
        super(name, timeframe, marketData, minRequestInterval, clock);
        if (shortPeriod < 1 || longPeriod <= shortPeriod) {
            throw new IllegalArgumentException("SMA periods must satisfy 1 <= short < long");
        }
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
    }

    @Override
    protected Signal evaluate(String coin) throws FetchException {
        List<Candle> candles = fetchCandles(coin, longPeriod + EXTRA_CANDLES);
        if (candles.size() < longPeriod + 1) {
            log.warn("{}: insufficient data for {} ({} candles)", getName(), coin, candles.size());
            return null;
        }

        double[] closes = IndicatorUtils.closes(candles);
        double[] shortSma = IndicatorUtils.sma(closes, shortPeriod);
        double[] longSma = IndicatorUtils.sma(closes, longPeriod);
        int last = closes.length - 1;
        double curShort = shortSma[last];
        double curLong = longSma[last];
        double prevShort = shortSma[last - 1];
        double prevLong = longSma[last - 1];
        double price = closes[last];

        SignalAction action = SignalAction.HOLD;
        if (prevShort <= prevLong && curShort > curLong) {
            action = SignalAction.BUY;
        } else if (prevShort >= prevLong && curShort < curLong) {
            action = SignalAction.SELL;
        } else if (curShort > curLong && lastTrend.get(coin) != SignalAction.BUY) {
            action = SignalAction.BUY;
        } else if (curShort < curLong && lastTrend.get(coin) != SignalAction.SELL) {
            action = SignalAction.SELL;
        }
        if (action != SignalAction.HOLD) {
            lastTrend.put(coin, action);
        }

        double separation = Math.abs(curShort - curLong) / curLong;
        double strength = 0.0;
        if (action == SignalAction.BUY && curShort > curLong && price > curShort) {
            strength = Math.min(1.0, 0.6 + separation * 20.0);
        } else if (action == SignalAction.SELL && curShort < curLong && price < curShort) {
            strength = Math.min(1.0, 0.6 + separation * 20.0);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("shortSma", curShort);
        metadata.put("longSma", curLong);
        metadata.put("price", price);
        metadata.put("separationPercent", Math.round(separation * 10000.0) / 100.0);
        metadata.put("timeframe", getTimeframe());

        // A cross without price confirmation has no strength and is reported as HOLD
        return signal(coin, action, strength, metadata);
    }
}
