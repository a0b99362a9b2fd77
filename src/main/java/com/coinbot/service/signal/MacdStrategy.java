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

/**
 * MACD histogram zero-cross: BUY when it crosses above zero, SELL when it crosses below.
 */
@Slf4j
public class MacdStrategy extends AbstractCandleStrategy {

    private static final int MAX_CANDLES = 200;

    private final int fastPeriod;
    private final int slowPeriod;
    private final int signalPeriod;

    public MacdStrategy(String name, String timeframe, MarketDataClient marketData, Duration minRequestInterval,
                        Clock clock, int fastPeriod, int slowPeriod, int signalPeriod) {
        super(name, timeframe, marketData, minRequestInterval, clock);
        if (fastPeriod < 1 || slowPeriod <= fastPeriod || signalPeriod < 1) {
            throw new IllegalArgumentException("MACD periods must satisfy 1 <= fast < slow and signal >= 1");
        }
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.signalPeriod = signalPeriod;
    }

    @Override
    protected Signal evaluate(String coin) throws FetchException {
        int required = slowPeriod + signalPeriod + 10;
        List<Candle> candles = fetchCandles(coin, Math.min(required, MAX_CANDLES));
        if (candles.size() < Math.min(required, MAX_CANDLES)) {
            log.warn("{}: insufficient data for {} ({} candles)", getName(), coin, candles.size());
            return null;
        }

        double[] closes = IndicatorUtils.closes(candles);
        double[] histogram = IndicatorUtils.macdHistogram(closes, fastPeriod, slowPeriod, signalPeriod);
        double current = histogram[histogram.length - 1];
        double previous = histogram[histogram.length - 2];

        SignalAction action = SignalAction.HOLD;
        if (previous <= 0.0 && current > 0.0) {
            action = SignalAction.BUY;
        } else if (previous >= 0.0 && current < 0.0) {
            action = SignalAction.SELL;
        }

        double strength = 0.0;
        if (action != SignalAction.HOLD) {
            double histogramBoost = Math.min(0.2, Math.abs(current) * 0.05);
            double momentumBoost = Math.min(0.1, Math.abs(current - previous) * 0.02);
            strength = Math.min(1.0, 0.7 + histogramBoost + momentumBoost);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("histogram", current);
        metadata.put("previousHistogram", previous);
        metadata.put("price", closes[closes.length - 1]);
        metadata.put("timeframe", getTimeframe());
        return signal(coin, action, strength, metadata);
    }
}
