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
 * RSI mean-reversion: BUY at or below the oversold level, SELL at or above the overbought level.
 * Strength grows with the distance past the threshold and never drops below 0.6.
 */
@Slf4j
public class RsiStrategy extends AbstractCandleStrategy {

    private static final double MIN_STRENGTH = 0.6;
    private static final int EXTRA_CANDLES = 50;

    private final int period;
    private final double oversold;
    private final double overbought;

    public RsiStrategy(String name, String timeframe, MarketDataClient marketData, Duration minRequestInterval,
                       Clock clock, int period, double oversold, double overbought) {
        super(name, timeframe, marketData, minRequestInterval, clock);
        if (period < 2) {
            throw new IllegalArgumentException("RSI period must be >= 2, got " + period);
        }
        if (!(oversold > 0.0 && oversold < overbought && overbought < 100.0)) {
            throw new IllegalArgumentException("RSI thresholds must satisfy 0 < oversold < overbought < 100");
        }
        this.period = period;
        this.oversold = oversold;
        this.overbought = overbought;
    }

    @Override
    protected Signal evaluate(String coin) throws FetchException {
        List<Candle> candles = fetchCandles(coin, period + EXTRA_CANDLES);
        if (candles.size() < period + 1) {
            log.warn("{}: insufficient data for {} ({} candles)", getName(), coin, candles.size());
            return null;
        }

        double[] closes = IndicatorUtils.closes(candles);
        double rsi = IndicatorUtils.rsi(closes, period);
        if (Double.isNaN(rsi)) {
            return null;
        }

        SignalAction action = SignalAction.HOLD;
        double strength = 0.0;
        if (rsi <= oversold) {
            action = SignalAction.BUY;
            strength = strengthFor(1.0 - rsi / oversold);
        } else if (rsi >= overbought) {
            action = SignalAction.SELL;
            strength = strengthFor((rsi - overbought) / (100.0 - overbought));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rsi", Math.round(rsi * 100.0) / 100.0);
        metadata.put("price", closes[closes.length - 1]);
        metadata.put("oversold", oversold);
        metadata.put("overbought", overbought);
        metadata.put("timeframe", getTimeframe());

        Signal signal = signal(coin, action, strength, metadata);
        if (!signal.isHold()) {
            log.info("{}: {} {} signal, RSI={} (strength {})", getName(), coin, action,
                    String.format("%.2f", rsi), String.format("%.2f", signal.getStrength()));
        }
        return signal;
    }

    static double strengthFor(double distance) {
        return IndicatorUtils.clamp(Math.max(MIN_STRENGTH, distance), 0.0, 1.0);
    }
}
