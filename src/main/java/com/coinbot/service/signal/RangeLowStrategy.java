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
 * Buys when the current price sits in a band just around the 24-hour low.
 * <p>
 * The band is {@code [low * (1 + offset), low * (1 + offset + tolerance)]}. Strength is 1.0 at
 * the bottom of the band and falls linearly to 0.7 at the top. Never emits SELL.
 */
@Slf4j
public class RangeLowStrategy extends AbstractCandleStrategy {

    private static final int LOOKBACK_HOURS = 24;

    private final double longOffsetPercent;
    private final double tolerancePercent;

    public RangeLowStrategy(String name, MarketDataClient marketData, Duration minRequestInterval, Clock clock,
                            double longOffsetPercent, double tolerancePercent) {
        super(name, "1h", marketData, minRequestInterval, clock);
        if (tolerancePercent < 0.0) {
            throw new IllegalArgumentException("tolerancePercent must be >= 0");
        }
        this.longOffsetPercent = longOffsetPercent;
        this.tolerancePercent = tolerancePercent;
    }

    @Override
    protected Signal evaluate(String coin) throws FetchException {
        List<Candle> candles = fetchCandles(coin, LOOKBACK_HOURS);
        if (candles.size() < LOOKBACK_HOURS) {
            log.warn("{}: insufficient data for {} ({}/{} candles)", getName(), coin, candles.size(), LOOKBACK_HOURS);
            return null;
        }
        double price = fetchPrice(coin);

        double low = Double.POSITIVE_INFINITY;
        double high = Double.NEGATIVE_INFINITY;
        for (Candle candle : candles) {
            low = Math.min(low, candle.low());
            high = Math.max(high, candle.high());
        }

        double bandLow = low * (1.0 + longOffsetPercent / 100.0);
        double bandHigh = low * (1.0 + (longOffsetPercent + tolerancePercent) / 100.0);
        boolean inRange = price >= bandLow && price <= bandHigh;

        double strength = 0.0;
        if (inRange) {
            double width = bandHigh - bandLow;
            strength = width == 0.0 ? 0.85 : IndicatorUtils.clamp(1.0 - (price - bandLow) / width * 0.3, 0.7, 1.0);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("price", price);
        metadata.put("low24h", low);
        metadata.put("high24h", high);
        metadata.put("bandLow", bandLow);
        metadata.put("bandHigh", bandHigh);
        metadata.put("inRange", inRange);

        Signal signal = signal(coin, inRange ? SignalAction.BUY : SignalAction.HOLD, strength, metadata);
        if (!signal.isHold()) {
            log.info("{}: {} BUY, price {} within [{}, {}] (strength {})", getName(), coin, price,
                    bandLow, bandHigh, String.format("%.2f", strength));
        }
        return signal;
    }
}
