package com.coinbot.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Built-in signal strategies with their registry name and candle interval.
 */
public enum StrategyType {
    RSI_1MIN("rsi_1min", "1m", "RSI on 1-minute candles"),
    RSI_5MIN("rsi_5min", "5m", "RSI on 5-minute candles"),
    RSI_1H("rsi_1h", "1h", "RSI on 1-hour candles"),
    RSI_4H("rsi_4h", "4h", "RSI on 4-hour candles"),
    SMA_5MIN("sma_5min", "5m", "Short/long SMA crossover on 5-minute candles"),
    MACD_15MIN("macd_15min", "15m", "MACD histogram zero-cross on 15-minute candles"),
    RANGE_24H_LOW("range_24h_low", "1h", "Buy near the 24-hour low");

    private final String strategyName;
    private final String interval;
    private final String description;

    StrategyType(String strategyName, String interval, String description) {
        this.strategyName = strategyName;
        this.interval = interval;
        this.description = description;
    }

    public String getStrategyName() {
        return strategyName;
    }

    public String getInterval() {
        return interval;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<StrategyType> fromStrategyName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.strategyName.equalsIgnoreCase(name))
                .findFirst();
    }
}
