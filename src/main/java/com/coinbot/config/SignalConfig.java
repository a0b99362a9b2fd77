package com.coinbot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Signal Strategy Configuration
 * Enabled strategies, indicator parameters and market-data access settings
 */
@Configuration
@ConfigurationProperties(prefix = "signals")
@Data
public class SignalConfig {

    private List<String> enabledStrategies = new ArrayList<>(List.of(
            "rsi_1h", "sma_5min", "macd_15min", "range_24h_low"));

    // Market data
    private String marketDataBaseUrl = "https://api.binance.com/api/v3";
    private String quoteAsset = "USDT";
    private long connectTimeoutSeconds = 10;
    private long readTimeoutSeconds = 10;
    // Bounds the whole request, including a body that trickles in slowly
    private long callTimeoutSeconds = 20;

    // Minimum spacing between outbound requests of one strategy instance
    private long minRequestIntervalMs = 500;

    private Rsi rsi = new Rsi();
    private Sma sma = new Sma();
    private Macd macd = new Macd();
    private Range range = new Range();

    @Data
    public static class Rsi {
        private int period = 14;
        private double oversold = 32.0;
        private double overbought = 68.0;
    }

    @Data
    public static class Sma {
        private int shortPeriod = 10;
        private int longPeriod = 20;
    }

    @Data
    public static class Macd {
        private int fastPeriod = 12;
        private int slowPeriod = 26;
        private int signalPeriod = 9;
    }

    @Data
    public static class Range {
        // Buy zone is [low * (1 + offset), low * (1 + offset + tolerance)]
        private double longOffsetPercent = -1.0;
        private double tolerancePercent = 2.0;
    }
}
