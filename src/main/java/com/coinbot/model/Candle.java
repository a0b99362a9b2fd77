package com.coinbot.model;

/**
 * OHLCV bar as returned by the market-data client. {@code openTime} is epoch millis.
 */
public record Candle(long openTime, double open, double high, double low, double close, double volume) {
}
