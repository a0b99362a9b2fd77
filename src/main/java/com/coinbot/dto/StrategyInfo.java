package com.coinbot.dto;

/**
 * DTO for a signal strategy registered in the running session
 */
public record StrategyInfo(
    String name,
    String timeframe,
    String description,
    long checkIntervalSeconds,
    boolean enabled,
    int coins
) {
}
