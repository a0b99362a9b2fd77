package com.coinbot.service.signal;

import com.coinbot.config.SignalConfig;
import com.coinbot.exception.ConfigurationException;
import com.coinbot.model.StrategyType;
import com.coinbot.service.marketdata.MarketDataClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Builds fresh strategy instances for a trading session from {@link SignalConfig}.
 * Instances are not shared between sessions since each keeps its own throttle and trend state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StrategyFactory {

    private final SignalConfig signalConfig;
    private final MarketDataClient marketDataClient;
    private final Clock clock;

    /**
     * Creates the strategies listed in {@code signals.enabled-strategies}, in order and without duplicates.
     *
     * @throws ConfigurationException for an unknown strategy name or invalid parameters
     */
    public List<SignalStrategy> createEnabledStrategies() {
        List<SignalStrategy> strategies = new ArrayList<>();
        for (String name : new LinkedHashSet<>(signalConfig.getEnabledStrategies())) {
            StrategyType type = StrategyType.fromStrategyName(name)
                    .orElseThrow(() -> new ConfigurationException("Unknown signal strategy: " + name));
            strategies.add(create(type));
        }
        if (strategies.isEmpty()) {
            throw new ConfigurationException("No signal strategies enabled");
        }
        log.info("Created {} signal strategies: {}", strategies.size(),
                strategies.stream().map(SignalStrategy::getName).toList());
        return strategies;
    }

    public SignalStrategy create(StrategyType type) {
        Duration minInterval = Duration.ofMillis(signalConfig.getMinRequestIntervalMs());
        try {
            return switch (type) {
                case RSI_1MIN, RSI_5MIN, RSI_1H, RSI_4H -> new RsiStrategy(type.getStrategyName(), type.getInterval(),
                        marketDataClient, minInterval, clock, signalConfig.getRsi().getPeriod(),
                        signalConfig.getRsi().getOversold(), signalConfig.getRsi().getOverbought());
                case SMA_5MIN -> new SmaCrossoverStrategy(type.getStrategyName(), type.getInterval(),
                        marketDataClient, minInterval, clock, signalConfig.getSma().getShortPeriod(),
                        signalConfig.getSma().getLongPeriod());
                case MACD_15MIN -> new MacdStrategy(type.getStrategyName(), type.getInterval(),
                        marketDataClient, minInterval, clock, signalConfig.getMacd().getFastPeriod(),
                        signalConfig.getMacd().getSlowPeriod(), signalConfig.getMacd().getSignalPeriod());
                case RANGE_24H_LOW -> new RangeLowStrategy(type.getStrategyName(), marketDataClient, minInterval,
                        clock, signalConfig.getRange().getLongOffsetPercent(),
                        signalConfig.getRange().getTolerancePercent());
            };
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid parameters for " + type.getStrategyName() + ": " + e.getMessage(), e);
        }
    }
}
