package com.coinbot.config;

import com.coinbot.model.RiskConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Trading Configuration
 * Risk limits and the coin universe. Percent values are in percent units (0.6 = 0.6%).
 */
@Configuration
@ConfigurationProperties(prefix = "trading")
@Data
public class TradingConfig {

    // Risk limits
    private int maxPositions = 10;
    private double positionSizeUsd = 20.0;
    private double stopLossPercent = 2.2;
    private double takeProfitPercent = 10.12;
    private double trailingStopPercent = 0.2;
    private double trailingActivationPercent = 0.3;

    // Signal filtering
    private double minSignalStrength = 0.75;
    private long cooldownSeconds = 300;

    /**
     * When false, sessions run in signal-monitoring mode: signals are generated and
     * published but never submitted to the order gate.
     */
    private boolean executeOrders = true;

    private List<String> monitoredCoins = new ArrayList<>(List.of("BTC", "ETH", "SOL", "XRP", "DOGE"));

    /**
     * Builds the immutable snapshot a session runs with. Not validated here.
     */
    public RiskConfig toRiskConfig() {
        return RiskConfig.builder()
                .maxPositions(maxPositions)
                .positionSizeUsd(positionSizeUsd)
                .stopLossPercent(stopLossPercent)
                .takeProfitPercent(takeProfitPercent)
                .trailingStopPercent(trailingStopPercent)
                .trailingActivationPercent(trailingActivationPercent)
                .minSignalStrength(minSignalStrength)
                .cooldownSeconds(cooldownSeconds)
                .build();
    }
}
