package com.coinbot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Paper Trading Configuration
 * Parameters of the simulated exchange used when no live exchange binding is configured
 */
@Configuration
@ConfigurationProperties(prefix = "paper")
@Data
public class PaperTradingConfig {

    private double initialBalance = 1000.0; // USD

    // Execution configuration
    private double slippagePercentage = 0.05; // 0.05%
    private boolean enableExecutionDelay = true;
    private long executionDelayMs = 200;

    // Fee charged on notional for each fill
    private double feePercentage = 0.04;

    // Order rejection simulation
    private boolean enableOrderRejection = false;
    private double rejectionProbability = 0.02; // 2%
}
