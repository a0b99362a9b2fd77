package com.coinbot.model;

import com.coinbot.exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only snapshot of the risk parameters a trading session runs with.
 * <p>
 * Percent fields are in percent units: {@code 0.6} means 0.6 %. A snapshot is never mutated;
 * a reload swaps in a new instance.
 */
@Value
@Builder(toBuilder = true)
public class RiskConfig {

    int maxPositions;
    double positionSizeUsd;
    double stopLossPercent;
    double takeProfitPercent;
    double trailingStopPercent;
    double trailingActivationPercent;
    double minSignalStrength;
    long cooldownSeconds;

    /**
     * Checks every field and returns this snapshot for chaining.
     *
     * @throws ConfigurationException naming the first invalid field
     */
    public RiskConfig validate() {
        if (maxPositions < 1) {
            throw new ConfigurationException("maxPositions must be at least 1, got " + maxPositions);
        }
        requirePositive("positionSizeUsd", positionSizeUsd);
        requirePositive("stopLossPercent", stopLossPercent);
        requirePositive("takeProfitPercent", takeProfitPercent);
        requirePositive("trailingStopPercent", trailingStopPercent);
        if (stopLossPercent >= 100.0) {
            throw new ConfigurationException("stopLossPercent must be below 100, got " + stopLossPercent);
        }
        if (trailingStopPercent >= 100.0) {
            throw new ConfigurationException("trailingStopPercent must be below 100, got " + trailingStopPercent);
        }
        if (Double.isNaN(trailingActivationPercent) || trailingActivationPercent < 0.0) {
            throw new ConfigurationException("trailingActivationPercent must be >= 0, got " + trailingActivationPercent);
        }
        if (Double.isNaN(minSignalStrength) || minSignalStrength < 0.0 || minSignalStrength > 1.0) {
            throw new ConfigurationException("minSignalStrength must be within [0, 1], got " + minSignalStrength);
        }
        if (cooldownSeconds < 0) {
            throw new ConfigurationException("cooldownSeconds must be >= 0, got " + cooldownSeconds);
        }
        return this;
    }

    private static void requirePositive(String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value <= 0.0) {
            throw new ConfigurationException(field + " must be a positive number, got " + value);
        }
    }
}
