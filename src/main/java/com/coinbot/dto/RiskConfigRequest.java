package com.coinbot.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * Partial risk update for a reload. Only the fields that are set replace the current values.
 */
@Data
public class RiskConfigRequest {

    @Min(value = 1, message = "maxPositions must be at least 1")
    private Integer maxPositions;

    @Positive(message = "positionSizeUsd must be positive")
    private Double positionSizeUsd;

    @Positive(message = "stopLossPercent must be positive")
    private Double stopLossPercent;

    @Positive(message = "takeProfitPercent must be positive")
    private Double takeProfitPercent;

    @Positive(message = "trailingStopPercent must be positive")
    private Double trailingStopPercent;

    @PositiveOrZero(message = "trailingActivationPercent must not be negative")
    private Double trailingActivationPercent;

    @DecimalMin(value = "0.0", message = "minSignalStrength must be within [0, 1]")
    @DecimalMax(value = "1.0", message = "minSignalStrength must be within [0, 1]")
    private Double minSignalStrength;

    @PositiveOrZero(message = "cooldownSeconds must not be negative")
    private Long cooldownSeconds;
}
