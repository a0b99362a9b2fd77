package com.coinbot.model;

import com.coinbot.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RiskConfigTest {

    private static RiskConfig.RiskConfigBuilder valid() {
        return RiskConfig.builder()
                .maxPositions(2)
                .positionSizeUsd(20.0)
                .stopLossPercent(0.6)
                .takeProfitPercent(1.6)
                .trailingStopPercent(0.3)
                .trailingActivationPercent(0.3)
                .minSignalStrength(0.6)
                .cooldownSeconds(300);
    }

    @Test
    @DisplayName("A complete snapshot validates and returns itself")
    void validSnapshot() {
        RiskConfig config = valid().build();

        assertSame(config, config.validate());
    }

    @Test
    @DisplayName("Each invalid field is reported by name")
    void invalidFields() {
        assertMessageContains(valid().maxPositions(0).build(), "maxPositions");
        assertMessageContains(valid().positionSizeUsd(0.0).build(), "positionSizeUsd");
        assertMessageContains(valid().stopLossPercent(-0.1).build(), "stopLossPercent");
        assertMessageContains(valid().stopLossPercent(100.0).build(), "stopLossPercent");
        assertMessageContains(valid().takeProfitPercent(Double.NaN).build(), "takeProfitPercent");
        assertMessageContains(valid().trailingStopPercent(0.0).build(), "trailingStopPercent");
        assertMessageContains(valid().trailingActivationPercent(-1.0).build(), "trailingActivationPercent");
        assertMessageContains(valid().minSignalStrength(1.2).build(), "minSignalStrength");
        assertMessageContains(valid().cooldownSeconds(-1).build(), "cooldownSeconds");
    }

    @Test
    @DisplayName("Zero activation and zero cooldown are allowed")
    void zeroBoundsAllowed() {
        assertDoesNotThrow(() -> valid().trailingActivationPercent(0.0).cooldownSeconds(0).build().validate());
    }

    private static void assertMessageContains(RiskConfig config, String field) {
        ConfigurationException e = assertThrows(ConfigurationException.class, config::validate);
        assertTrue(e.getMessage().contains(field), e.getMessage());
    }
}
