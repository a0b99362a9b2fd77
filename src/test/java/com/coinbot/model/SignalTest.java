package com.coinbot.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignalTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    @DisplayName("Actionable signals clamp strength to 1 and are well formed")
    void actionableClamps() {
        Signal signal = Signal.actionable("BTC", SignalAction.BUY, 1.4, NOW, "rsi_1h", null);

        assertEquals(1.0, signal.getStrength());
        assertNull(signal.validationError());
        assertTrue(signal.getMetadata().isEmpty());
    }

    @Test
    @DisplayName("Factories refuse HOLD or non-positive strength for actionable signals")
    void actionableRejectsInvalid() {
        assertThrows(IllegalArgumentException.class,
                () -> Signal.actionable("BTC", SignalAction.HOLD, 0.5, NOW, "rsi_1h", null));
        assertThrows(IllegalArgumentException.class,
                () -> Signal.actionable("BTC", SignalAction.SELL, 0.0, NOW, "rsi_1h", null));
        assertThrows(IllegalArgumentException.class,
                () -> Signal.actionable("BTC", SignalAction.SELL, Double.NaN, NOW, "rsi_1h", null));
    }

    @Test
    @DisplayName("HOLD has zero strength")
    void holdHasZeroStrength() {
        Signal hold = Signal.hold("ETH", NOW, "sma_5min", null);

        assertTrue(hold.isHold());
        assertEquals(0.0, hold.getStrength());
        assertNull(hold.validationError());
    }

    @Test
    @DisplayName("Validation reports malformed signals built through the raw constructor")
    void validationErrors() {
        assertEquals("coin is missing", new Signal(" ", SignalAction.BUY, 0.5, NOW, "x", null).validationError());
        assertEquals("source is missing", new Signal("BTC", SignalAction.BUY, 0.5, NOW, null, null).validationError());
        assertEquals("timestamp is missing", new Signal("BTC", SignalAction.BUY, 0.5, null, "x", null).validationError());
        assertNotNull(new Signal("BTC", SignalAction.BUY, 1.5, NOW, "x", null).validationError());
        assertNotNull(new Signal("BTC", SignalAction.HOLD, 0.3, NOW, "x", null).validationError());
        assertNotNull(new Signal("BTC", SignalAction.SELL, 0.0, NOW, "x", null).validationError());
    }

    @Test
    @DisplayName("Metadata is copied and read-only")
    void metadataImmutable() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("rsi", 25.0);
        Signal signal = Signal.actionable("BTC", SignalAction.BUY, 0.7, NOW, "rsi_1h", metadata);

        metadata.put("rsi", 99.0);

        assertEquals(25.0, signal.getMetadata().get("rsi"));
        assertThrows(UnsupportedOperationException.class, () -> signal.getMetadata().put("x", 1));
    }

    @Test
    @DisplayName("BUY opens LONG, SELL opens SHORT, HOLD opens nothing")
    void actionToSide() {
        assertEquals(PositionSide.LONG, SignalAction.BUY.toPositionSide());
        assertEquals(PositionSide.SHORT, SignalAction.SELL.toPositionSide());
        assertThrows(IllegalStateException.class, SignalAction.HOLD::toPositionSide);
    }
}
