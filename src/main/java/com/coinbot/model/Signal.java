package com.coinbot.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable trading recommendation produced by a {@link com.coinbot.service.signal.SignalStrategy}.
 * <p>
 * Well-formed signals satisfy {@code strength == 0.0} exactly when {@code action == HOLD}.
 * The factory methods enforce this; the raw constructor does not, so that the order gate
 * can reject malformed signals coming from third-party strategies.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Signal {

    private final String coin;
    private final SignalAction action;
    private final double strength;
    private final Instant timestamp;
    private final String source;
    private final Map<String, Object> metadata;

    public Signal(String coin, SignalAction action, double strength, Instant timestamp,
                  String source, Map<String, Object> metadata) {
        this.coin = coin;
        this.action = action;
        this.strength = strength;
        this.timestamp = timestamp;
        this.source = source;
        this.metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Creates a BUY or SELL signal. Strength is clamped into (0, 1].
     */
    public static Signal actionable(String coin, SignalAction action, double strength, Instant timestamp,
                                    String source, Map<String, Object> metadata) {
        if (action == null || action == SignalAction.HOLD) {
            throw new IllegalArgumentException("Actionable signal requires BUY or SELL, got " + action);
        }
        if (Double.isNaN(strength) || strength <= 0.0) {
            throw new IllegalArgumentException("Actionable signal requires positive strength, got " + strength);
        }
        return new Signal(coin, action, Math.min(1.0, strength), timestamp, source, metadata);
    }

    public static Signal hold(String coin, Instant timestamp, String source, Map<String, Object> metadata) {
        return new Signal(coin, SignalAction.HOLD, 0.0, timestamp, source, metadata);
    }

    public boolean isHold() {
        return action == SignalAction.HOLD;
    }

    /**
     * Describes the first structural problem of this signal, or returns null when it is well formed.
     */
    public String validationError() {
        if (coin == null || coin.isBlank()) {
            return "coin is missing";
        }
        if (source == null || source.isBlank()) {
            return "source is missing";
        }
        if (action == null) {
            return "action is missing";
        }
        if (timestamp == null) {
            return "timestamp is missing";
        }
        if (Double.isNaN(strength) || strength < 0.0 || strength > 1.0) {
            return "strength " + strength + " is outside [0, 1]";
        }
        if (action == SignalAction.HOLD && strength != 0.0) {
            return "HOLD signal must have zero strength";
        }
        if (action != SignalAction.HOLD && strength == 0.0) {
            return action + " signal must have non-zero strength";
        }
        return null;
    }
}
