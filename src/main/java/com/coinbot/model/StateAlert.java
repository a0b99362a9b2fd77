package com.coinbot.model;

import lombok.Value;

import java.time.Instant;

/**
 * Operator-facing alert published to the state sink.
 */
@Value
public class StateAlert {
    AlertLevel level;
    String coin;
    String message;
    Instant timestamp;

    public static StateAlert of(AlertLevel level, String coin, String message, Instant timestamp) {
        return new StateAlert(level, coin, message, timestamp);
    }
}
