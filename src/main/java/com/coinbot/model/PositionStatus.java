package com.coinbot.model;

/**
 * Lifecycle states of a position.
 * <p>
 * Legal transitions: OPENING to OPEN or FAILED, OPEN to CLOSING, CLOSING to CLOSED or FAILED.
 */
public enum PositionStatus {
    /**
     * Slot reserved, order not yet confirmed by the exchange
     */
    OPENING,

    /**
     * Order filled, position is being monitored
     */
    OPEN,

    /**
     * Exit triggered, close order pending or being retried
     */
    CLOSING,

    /**
     * Close confirmed, trade recorded
     */
    CLOSED,

    /**
     * Opening failed, or close retries were exhausted
     */
    FAILED;

    /**
     * Whether a position in this state occupies its coin.
     */
    public boolean isLive() {
        return this == OPENING || this == OPEN || this == CLOSING;
    }
}
