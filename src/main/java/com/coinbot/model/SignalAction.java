package com.coinbot.model;

/**
 * Direction recommended by a signal strategy.
 */
public enum SignalAction {
    BUY,
    SELL,
    HOLD;

    /**
     * Maps an actionable signal to the side of the position it opens.
     *
     * @throws IllegalStateException for HOLD, which never opens a position
     */
    public PositionSide toPositionSide() {
        return switch (this) {
            case BUY -> PositionSide.LONG;
            case SELL -> PositionSide.SHORT;
            case HOLD -> throw new IllegalStateException("HOLD does not map to a position side");
        };
    }
}
