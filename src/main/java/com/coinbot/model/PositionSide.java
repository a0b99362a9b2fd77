package com.coinbot.model;

/**
 * Side of an open position. The multiplier turns price differences into signed profit.
 */
public enum PositionSide {
    LONG(1.0),
    SHORT(-1.0);

    private final double directionMultiplier;

    PositionSide(double directionMultiplier) {
        this.directionMultiplier = directionMultiplier;
    }

    public double getDirectionMultiplier() {
        return directionMultiplier;
    }
}
