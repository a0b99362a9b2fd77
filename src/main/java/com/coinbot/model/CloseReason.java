package com.coinbot.model;

/**
 * Why a position was closed. Exactly one reason is recorded per position.
 */
public enum CloseReason {
    STOP_LOSS,
    TAKE_PROFIT,
    TRAILING_STOP,
    MANUAL,
    EMERGENCY
}
