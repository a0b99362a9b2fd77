package com.coinbot.model;

/**
 * Outcome categories of an order-gate submission.
 */
public enum AdmissionDecision {
    ADMITTED,
    REJECTED_INVALID,
    REJECTED_HOLD,
    REJECTED_WEAK,
    REJECTED_DUPLICATE,
    REJECTED_COOLDOWN,
    REJECTED_MAX_POSITIONS,
    REJECTED_INSUFFICIENT_BALANCE,
    REJECTED_HALTED,
    FAILED_EXCHANGE;

    public boolean isAdmitted() {
        return this == ADMITTED;
    }
}
