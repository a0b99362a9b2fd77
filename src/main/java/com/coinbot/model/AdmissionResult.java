package com.coinbot.model;

import lombok.Value;

/**
 * Result of submitting a signal to the order gate. The snapshot is present when a
 * placeholder position was created, whether or not the order went through.
 */
@Value
public class AdmissionResult {
    AdmissionDecision decision;
    String message;
    PositionSnapshot position;

    public static AdmissionResult admitted(PositionSnapshot position) {
        return new AdmissionResult(AdmissionDecision.ADMITTED, "Position opened", position);
    }

    public static AdmissionResult rejected(AdmissionDecision decision, String message) {
        return new AdmissionResult(decision, message, null);
    }

    public static AdmissionResult failed(AdmissionDecision decision, String message, PositionSnapshot position) {
        return new AdmissionResult(decision, message, position);
    }

    public boolean isAdmitted() {
        return decision.isAdmitted();
    }
}
