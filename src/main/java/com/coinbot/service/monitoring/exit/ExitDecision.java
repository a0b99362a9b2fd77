package com.coinbot.service.monitoring.exit;

import com.coinbot.model.CloseReason;
import lombok.Getter;

/**
 * Outcome of an {@link ExitRule} evaluation.
 */
@Getter
public final class ExitDecision {

    private static final ExitDecision NO_EXIT = new ExitDecision(null, null);

    /** Reason recorded on the position, null when the rule did not fire */
    private final CloseReason reason;

    /** Human readable detail for logs and alerts */
    private final String detail;

    private ExitDecision(CloseReason reason, String detail) {
        this.reason = reason;
        this.detail = detail;
    }

    public static ExitDecision noExit() {
        return NO_EXIT;
    }

    public static ExitDecision exit(CloseReason reason, String detail) {
        if (reason == null) {
            throw new IllegalArgumentException("Exit reason is required");
        }
        return new ExitDecision(reason, detail);
    }

    public boolean isExit() {
        return reason != null;
    }
}
