package com.coinbot.service.monitoring.exit;

import java.util.Locale;

/**
 * Shared formatting for exit rules.
 */
public abstract class AbstractExitRule implements ExitRule {

    private final int priority;
    private final String name;

    protected AbstractExitRule(int priority, String name) {
        this.priority = priority;
        this.name = name;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    public String getName() {
        return name;
    }

    protected static String describe(String label, ExitContext ctx, double threshold) {
        return String.format(Locale.ROOT, "%s (price: %.6f, threshold: %.6f, P&L: %.2f%%)",
                label, ctx.getPrice(), threshold, ctx.getProfitPercent());
    }

    @Override
    public String toString() {
        return name + "[" + priority + "]";
    }
}
