package com.coinbot.service.monitoring.exit;

import com.coinbot.model.CloseReason;

/**
 * Fires when the price has moved against the position to or past its stop-loss price.
 * Evaluated first so a fast reversal is never reported as a trailing exit.
 */
public class StopLossExitRule extends AbstractExitRule {

    public static final int PRIORITY = 100;

    public StopLossExitRule() {
        super(PRIORITY, "StopLoss");
    }

    @Override
    public ExitDecision evaluate(ExitContext ctx) {
        double stop = ctx.getPosition().getStopLossPrice();
        boolean hit = ctx.isLong() ? ctx.getPrice() <= stop : ctx.getPrice() >= stop;
        if (!hit) {
            return ExitDecision.noExit();
        }
        return ExitDecision.exit(CloseReason.STOP_LOSS, describe("STOP_LOSS_HIT", ctx, stop));
    }
}
