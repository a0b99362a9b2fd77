package com.coinbot.service.monitoring.exit;

import com.coinbot.model.CloseReason;

/**
 * Fires when the price has moved in the position's favour to or past its take-profit price.
 */
public class TakeProfitExitRule extends AbstractExitRule {

    public static final int PRIORITY = 200;

    public TakeProfitExitRule() {
        super(PRIORITY, "TakeProfit");
    }

    @Override
    public ExitDecision evaluate(ExitContext ctx) {
        double target = ctx.getPosition().getTakeProfitPrice();
        boolean hit = ctx.isLong() ? ctx.getPrice() >= target : ctx.getPrice() <= target;
        if (!hit) {
            return ExitDecision.noExit();
        }
        return ExitDecision.exit(CloseReason.TAKE_PROFIT, describe("TARGET_HIT", ctx, target));
    }
}
