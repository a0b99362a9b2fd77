package com.coinbot.service.monitoring.exit;

import com.coinbot.model.CloseReason;
import com.coinbot.model.Position;
import lombok.extern.slf4j.Slf4j;

/**
 * Trailing stop that follows the best price seen since entry.
 *
 * <h2>Logic</h2>
 * <ol>
 *   <li>The position's watermark advances to the current price when it is more favourable</li>
 *   <li>Once profit at the watermark reaches the activation percent the band activates</li>
 *   <li>The stop is recomputed from the watermark and only ever tightens</li>
 *   <li>Exit when the price retraces to or past the stop</li>
 * </ol>
 * The trailing state lives on the {@link Position} so it survives across checks; this rule
 * holds no state of its own.
 */
@Slf4j
public class TrailingStopExitRule extends AbstractExitRule {

    public static final int PRIORITY = 300;

    public TrailingStopExitRule() {
        super(PRIORITY, "TrailingStop");
    }

    @Override
    public ExitDecision evaluate(ExitContext ctx) {
        Position position = ctx.getPosition();
        boolean wasActive = position.isTrailingActive();
        position.advanceTrailing(ctx.getPrice(), ctx.getRisk().getTrailingStopPercent(),
                ctx.getRisk().getTrailingActivationPercent());

        if (!position.isTrailingActive()) {
            return ExitDecision.noExit();
        }
        if (!wasActive) {
            log.info("Trailing stop activated for {} {}: watermark={}, stop={}", position.getSide(),
                    position.getCoin(), position.getTrailingWatermark(), position.getTrailingStopPrice());
        }

        double stop = position.getTrailingStopPrice();
        boolean hit = ctx.isLong() ? ctx.getPrice() <= stop : ctx.getPrice() >= stop;
        if (!hit) {
            return ExitDecision.noExit();
        }
        return ExitDecision.exit(CloseReason.TRAILING_STOP, describe("TRAILING_STOP_HIT", ctx, stop));
    }
}
