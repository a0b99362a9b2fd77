package com.coinbot.service.monitoring.exit;

/**
 * One exit condition evaluated by the lifecycle manager on every check of an OPEN position.
 * <p>
 * Rules are evaluated in ascending {@link #getPriority()} order and the first rule that fires
 * wins, so exactly one close reason is recorded per exit.
 *
 * <h2>Priority ranges</h2>
 * <ul>
 *   <li>100-199: hard stops (stop-loss)</li>
 *   <li>200-299: profit targets</li>
 *   <li>300-399: trailing stops</li>
 * </ul>
 *
 * @see ExitContext
 * @see ExitDecision
 */
public interface ExitRule {

    /**
     * @return evaluation order, lower values first
     */
    int getPriority();

    /**
     * @return rule name for logging
     */
    String getName();

    /**
     * Evaluates the rule against the current mark price.
     *
     * @return {@link ExitDecision#noExit()} when the rule does not fire
     */
    ExitDecision evaluate(ExitContext ctx);
}
