/**
 * Exit rules evaluated by the position lifecycle manager.
 * <p>
 * Built-in rules in evaluation order: {@link com.coinbot.service.monitoring.exit.StopLossExitRule},
 * {@link com.coinbot.service.monitoring.exit.TakeProfitExitRule} and
 * {@link com.coinbot.service.monitoring.exit.TrailingStopExitRule}.
 */
package com.coinbot.service.monitoring.exit;
