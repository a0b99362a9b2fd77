package com.coinbot.dto;

import com.coinbot.model.CompletedTrade;
import com.coinbot.model.PositionSnapshot;
import com.coinbot.model.Signal;
import com.coinbot.model.StateAlert;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything the dashboard renders in one read.
 */
@Value
@Builder
public class DashboardSnapshot {
    Instant generatedAt;
    String botStatus;
    List<PositionSnapshot> positions;
    List<Signal> recentSignals;
    List<CompletedTrade> recentTrades;
    List<StateAlert> recentAlerts;
    double realisedPnl;
    double unrealisedPnl;
    long tradeCount;
    double winRatePercent;
    Map<String, Integer> tradesToday;
    Map<String, Long> cooldowns;
    Map<String, Object> sinkMetrics;
}
