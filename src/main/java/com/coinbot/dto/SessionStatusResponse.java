package com.coinbot.dto;

import com.coinbot.model.RiskConfig;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class SessionStatusResponse {
    String sessionId;
    String status;
    boolean executeOrders;
    Instant startedAt;
    Instant stoppedAt;
    List<String> coins;
    List<String> strategies;
    RiskConfig riskConfig;
    int openPositions;
    int closingPositions;
    int attentionPositions;
    int occupiedSlots;
    long queuedSignals;
    long droppedSignals;
    Map<String, Long> admissionDecisions;
    // Position monitoring counters of the current session
    long positionChecks;
    long skippedPositionChecks;
}
