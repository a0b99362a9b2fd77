package com.coinbot.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable view of a {@link Position} at one instant. This is what leaves the engine:
 * state sink updates, REST responses and exchange close requests.
 */
@Value
@Builder
public class PositionSnapshot {
    String id;
    String coin;
    PositionSide side;
    String source;
    PositionStatus status;
    double entryPrice;
    double size;
    String orderId;
    Instant openedAt;
    double stopLossPrice;
    double takeProfitPrice;
    double trailingWatermark;
    double trailingStopPrice;
    boolean trailingActive;
    double lastMarkPrice;
    double unrealizedPnl;
    CloseReason closeReason;
    int closeAttempts;
    double exitPrice;
    Instant closedAt;
    String failureMessage;
    boolean failedOnClose;
    boolean acknowledged;
}
