package com.coinbot.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Record of a closed position with its realised profit.
 */
@Value
@Builder
public class CompletedTrade {
    String positionId;
    String coin;
    PositionSide side;
    String source;
    double entryPrice;
    double exitPrice;
    double size;
    CloseReason reason;
    double pnl;
    double pnlPercent;
    Instant openedAt;
    Instant closedAt;

    public static CompletedTrade from(Position position) {
        double exit = position.getExitPrice();
        return CompletedTrade.builder()
                .positionId(position.getId())
                .coin(position.getCoin())
                .side(position.getSide())
                .source(position.getSource())
                .entryPrice(position.getEntryPrice())
                .exitPrice(exit)
                .size(position.getSize())
                .reason(position.getCloseReason())
                .pnl(position.pnlAt(exit))
                .pnlPercent(position.profitPercentAt(exit))
                .openedAt(position.getOpenedAt())
                .closedAt(position.getClosedAt())
                .build();
    }

    public Duration getHoldingTime() {
        if (openedAt == null || closedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(openedAt, closedAt);
    }

    public boolean isWin() {
        return pnl > 0.0;
    }
}
