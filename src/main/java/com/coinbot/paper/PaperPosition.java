package com.coinbot.paper;

import com.coinbot.model.PositionSide;
import lombok.Value;

import java.time.Instant;

/**
 * Exchange-side record of a simulated open position.
 */
@Value
class PaperPosition {
    String orderId;
    String coin;
    PositionSide side;
    double entryPrice;
    double size;
    double margin;
    Instant openedAt;
}
