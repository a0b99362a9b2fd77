package com.coinbot.service.monitoring.exit;

import com.coinbot.model.Position;
import com.coinbot.model.PositionSide;
import com.coinbot.model.RiskConfig;
import lombok.Getter;

/**
 * Inputs of a single exit evaluation: the position, the mark price just fetched and the
 * risk snapshot in force for this check.
 */
@Getter
public class ExitContext {

    private final Position position;
    private final double price;
    private final RiskConfig risk;

    public ExitContext(Position position, double price, RiskConfig risk) {
        this.position = position;
        this.price = price;
        this.risk = risk;
    }

    public boolean isLong() {
        return position.getSide() == PositionSide.LONG;
    }

    public double getProfitPercent() {
        return position.profitPercentAt(price);
    }
}
