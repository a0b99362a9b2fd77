package com.coinbot.service.sink;

import com.coinbot.model.CompletedTrade;
import com.coinbot.model.PositionSnapshot;
import com.coinbot.model.Signal;
import com.coinbot.model.StateAlert;

/**
 * Fire-and-forget publication of engine state to dashboards and history.
 * Implementations must never block the caller and must never throw.
 */
public interface StateSink {

    void publishSignal(Signal signal);

    void publishPositionUpdate(PositionSnapshot position);

    void publishTrade(CompletedTrade trade);

    void publishAlert(StateAlert alert);
}
