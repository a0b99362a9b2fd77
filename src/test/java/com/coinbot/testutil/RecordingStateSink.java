package com.coinbot.testutil;

import com.coinbot.model.CompletedTrade;
import com.coinbot.model.PositionSnapshot;
import com.coinbot.model.Signal;
import com.coinbot.model.StateAlert;
import com.coinbot.service.sink.StateSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sink that keeps everything published, in order.
 */
public class RecordingStateSink implements StateSink {

    public final List<Signal> signals = new CopyOnWriteArrayList<>();
    public final List<PositionSnapshot> positionUpdates = new CopyOnWriteArrayList<>();
    public final List<CompletedTrade> trades = new CopyOnWriteArrayList<>();
    public final List<StateAlert> alerts = new CopyOnWriteArrayList<>();

    @Override
    public void publishSignal(Signal signal) {
        signals.add(signal);
    }

    @Override
    public void publishPositionUpdate(PositionSnapshot position) {
        positionUpdates.add(position);
    }

    @Override
    public void publishTrade(CompletedTrade trade) {
        trades.add(trade);
    }

    @Override
    public void publishAlert(StateAlert alert) {
        alerts.add(alert);
    }
}
