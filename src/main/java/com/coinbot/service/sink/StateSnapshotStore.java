package com.coinbot.service.sink;

import com.coinbot.model.CompletedTrade;
import com.coinbot.model.PositionSnapshot;
import com.coinbot.model.PositionStatus;
import com.coinbot.model.Signal;
import com.coinbot.model.StateAlert;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory dashboard state: latest snapshot per live position and bounded histories of
 * signals, trades and alerts. Trade totals cover every recorded trade, not just the retained
 * history. Written only by the sink flush, read by the REST layer.
 */
@Component
public class StateSnapshotStore {

    static final int MAX_SIGNALS = 200;
    static final int MAX_TRADES = 1000;
    static final int MAX_ALERTS = 200;

    private final Deque<Signal> signals = new ArrayDeque<>();
    private final Deque<CompletedTrade> trades = new ArrayDeque<>();
    private final Deque<StateAlert> alerts = new ArrayDeque<>();
    private final Map<String, PositionSnapshot> livePositions = new LinkedHashMap<>();

    private long tradeCount;
    private long winningTrades;
    private double realisedPnl;

    public synchronized void recordSignal(Signal signal) {
        append(signals, signal, MAX_SIGNALS);
    }

    public synchronized void recordTrade(CompletedTrade trade) {
        append(trades, trade, MAX_TRADES);
        tradeCount++;
        if (trade.isWin()) {
            winningTrades++;
        }
        realisedPnl += trade.getPnl();
    }

    public synchronized void recordAlert(StateAlert alert) {
        append(alerts, alert, MAX_ALERTS);
    }

    /**
     * Keeps the latest snapshot per position id. Closed positions and positions that failed
     * while opening drop out; a position that failed on close stays visible until acknowledged.
     */
    public synchronized void recordPosition(PositionSnapshot position) {
        PositionStatus status = position.getStatus();
        boolean terminal = status == PositionStatus.CLOSED
                || (status == PositionStatus.FAILED && (!position.isFailedOnClose() || position.isAcknowledged()));
        if (terminal) {
            livePositions.remove(position.getId());
        } else {
            livePositions.put(position.getId(), position);
        }
    }

    public synchronized List<Signal> recentSignals() {
        return newestFirst(signals);
    }

    public synchronized List<CompletedTrade> recentTrades() {
        return newestFirst(trades);
    }

    public synchronized List<StateAlert> recentAlerts() {
        return newestFirst(alerts);
    }

    public synchronized List<PositionSnapshot> livePositions() {
        return new ArrayList<>(livePositions.values());
    }

    public synchronized double realisedPnl() {
        return realisedPnl;
    }

    public synchronized long tradeCount() {
        return tradeCount;
    }

    public synchronized double winRatePercent() {
        return tradeCount == 0 ? 0.0 : winningTrades * 100.0 / tradeCount;
    }

    private static <T> void append(Deque<T> deque, T item, int max) {
        deque.addLast(item);
        while (deque.size() > max) {
            deque.removeFirst();
        }
    }

    private static <T> List<T> newestFirst(Deque<T> deque) {
        List<T> copy = new ArrayList<>(deque.size());
        deque.descendingIterator().forEachRemaining(copy::add);
        return copy;
    }
}
