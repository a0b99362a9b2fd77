package com.coinbot.service.monitoring;

import com.coinbot.exception.ExchangeException;
import com.coinbot.exception.PositionNotFoundException;
import com.coinbot.model.AlertLevel;
import com.coinbot.model.CloseFill;
import com.coinbot.model.CloseReason;
import com.coinbot.model.CompletedTrade;
import com.coinbot.model.Position;
import com.coinbot.model.PositionSnapshot;
import com.coinbot.model.PositionStatus;
import com.coinbot.model.RiskConfig;
import com.coinbot.model.StateAlert;
import com.coinbot.service.exchange.ExchangeClient;
import com.coinbot.service.monitoring.exit.ExitContext;
import com.coinbot.service.monitoring.exit.ExitDecision;
import com.coinbot.service.monitoring.exit.ExitRule;
import com.coinbot.service.order.PositionBook;
import com.coinbot.service.order.PositionHandoff;
import com.coinbot.service.sink.StateSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Supervises every opened position until it is closed.
 *
 * <h2>State machine</h2>
 * <pre>
 * OPENING -> OPEN -> CLOSING -> CLOSED
 *    |                  |
 *    +----> FAILED <----+
 * </pre>
 * OPENING is owned by the order gate; from OPEN onwards this class is the only writer.
 *
 * <h2>Monitoring cycle</h2>
 * Every tick dispatches one check per OPEN or CLOSING position onto the monitor pool. A
 * position whose previous check is still running is skipped for that tick. OPEN positions are
 * priced and run through the exit rules in priority order; CLOSING positions retry the close.
 *
 * <h2>Close failures</h2>
 * A failed close keeps the position CLOSING and it is retried on the next tick. After
 * {@code maxCloseRetries} failures the position is flagged FAILED, a CRITICAL alert is raised
 * and it keeps its coin and slot until {@link #acknowledgeFailure(String)}.
 */
@Slf4j
public class PositionLifecycleManager implements PositionHandoff {

    private final PositionBook positionBook;
    private final ExchangeClient exchangeClient;
    private final Supplier<RiskConfig> riskConfig;
    private final StateSink stateSink;
    private final Executor monitorExecutor;
    private final Clock clock;
    private final int maxCloseRetries;
    private final List<ExitRule> exitRules;

    private final AtomicLong checks = new AtomicLong();
    private final AtomicLong skippedChecks = new AtomicLong();
    private final AtomicLong closedTrades = new AtomicLong();
    private final AtomicLong winningTrades = new AtomicLong();
    private final DoubleAdder realisedPnl = new DoubleAdder();

    private volatile ScheduledFuture<?> monitoringTask;
    private volatile CloseReason closeOnOpenReason;

    public PositionLifecycleManager(PositionBook positionBook, ExchangeClient exchangeClient,
                                    Supplier<RiskConfig> riskConfig, StateSink stateSink,
                                    Executor monitorExecutor, Clock clock, int maxCloseRetries,
                                    List<ExitRule> exitRules) {
        if (maxCloseRetries < 1) {
            throw new IllegalArgumentException("maxCloseRetries must be at least 1");
        }
        this.positionBook = positionBook;
        this.exchangeClient = exchangeClient;
        this.riskConfig = riskConfig;
        this.stateSink = stateSink;
        this.monitorExecutor = monitorExecutor;
        this.clock = clock;
        this.maxCloseRetries = maxCloseRetries;
        List<ExitRule> sorted = new ArrayList<>(exitRules);
        sorted.sort(Comparator.comparingInt(ExitRule::getPriority));
        this.exitRules = List.copyOf(sorted);
    }

    /**
     * Schedules {@link #runMonitoringCycle()} with a fixed delay of {@code tick}.
     */
    public synchronized void start(TaskScheduler scheduler, Duration tick) {
        if (monitoringTask != null) {
            throw new IllegalStateException("Position monitoring already running");
        }
        monitoringTask = scheduler.scheduleWithFixedDelay(this::runMonitoringCycle, tick);
        log.info("Position monitoring started: tick={}ms, rules={}", tick.toMillis(), exitRules);
    }

    /**
     * Stops new ticks. Checks already dispatched run to completion.
     */
    public synchronized void stop() {
        if (monitoringTask != null) {
            monitoringTask.cancel(false);
            monitoringTask = null;
            log.info("Position monitoring stopped");
        }
    }

    public boolean isRunning() {
        return monitoringTask != null;
    }

    /**
     * Positions opened after {@link #closeAll(CloseReason)} are closed straight away with the
     * same reason.
     */
    @Override
    public void onPositionOpened(Position position) {
        CloseReason pending = closeOnOpenReason;
        if (pending != null) {
            log.warn("{} {} opened after {} close-all, closing it now", position.getSide(), position.getCoin(),
                    pending);
            try {
                closePosition(position.getCoin(), pending);
            } catch (IllegalStateException e) {
                log.warn("Could not request {} close of {}: {}", pending, position.getCoin(), e.getMessage());
            }
            return;
        }
        log.info("Monitoring {} {} entry={} SL={} TP={}", position.getSide(), position.getCoin(),
                position.getEntryPrice(), position.getStopLossPrice(), position.getTakeProfitPrice());
    }

    /**
     * One monitoring tick.
     *
     * @return the number of checks dispatched
     */
    public int runMonitoringCycle() {
        int dispatched = 0;
        for (Position position : positionBook.monitoredPositions()) {
            if (!position.tryBeginCheck()) {
                skippedChecks.incrementAndGet();
                continue;
            }
            try {
                monitorExecutor.execute(() -> runCheck(position));
                dispatched++;
            } catch (RejectedExecutionException e) {
                position.endCheck();
                skippedChecks.incrementAndGet();
                log.warn("Monitor pool rejected check of {}: {}", position.getCoin(), e.getMessage());
            }
        }
        return dispatched;
    }

    private void runCheck(Position position) {
        try {
            checks.incrementAndGet();
            PositionStatus status = position.getStatus();
            if (status == PositionStatus.OPEN) {
                evaluateOpen(position);
            } else if (status == PositionStatus.CLOSING) {
                attemptClose(position);
            }
        } catch (RuntimeException e) {
            log.error("Check of {} failed: {}", position.getCoin(), e.getMessage(), e);
        } finally {
            position.endCheck();
        }
    }

    private void evaluateOpen(Position position) {
        double price;
        try {
            price = exchangeClient.getMarkPrice(position.getCoin());
        } catch (ExchangeException e) {
            log.warn("Price fetch for {} failed, skipping this tick: {}", position.getCoin(), e.getMessage());
            return;
        }
        position.recordMarkPrice(price);

        ExitContext ctx = new ExitContext(position, price, riskConfig.get());
        for (ExitRule rule : exitRules) {
            ExitDecision decision = rule.evaluate(ctx);
            if (decision.isExit()) {
                if (position.markClosing(decision.getReason())) {
                    log.info("Exit {} {}: {}", position.getSide(), position.getCoin(), decision.getDetail());
                    stateSink.publishPositionUpdate(position.snapshot());
                    attemptClose(position);
                }
                return;
            }
        }
        stateSink.publishPositionUpdate(position.snapshot());
    }

    private void attemptClose(Position position) {
        CloseFill fill;
        try {
            fill = exchangeClient.closePosition(position.snapshot());
        } catch (ExchangeException e) {
            handleCloseFailure(position, e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Unexpected error closing {}: {}", position.getCoin(), e.getMessage(), e);
            handleCloseFailure(position, "unexpected error: " + e.getMessage());
            return;
        }
        completeClose(position, fill);
    }

    private void completeClose(Position position, CloseFill fill) {
        ReentrantLock lock = positionBook.lockFor(position.getCoin());
        lock.lock();
        try {
            position.markClosed(fill.getExitPrice(), clock.instant());
            positionBook.remove(position);
            positionBook.releaseSlot();
        } finally {
            lock.unlock();
        }

        CompletedTrade trade = CompletedTrade.from(position);
        closedTrades.incrementAndGet();
        if (trade.isWin()) {
            winningTrades.incrementAndGet();
        }
        realisedPnl.add(trade.getPnl());

        log.info("Closed {} {} reason={} entry={} exit={} pnl={}", position.getSide(), position.getCoin(),
                trade.getReason(), trade.getEntryPrice(), trade.getExitPrice(),
                String.format("%.4f", trade.getPnl()));
        stateSink.publishPositionUpdate(position.snapshot());
        stateSink.publishTrade(trade);
    }

    private void handleCloseFailure(Position position, String message) {
        int failures = position.recordCloseFailure(message);
        if (failures < maxCloseRetries) {
            log.warn("Close of {} failed (attempt {}/{}), retrying next tick: {}", position.getCoin(),
                    failures, maxCloseRetries, message);
            stateSink.publishPositionUpdate(position.snapshot());
            return;
        }

        ReentrantLock lock = positionBook.lockFor(position.getCoin());
        lock.lock();
        try {
            position.markCloseFailed(message, clock.instant());
        } finally {
            lock.unlock();
        }
        log.error("Close of {} {} failed {} times, position needs manual intervention: {}",
                position.getSide(), position.getCoin(), failures, message);
        stateSink.publishPositionUpdate(position.snapshot());
        stateSink.publishAlert(StateAlert.of(AlertLevel.CRITICAL, position.getCoin(),
                "Close failed after " + failures + " attempts, exchange position may still be live: " + message,
                clock.instant()));
    }

    /**
     * Requests a close of the position on {@code coin}. The close is attempted on the caller's
     * thread unless a check for the position is already running, in which case the next tick
     * performs it.
     *
     * @throws PositionNotFoundException if no position occupies the coin
     * @throws IllegalStateException if the position is not OPEN
     */
    public PositionSnapshot closePosition(String coin, CloseReason reason) {
        Position position = positionBook.get(coin);
        if (position == null) {
            throw new PositionNotFoundException(coin);
        }
        if (!position.markClosing(reason)) {
            throw new IllegalStateException("Position on " + coin + " cannot be closed in status "
                    + position.getStatus());
        }
        log.info("{} close requested for {} {}", reason, position.getSide(), coin);
        stateSink.publishPositionUpdate(position.snapshot());

        if (position.tryBeginCheck()) {
            try {
                attemptClose(position);
            } finally {
                position.endCheck();
            }
        }
        return position.snapshot();
    }

    /**
     * Marks every OPEN position CLOSING with {@code reason} and dispatches the closes at once.
     * Positions handed over later are closed with the same reason on arrival.
     *
     * @return the number of positions marked for closing
     */
    public int closeAll(CloseReason reason) {
        closeOnOpenReason = reason;
        int marked = 0;
        for (Position position : positionBook.monitoredPositions()) {
            if (position.markClosing(reason)) {
                stateSink.publishPositionUpdate(position.snapshot());
                marked++;
            }
        }
        if (marked > 0) {
            log.warn("{}: closing {} positions", reason, marked);
            runMonitoringCycle();
        }
        return marked;
    }

    /**
     * Releases the coin and slot of a position that failed on close, after an operator has
     * dealt with the exchange position by hand.
     *
     * @throws PositionNotFoundException if no position occupies the coin
     * @throws IllegalStateException if the position did not fail on close
     */
    public PositionSnapshot acknowledgeFailure(String coin) {
        ReentrantLock lock = positionBook.lockFor(coin);
        Position position;
        lock.lock();
        try {
            position = positionBook.get(coin);
            if (position == null) {
                throw new PositionNotFoundException(coin);
            }
            position.acknowledgeFailure();
            positionBook.remove(position);
            positionBook.releaseSlot();
        } finally {
            lock.unlock();
        }
        log.info("Failed position on {} acknowledged, slot released", coin);
        PositionSnapshot snapshot = position.snapshot();
        stateSink.publishPositionUpdate(snapshot);
        return snapshot;
    }

    public List<PositionSnapshot> getPositions() {
        List<PositionSnapshot> snapshots = new ArrayList<>();
        for (Position position : positionBook.allPositions()) {
            snapshots.add(position.snapshot());
        }
        snapshots.sort(Comparator.comparing(PositionSnapshot::getCoin));
        return snapshots;
    }

    public List<PositionSnapshot> getAttentionPositions() {
        List<PositionSnapshot> snapshots = new ArrayList<>();
        for (Position position : positionBook.attentionPositions()) {
            snapshots.add(position.snapshot());
        }
        return snapshots;
    }

    public List<ExitRule> getExitRules() {
        return exitRules;
    }

    public long getCheckCount() {
        return checks.get();
    }

    public long getSkippedCheckCount() {
        return skippedChecks.get();
    }

    public long getClosedTradeCount() {
        return closedTrades.get();
    }

    public long getWinningTradeCount() {
        return winningTrades.get();
    }

    public double getRealisedPnl() {
        return realisedPnl.sum();
    }
}
