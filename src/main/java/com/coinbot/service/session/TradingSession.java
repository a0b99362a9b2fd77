package com.coinbot.service.session;

import com.coinbot.model.CloseReason;
import com.coinbot.model.RiskConfig;
import com.coinbot.service.exchange.ExchangeClient;
import com.coinbot.service.monitoring.PositionLifecycleManager;
import com.coinbot.service.monitoring.exit.ExitRule;
import com.coinbot.service.order.OrderGate;
import com.coinbot.service.order.PositionBook;
import com.coinbot.service.scheduler.SignalDispatcher;
import com.coinbot.service.scheduler.SignalQueue;
import com.coinbot.service.scheduler.TimeframeScheduler;
import com.coinbot.service.sink.StateSink;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One trading session: the scheduler, dispatcher, order gate and lifecycle manager wired
 * together around a shared {@link PositionBook} and one risk snapshot.
 * <p>
 * A session is started once and stopped once. The position book outlives it, so positions
 * left open by a stopped session are picked up by the next one.
 */
@Slf4j
@Getter
public class TradingSession {

    private final String id;
    private final Instant createdAt;
    private final boolean executeOrders;
    private final PositionBook positionBook;
    private final SignalQueue signalQueue;
    private final OrderGate orderGate;
    private final PositionLifecycleManager lifecycleManager;
    private final TimeframeScheduler scheduler;
    private final SignalDispatcher dispatcher;

    // Swapped whole on reload, read once per admission and once per position check
    @Getter(AccessLevel.NONE)
    private final AtomicReference<RiskConfig> riskConfig;

    private volatile Instant startedAt;
    private volatile Instant stoppedAt;

    private TradingSession(RiskConfig initialRisk, boolean executeOrders, PositionBook positionBook,
                           ExchangeClient exchangeClient, StateSink stateSink, Clock clock,
                           Executor workerExecutor, Executor admissionExecutor, Executor monitorExecutor,
                           Duration schedulerTick, int queueCapacity, int maxCloseRetries,
                           List<ExitRule> exitRules) {
        this.id = UUID.randomUUID().toString();
        this.createdAt = clock.instant();
        this.executeOrders = executeOrders;
        this.positionBook = positionBook;
        this.riskConfig = new AtomicReference<>(initialRisk.validate());
        this.signalQueue = new SignalQueue(queueCapacity);
        this.lifecycleManager = new PositionLifecycleManager(positionBook, exchangeClient, riskConfig::get,
                stateSink, monitorExecutor, clock, maxCloseRetries, exitRules);
        this.orderGate = new OrderGate(positionBook, exchangeClient, riskConfig::get, stateSink,
                lifecycleManager, clock);
        this.scheduler = new TimeframeScheduler(workerExecutor, signalQueue, stateSink, clock, schedulerTick);
        this.dispatcher = new SignalDispatcher(signalQueue, orderGate, admissionExecutor, executeOrders);
    }

    /**
     * @throws com.coinbot.exception.ConfigurationException if the initial risk snapshot is invalid
     */
    @Builder
    private static TradingSession assemble(RiskConfig riskConfig, boolean executeOrders, PositionBook positionBook,
                                           ExchangeClient exchangeClient, StateSink stateSink, Clock clock,
                                           Executor workerExecutor, Executor admissionExecutor,
                                           Executor monitorExecutor, Duration schedulerTick, int queueCapacity,
                                           int maxCloseRetries, List<ExitRule> exitRules) {
        return new TradingSession(riskConfig, executeOrders, positionBook, exchangeClient, stateSink, clock,
                workerExecutor, admissionExecutor, monitorExecutor, schedulerTick, queueCapacity,
                maxCloseRetries, exitRules);
    }

    /**
     * Starts position monitoring first, then signal dispatch, then the scheduler loop.
     */
    public synchronized void start(Executor loopExecutor, TaskScheduler tickScheduler, Duration positionTick,
                                   Instant now) {
        if (startedAt != null) {
            throw new IllegalStateException("Session " + id + " was already started");
        }
        lifecycleManager.start(tickScheduler, positionTick);
        dispatcher.start(loopExecutor);
        scheduler.start(loopExecutor);
        startedAt = now;
        log.info("Trading session {} started ({} mode, {} schedule entries)", id,
                executeOrders ? "trading" : "monitor-only", scheduler.getEntryCount());
    }

    /**
     * Halts the order gate, new strategy runs, signal dispatch and monitoring ticks. In-flight work
     * finishes; a position opened by an in-flight admission stays in the book for the next session.
     */
    public synchronized void stop(Instant now) {
        if (stoppedAt != null) {
            return;
        }
        orderGate.halt();
        scheduler.stop();
        dispatcher.stop();
        lifecycleManager.stop();
        stoppedAt = now;
        log.info("Trading session {} stopped, {} positions still in the book", id,
                positionBook.allPositions().size());
    }

    /**
     * Stops signal flow, then closes every open position with reason EMERGENCY. Monitoring
     * keeps running so failed closes are retried; call {@link #stop(Instant)} afterwards.
     *
     * @return the number of positions marked for closing
     */
    public synchronized int emergencyStop() {
        orderGate.halt();
        scheduler.stop();
        dispatcher.stop();
        int closing = lifecycleManager.closeAll(CloseReason.EMERGENCY);
        log.warn("Emergency stop on session {}: {} positions closing", id, closing);
        return closing;
    }

    /**
     * Atomically replaces the risk snapshot. Admissions and checks already running keep the
     * snapshot they started with.
     *
     * @throws com.coinbot.exception.ConfigurationException if {@code next} is invalid; the previous snapshot stays
     */
    public RiskConfig reload(RiskConfig next) {
        RiskConfig validated = next.validate();
        RiskConfig previous = riskConfig.getAndSet(validated);
        log.info("Risk configuration reloaded on session {}: {} -> {}", id, previous, validated);
        return validated;
    }

    public RiskConfig currentRiskConfig() {
        return riskConfig.get();
    }

    public boolean isActive() {
        return startedAt != null && stoppedAt == null;
    }
}
