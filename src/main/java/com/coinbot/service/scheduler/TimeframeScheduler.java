package com.coinbot.service.scheduler;

import com.coinbot.model.AlertLevel;
import com.coinbot.model.Signal;
import com.coinbot.model.StateAlert;
import com.coinbot.service.signal.SignalStrategy;
import com.coinbot.service.sink.StateSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Decides when each (strategy, coin) pair runs and fans the invocations out to a worker pool.
 *
 * <h2>Cadence</h2>
 * The loop wakes every {@code tickPeriod}. An enabled entry is due when its interval has
 * elapsed since its last dispatch; {@code lastRunAt} is set to the tick time before the task
 * is submitted, so slow invocations never cause back-to-back catch-up runs.
 *
 * <h2>Overlap</h2>
 * If an entry's previous invocation is still running when it becomes due, that slot is
 * skipped and counted. Other entries are unaffected.
 *
 * <h2>Errors</h2>
 * An invocation that throws is logged, published as an alert and treated as "no signal".
 * Nothing an invocation does can stop the loop.
 */
@Slf4j
public class TimeframeScheduler {

    private final Map<String, ScheduleEntry> entries = new ConcurrentHashMap<>();
    private final Set<String> disabledStrategies = ConcurrentHashMap.newKeySet();

    private final Executor workerExecutor;
    private final SignalQueue signalQueue;
    private final StateSink stateSink;
    private final Clock clock;
    private final Duration tickPeriod;

    private volatile boolean running;
    private volatile Thread loopThread;

    public TimeframeScheduler(Executor workerExecutor, SignalQueue signalQueue, StateSink stateSink,
                              Clock clock, Duration tickPeriod) {
        this.workerExecutor = workerExecutor;
        this.signalQueue = signalQueue;
        this.stateSink = stateSink;
        this.clock = clock;
        this.tickPeriod = tickPeriod;
    }

    /**
     * Adds a (strategy, coin) pair.
     *
     * @throws IllegalArgumentException if the interval is not positive or the pair is already registered
     */
    public ScheduleEntry register(SignalStrategy strategy, String coin, Duration interval) {
        ScheduleEntry entry = new ScheduleEntry(strategy, coin, interval);
        ScheduleEntry existing = entries.putIfAbsent(entry.getKey(), entry);
        if (existing != null) {
            throw new IllegalArgumentException("Already registered: " + entry.getKey());
        }
        log.debug("Registered {} every {}s", entry.getKey(), interval.toSeconds());
        return entry;
    }

    public boolean unregister(String strategyName, String coin) {
        return entries.remove(ScheduleEntry.keyOf(strategyName, coin)) != null;
    }

    /**
     * Enables or disables every entry of a strategy. Disabled entries are skipped without
     * touching their bookkeeping.
     *
     * @return false if no entry uses that strategy
     */
    public boolean setEnabled(String strategyName, boolean enabled) {
        boolean known = entries.values().stream()
                .anyMatch(entry -> entry.getStrategy().getName().equals(strategyName));
        if (!known) {
            return false;
        }
        if (enabled) {
            disabledStrategies.remove(strategyName);
        } else {
            disabledStrategies.add(strategyName);
        }
        log.info("Strategy {} {}", strategyName, enabled ? "enabled" : "disabled");
        return true;
    }

    public boolean isEnabled(String strategyName) {
        return !disabledStrategies.contains(strategyName);
    }

    /**
     * Runs the control loop on the calling thread until {@link #stop()} is called.
     */
    public void runForever() {
        running = true;
        loop();
    }

    private void loop() {
        loopThread = Thread.currentThread();
        log.info("Timeframe scheduler started with {} entries, tick {}ms", entries.size(), tickPeriod.toMillis());
        try {
            while (running) {
                try {
                    tick(clock.instant());
                } catch (RuntimeException e) {
                    log.error("Scheduler tick failed: {}", e.getMessage(), e);
                }
                try {
                    Thread.sleep(tickPeriod.toMillis());
                } catch (InterruptedException e) {
                    if (running) {
                        log.warn("Scheduler loop interrupted while running, stopping");
                    }
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } finally {
            running = false;
            loopThread = null;
            log.info("Timeframe scheduler stopped");
        }
    }

    /**
     * Starts the loop on a thread of {@code loopExecutor}.
     */
    public void start(Executor loopExecutor) {
        if (running) {
            throw new IllegalStateException("Scheduler already running");
        }
        running = true;
        loopExecutor.execute(this::loop);
    }

    /**
     * Cooperative shutdown: no new dispatches after the current tick; in-flight invocations finish.
     */
    public void stop() {
        running = false;
        Thread thread = loopThread;
        if (thread != null) {
            thread.interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * One scheduling pass at {@code now}.
     *
     * @return the number of invocations dispatched
     */
    public int tick(Instant now) {
        int dispatched = 0;
        for (ScheduleEntry entry : entries.values()) {
            if (disabledStrategies.contains(entry.getStrategy().getName()) || !entry.isDue(now)) {
                continue;
            }
            entry.markDispatched(now);
            if (!entry.tryBeginRun()) {
                entry.getSkippedOverlaps().incrementAndGet();
                log.debug("Skipping {}: previous run still in flight", entry.getKey());
                continue;
            }
            try {
                workerExecutor.execute(() -> invoke(entry));
                dispatched++;
            } catch (RejectedExecutionException e) {
                entry.endRun(now);
                entry.getSkippedOverlaps().incrementAndGet();
                log.warn("Worker pool rejected {}: {}", entry.getKey(), e.getMessage());
            }
        }
        return dispatched;
    }

    private void invoke(ScheduleEntry entry) {
        SignalStrategy strategy = entry.getStrategy();
        String coin = entry.getCoin();
        try {
            entry.getRuns().incrementAndGet();
            Signal signal = strategy.generate(coin);
            if (signal == null) {
                log.debug("{}: no signal for {}", strategy.getName(), coin);
                return;
            }
            stateSink.publishSignal(signal);
            if (!signal.isHold()) {
                signalQueue.offer(signal);
            }
        } catch (RuntimeException e) {
            entry.getFailures().incrementAndGet();
            log.warn("{} failed for {}: {}", strategy.getName(), coin, e.getMessage(), e);
            stateSink.publishAlert(StateAlert.of(AlertLevel.WARNING, coin,
                    strategy.getName() + " failed: " + e.getMessage(), clock.instant()));
        } finally {
            entry.endRun(clock.instant());
        }
    }

    public List<ScheduleEntry.ScheduleEntryView> getEntries() {
        List<ScheduleEntry.ScheduleEntryView> views = new ArrayList<>();
        for (ScheduleEntry entry : entries.values()) {
            views.add(entry.toView(isEnabled(entry.getStrategy().getName())));
        }
        views.sort(Comparator.comparing(ScheduleEntry.ScheduleEntryView::strategy)
                .thenComparing(ScheduleEntry.ScheduleEntryView::coin));
        return views;
    }

    public int getEntryCount() {
        return entries.size();
    }

    public long getDroppedSignals() {
        return signalQueue.getDroppedCount();
    }
}
