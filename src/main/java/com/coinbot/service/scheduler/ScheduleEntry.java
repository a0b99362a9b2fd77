package com.coinbot.service.scheduler;

import com.coinbot.service.signal.SignalStrategy;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One (strategy, coin) pair with its check interval and run bookkeeping.
 * <p>
 * {@code lastRunAt} is written only by the scheduler loop. The in-flight flag is claimed by the
 * loop on dispatch and released by the worker when the invocation ends.
 */
@Getter
public class ScheduleEntry {

    private final SignalStrategy strategy;
    private final String coin;
    private final Duration interval;

    private volatile Instant lastRunAt;
    private volatile Instant lastCompletedAt;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicLong runs = new AtomicLong();
    private final AtomicLong skippedOverlaps = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public ScheduleEntry(SignalStrategy strategy, String coin, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Check interval must be positive for "
                    + strategy.getName() + "/" + coin + ", got " + interval);
        }
        this.strategy = strategy;
        this.coin = coin;
        this.interval = interval;
    }

    public static String keyOf(String strategyName, String coin) {
        return strategyName + ":" + coin;
    }

    public String getKey() {
        return keyOf(strategy.getName(), coin);
    }

    /**
     * Due when it never ran or at least one interval has elapsed since the last dispatch.
     */
    public boolean isDue(Instant now) {
        Instant last = lastRunAt;
        return last == null || Duration.between(last, now).compareTo(interval) >= 0;
    }

    void markDispatched(Instant now) {
        this.lastRunAt = now;
    }

    boolean tryBeginRun() {
        return inFlight.compareAndSet(false, true);
    }

    void endRun(Instant now) {
        this.lastCompletedAt = now;
        inFlight.set(false);
    }

    public boolean isRunning() {
        return inFlight.get();
    }

    public ScheduleEntryView toView(boolean enabled) {
        return new ScheduleEntryView(strategy.getName(), coin, interval.toSeconds(), enabled, lastRunAt,
                lastCompletedAt, inFlight.get(), runs.get(), skippedOverlaps.get(), failures.get());
    }

    /**
     * Read-only copy of an entry for status reporting.
     */
    public record ScheduleEntryView(String strategy, String coin, long intervalSeconds, boolean enabled,
                                    Instant lastRunAt, Instant lastCompletedAt, boolean running,
                                    long runs, long skippedOverlaps, long failures) {
    }
}
