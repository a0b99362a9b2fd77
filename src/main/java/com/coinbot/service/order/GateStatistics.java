package com.coinbot.service.order;

import com.coinbot.model.AdmissionDecision;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Admission counters, per-coin cooldowns and daily trade counts (UTC day).
 */
public class GateStatistics {

    private final Clock clock;
    private final Map<AdmissionDecision, AtomicLong> decisions = new EnumMap<>(AdmissionDecision.class);
    private final Map<String, Instant> lastOpenByCoin = new ConcurrentHashMap<>();
    private final Map<String, Integer> tradesToday = new ConcurrentHashMap<>();
    private volatile LocalDate currentDay;

    public GateStatistics(Clock clock) {
        this.clock = clock;
        for (AdmissionDecision decision : AdmissionDecision.values()) {
            decisions.put(decision, new AtomicLong());
        }
        this.currentDay = LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    public void record(AdmissionDecision decision) {
        decisions.get(decision).incrementAndGet();
    }

    /**
     * Registers a successful open: starts the coin's cooldown and bumps today's count.
     */
    public void recordOpen(String coin, Instant openedAt) {
        lastOpenByCoin.put(coin, openedAt);
        rollDayIfNeeded();
        tradesToday.merge(coin, 1, Integer::sum);
    }

    /**
     * Remaining cooldown for {@code coin}, or {@link Duration#ZERO} when it may trade again.
     */
    public Duration remainingCooldown(String coin, long cooldownSeconds, Instant now) {
        Instant lastOpen = lastOpenByCoin.get(coin);
        if (lastOpen == null || cooldownSeconds <= 0) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.ofSeconds(cooldownSeconds).minus(Duration.between(lastOpen, now));
        return remaining.isNegative() || remaining.isZero() ? Duration.ZERO : remaining;
    }

    public Map<String, Long> getDecisionCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        decisions.forEach((decision, count) -> counts.put(decision.name(), count.get()));
        return counts;
    }

    public long getCount(AdmissionDecision decision) {
        return decisions.get(decision).get();
    }

    public Map<String, Integer> getTradesToday() {
        rollDayIfNeeded();
        return new LinkedHashMap<>(tradesToday);
    }

    public Map<String, Long> getCooldownsRemaining(long cooldownSeconds) {
        Instant now = clock.instant();
        Map<String, Long> remaining = new LinkedHashMap<>();
        lastOpenByCoin.keySet().forEach(coin -> {
            Duration left = remainingCooldown(coin, cooldownSeconds, now);
            if (!left.isZero()) {
                remaining.put(coin, left.toSeconds());
            }
        });
        return remaining;
    }

    private void rollDayIfNeeded() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        if (!today.equals(currentDay)) {
            synchronized (this) {
                if (!today.equals(currentDay)) {
                    tradesToday.clear();
                    currentDay = today;
                }
            }
        }
    }
}
