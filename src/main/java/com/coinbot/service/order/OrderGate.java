package com.coinbot.service.order;

import com.coinbot.exception.ExchangeException;
import com.coinbot.model.AccountState;
import com.coinbot.model.AdmissionDecision;
import com.coinbot.model.AdmissionResult;
import com.coinbot.model.AlertLevel;
import com.coinbot.model.OrderFill;
import com.coinbot.model.Position;
import com.coinbot.model.PositionSide;
import com.coinbot.model.RiskConfig;
import com.coinbot.model.Signal;
import com.coinbot.model.StateAlert;
import com.coinbot.service.exchange.ExchangeClient;
import com.coinbot.service.sink.StateSink;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Turns a signal into an opened position under concurrency-safe risk checks.
 *
 * <h2>Admission order</h2>
 * <ol>
 *   <li>Structural validation, HOLD rejection and minimum strength (no lock)</li>
 *   <li>Under the coin lock: duplicate check, cooldown, slot reservation, OPENING placeholder</li>
 *   <li>Outside the lock: balance check, mark price, sizing and order placement</li>
 *   <li>Under the coin lock again: OPEN on success, FAILED plus slot release on failure</li>
 * </ol>
 * No exchange call is ever made while a lock is held, and the gate never retries.
 * Once {@link #halt()} is called every later submission is rejected with REJECTED_HALTED.
 */
@Slf4j
public class OrderGate {

    private static final int SIZE_DECIMALS = 5;

    private final PositionBook positionBook;
    private final ExchangeClient exchangeClient;
    private final Supplier<RiskConfig> riskConfig;
    private final StateSink stateSink;
    private final PositionHandoff handoff;
    private final GateStatistics statistics;
    private final Clock clock;

    private volatile boolean halted;

    public OrderGate(PositionBook positionBook, ExchangeClient exchangeClient, Supplier<RiskConfig> riskConfig,
                     StateSink stateSink, PositionHandoff handoff, Clock clock) {
        this.positionBook = positionBook;
        this.exchangeClient = exchangeClient;
        this.riskConfig = riskConfig;
        this.stateSink = stateSink;
        this.handoff = handoff;
        this.clock = clock;
        this.statistics = new GateStatistics(clock);
    }

    public AdmissionResult submit(Signal signal) {
        AdmissionResult result = doSubmit(signal);
        statistics.record(result.getDecision());
        return result;
    }

    private AdmissionResult doSubmit(Signal signal) {
        if (signal == null) {
            return AdmissionResult.rejected(AdmissionDecision.REJECTED_INVALID, "signal is null");
        }
        if (halted) {
            return haltedResult(signal);
        }
        String error = signal.validationError();
        if (error != null) {
            log.warn("Rejected invalid signal from {}: {}", signal.getSource(), error);
            return AdmissionResult.rejected(AdmissionDecision.REJECTED_INVALID, error);
        }
        if (signal.isHold()) {
            return AdmissionResult.rejected(AdmissionDecision.REJECTED_HOLD, "HOLD signals are never admitted");
        }

        // One snapshot for the whole admission, even if a reload happens meanwhile
        RiskConfig risk = riskConfig.get();
        if (signal.getStrength() < risk.getMinSignalStrength()) {
            return AdmissionResult.rejected(AdmissionDecision.REJECTED_WEAK, String.format(
                    "strength %.2f below minimum %.2f", signal.getStrength(), risk.getMinSignalStrength()));
        }

        String coin = signal.getCoin();
        PositionSide side = signal.getAction().toPositionSide();
        Position placeholder;

        ReentrantLock lock = positionBook.lockFor(coin);
        lock.lock();
        try {
            if (halted) {
                return haltedResult(signal);
            }
            Position existing = positionBook.get(coin);
            if (existing != null) {
                return AdmissionResult.rejected(AdmissionDecision.REJECTED_DUPLICATE,
                        coin + " already has a position in status " + existing.getStatus());
            }
            Instant now = clock.instant();
            Duration cooldown = statistics.remainingCooldown(coin, risk.getCooldownSeconds(), now);
            if (!cooldown.isZero()) {
                return AdmissionResult.rejected(AdmissionDecision.REJECTED_COOLDOWN,
                        coin + " in cooldown for another " + cooldown.toSeconds() + "s");
            }
            if (!positionBook.tryReserveSlot(risk.getMaxPositions())) {
                return AdmissionResult.rejected(AdmissionDecision.REJECTED_MAX_POSITIONS,
                        "maximum of " + risk.getMaxPositions() + " positions reached");
            }
            placeholder = Position.opening(coin, side, signal.getSource(), now);
            positionBook.insert(placeholder);
        } finally {
            lock.unlock();
        }
        stateSink.publishPositionUpdate(placeholder.snapshot());
        log.info("Opening {} {} from {} (strength {})", side, coin, signal.getSource(),
                String.format("%.2f", signal.getStrength()));

        try {
            AccountState account = exchangeClient.getAccountState();
            if (account.getAvailableBalance() < risk.getPositionSizeUsd()) {
                String message = String.format("available balance %.2f below position size %.2f",
                        account.getAvailableBalance(), risk.getPositionSizeUsd());
                return abandon(placeholder, AdmissionDecision.REJECTED_INSUFFICIENT_BALANCE, message, AlertLevel.WARNING);
            }

            double price = exchangeClient.getMarkPrice(coin);
            double size = sizeFor(risk.getPositionSizeUsd(), price);
            if (size <= 0.0) {
                return abandon(placeholder, AdmissionDecision.FAILED_EXCHANGE,
                        "computed order size is zero at price " + price, AlertLevel.WARNING);
            }

            OrderFill fill = exchangeClient.placeOrder(coin, side, size);
            return confirm(placeholder, fill, risk);
        } catch (ExchangeException e) {
            log.warn("Order for {} {} failed: {}", side, coin, e.getMessage());
            return abandon(placeholder, AdmissionDecision.FAILED_EXCHANGE, e.getMessage(), AlertLevel.WARNING);
        } catch (RuntimeException e) {
            log.error("Unexpected error opening {} {}: {}", side, coin, e.getMessage(), e);
            return abandon(placeholder, AdmissionDecision.FAILED_EXCHANGE,
                    "unexpected error: " + e.getMessage(), AlertLevel.CRITICAL);
        }
    }

    private AdmissionResult confirm(Position placeholder, OrderFill fill, RiskConfig risk) {
        ReentrantLock lock = positionBook.lockFor(placeholder.getCoin());
        lock.lock();
        try {
            Instant now = clock.instant();
            placeholder.markOpen(fill, risk, now);
            statistics.recordOpen(placeholder.getCoin(), now);
        } finally {
            lock.unlock();
        }
        log.info("Opened {} {} size={} entry={} SL={} TP={} orderId={}", placeholder.getSide(),
                placeholder.getCoin(), placeholder.getSize(), placeholder.getEntryPrice(),
                placeholder.getStopLossPrice(), placeholder.getTakeProfitPrice(), placeholder.getOrderId());
        stateSink.publishPositionUpdate(placeholder.snapshot());
        if (halted) {
            log.warn("{} {} opened while the gate was halting", placeholder.getSide(), placeholder.getCoin());
        }
        handoff.onPositionOpened(placeholder);
        return AdmissionResult.admitted(placeholder.snapshot());
    }

    private AdmissionResult abandon(Position placeholder, AdmissionDecision decision, String message, AlertLevel level) {
        ReentrantLock lock = positionBook.lockFor(placeholder.getCoin());
        lock.lock();
        try {
            placeholder.markOpenFailed(message, clock.instant());
            positionBook.remove(placeholder);
            positionBook.releaseSlot();
        } finally {
            lock.unlock();
        }
        stateSink.publishPositionUpdate(placeholder.snapshot());
        stateSink.publishAlert(StateAlert.of(level, placeholder.getCoin(),
                "Could not open " + placeholder.getSide() + " " + placeholder.getCoin() + ": " + message,
                clock.instant()));
        return AdmissionResult.failed(decision, message, placeholder.snapshot());
    }

    private static AdmissionResult haltedResult(Signal signal) {
        log.info("Dropped {} {} from {}: order gate halted", signal.getAction(), signal.getCoin(), signal.getSource());
        return AdmissionResult.rejected(AdmissionDecision.REJECTED_HALTED, "order gate halted");
    }

    /**
     * Rejects every admission not yet past the coin lock. Admissions already placing an order
     * complete and are handed off as usual. Irreversible.
     */
    public void halt() {
        if (!halted) {
            halted = true;
            log.info("Order gate halted");
        }
    }

    public boolean isHalted() {
        return halted;
    }

    /**
     * Base-asset quantity for {@code usd} at {@code price}, rounded half-up to 5 decimals.
     */
    static double sizeFor(double usd, double price) {
        if (!(price > 0.0) || Double.isInfinite(price)) {
            return 0.0;
        }
        return BigDecimal.valueOf(usd / price).setScale(SIZE_DECIMALS, RoundingMode.HALF_UP).doubleValue();
    }

    public GateStatistics getStatistics() {
        return statistics;
    }

    public RiskConfig currentRiskConfig() {
        return riskConfig.get();
    }
}
