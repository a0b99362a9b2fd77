package com.coinbot.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable position tracked from order placement until it is closed.
 * <p>
 * State transitions are synchronized on the instance and reject illegal moves with
 * {@link IllegalStateException}. Readers that need a consistent view take a {@link #snapshot()}.
 * Once OPEN the position is mutated only by the lifecycle manager.
 */
@Getter
public class Position {

    private final String id;
    private final String coin;
    private final PositionSide side;
    private final String source;
    private final Instant createdAt;

    private volatile PositionStatus status;
    private volatile double entryPrice;
    private volatile double size;
    private volatile String orderId;
    private volatile Instant openedAt;

    private volatile double stopLossPrice;
    private volatile double takeProfitPrice;
    private volatile double trailingWatermark;
    private volatile double trailingStopPrice;
    private volatile boolean trailingActive;

    private volatile double lastMarkPrice;
    private volatile CloseReason closeReason;
    private volatile int closeAttempts;
    private volatile double exitPrice;
    private volatile Instant closedAt;
    private volatile String failureMessage;
    private volatile boolean failedOnClose;
    private volatile boolean acknowledged;

    // Set while a monitoring check or close attempt is running for this position
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean checkInFlight = new AtomicBoolean(false);

    private Position(String coin, PositionSide side, String source, Instant createdAt) {
        this.id = UUID.randomUUID().toString();
        this.coin = coin;
        this.side = side;
        this.source = source;
        this.createdAt = createdAt;
        this.status = PositionStatus.OPENING;
    }

    /**
     * Creates the placeholder inserted by the order gate while the order is in flight.
     */
    public static Position opening(String coin, PositionSide side, String source, Instant now) {
        return new Position(coin, side, source, now);
    }

    /**
     * Fills the placeholder with the exchange confirmation and derives the exit thresholds.
     * The trailing stop starts at the stop-loss floor and the watermark at the entry price.
     */
    public synchronized void markOpen(OrderFill fill, RiskConfig risk, Instant now) {
        requireStatus(PositionStatus.OPENING, "open");
        double entry = fill.getEntryPrice();
        this.entryPrice = entry;
        this.size = fill.getFilledSize();
        this.orderId = fill.getOrderId();
        this.openedAt = now;
        this.lastMarkPrice = entry;
        if (side == PositionSide.LONG) {
            this.stopLossPrice = entry * (1.0 - risk.getStopLossPercent() / 100.0);
            this.takeProfitPrice = entry * (1.0 + risk.getTakeProfitPercent() / 100.0);
        } else {
            this.stopLossPrice = entry * (1.0 + risk.getStopLossPercent() / 100.0);
            this.takeProfitPrice = entry * (1.0 - risk.getTakeProfitPercent() / 100.0);
        }
        this.trailingWatermark = entry;
        this.trailingStopPrice = stopLossPrice;
        this.trailingActive = false;
        this.status = PositionStatus.OPEN;
    }

    /**
     * OPENING to FAILED: the order was never confirmed.
     */
    public synchronized void markOpenFailed(String message, Instant now) {
        requireStatus(PositionStatus.OPENING, "fail opening of");
        this.failureMessage = message;
        this.closedAt = now;
        this.status = PositionStatus.FAILED;
    }

    /**
     * OPEN to CLOSING with the given reason.
     *
     * @return false if the position was no longer OPEN (another path already started closing it)
     */
    public synchronized boolean markClosing(CloseReason reason) {
        if (status != PositionStatus.OPEN) {
            return false;
        }
        this.closeReason = reason;
        this.status = PositionStatus.CLOSING;
        return true;
    }

    /**
     * Records a failed close attempt.
     *
     * @return the number of failed attempts so far
     */
    public synchronized int recordCloseFailure(String message) {
        requireStatus(PositionStatus.CLOSING, "record close failure of");
        this.closeAttempts++;
        this.failureMessage = message;
        return closeAttempts;
    }

    /**
     * CLOSING to CLOSED.
     */
    public synchronized void markClosed(double exitPrice, Instant now) {
        requireStatus(PositionStatus.CLOSING, "close");
        this.closeAttempts++;
        this.exitPrice = exitPrice;
        this.lastMarkPrice = exitPrice;
        this.closedAt = now;
        this.status = PositionStatus.CLOSED;
    }

    /**
     * CLOSING to FAILED after the close retries are exhausted. The exchange position may still be live.
     */
    public synchronized void markCloseFailed(String message, Instant now) {
        requireStatus(PositionStatus.CLOSING, "fail close of");
        this.failureMessage = message;
        this.failedOnClose = true;
        this.closedAt = now;
        this.status = PositionStatus.FAILED;
    }

    /**
     * Operator confirmation that a position which failed on close has been dealt with by hand.
     */
    public synchronized void acknowledgeFailure() {
        if (status != PositionStatus.FAILED || !failedOnClose) {
            throw new IllegalStateException("Position " + id + " (" + coin + ") did not fail on close, status is "
                    + status);
        }
        this.acknowledged = true;
    }

    public void recordMarkPrice(double price) {
        this.lastMarkPrice = price;
    }

    /**
     * Advances the watermark to the best price seen and recomputes the trailing stop.
     * <p>
     * Before activation the trailing stop stays at the stop-loss floor. Once profit at the
     * watermark reaches {@code activationPercent} the band activates and the stop only ever
     * moves in the position's favour.
     */
    public synchronized void advanceTrailing(double price, double trailPercent, double activationPercent) {
        if (status != PositionStatus.OPEN) {
            return;
        }
        if (side == PositionSide.LONG) {
            if (price > trailingWatermark) {
                trailingWatermark = price;
            }
        } else if (price < trailingWatermark) {
            trailingWatermark = price;
        }

        if (!trailingActive && profitPercentAt(trailingWatermark) >= activationPercent) {
            trailingActive = true;
        }
        if (!trailingActive) {
            return;
        }

        if (side == PositionSide.LONG) {
            double candidate = trailingWatermark * (1.0 - trailPercent / 100.0);
            trailingStopPrice = Math.max(trailingStopPrice, candidate);
        } else {
            double candidate = trailingWatermark * (1.0 + trailPercent / 100.0);
            trailingStopPrice = Math.min(trailingStopPrice, candidate);
        }
    }

    /**
     * Signed profit in percent of entry if the position were valued at {@code price}.
     */
    public double profitPercentAt(double price) {
        if (entryPrice <= 0.0) {
            return 0.0;
        }
        return (price - entryPrice) / entryPrice * 100.0 * side.getDirectionMultiplier();
    }

    /**
     * Signed profit in quote currency if the position were valued at {@code price}.
     */
    public double pnlAt(double price) {
        return (price - entryPrice) * size * side.getDirectionMultiplier();
    }

    /**
     * Claims the per-position check slot. Returns false if a check is already running.
     */
    public boolean tryBeginCheck() {
        return checkInFlight.compareAndSet(false, true);
    }

    public void endCheck() {
        checkInFlight.set(false);
    }

    public boolean isCheckInFlight() {
        return checkInFlight.get();
    }

    public synchronized PositionSnapshot snapshot() {
        return PositionSnapshot.builder()
                .id(id)
                .coin(coin)
                .side(side)
                .source(source)
                .status(status)
                .entryPrice(entryPrice)
                .size(size)
                .orderId(orderId)
                .openedAt(openedAt)
                .stopLossPrice(stopLossPrice)
                .takeProfitPrice(takeProfitPrice)
                .trailingWatermark(trailingWatermark)
                .trailingStopPrice(trailingStopPrice)
                .trailingActive(trailingActive)
                .lastMarkPrice(lastMarkPrice)
                .unrealizedPnl(status == PositionStatus.OPEN || status == PositionStatus.CLOSING
                        ? pnlAt(lastMarkPrice) : 0.0)
                .closeReason(closeReason)
                .closeAttempts(closeAttempts)
                .exitPrice(exitPrice)
                .closedAt(closedAt)
                .failureMessage(failureMessage)
                .failedOnClose(failedOnClose)
                .acknowledged(acknowledged)
                .build();
    }

    private void requireStatus(PositionStatus expected, String operation) {
        if (status != expected) {
            throw new IllegalStateException("Cannot " + operation + " position " + id + " (" + coin
                    + "): status is " + status + ", expected " + expected);
        }
    }
}
