package com.coinbot.service.order;

import com.coinbot.model.Position;
import com.coinbot.model.PositionStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of positions that occupy a coin, shared by the order gate and the lifecycle manager.
 * <p>
 * Structural changes for a coin (insert, remove) are made while holding that coin's lock.
 * The slot counter is independent of the locks and is reserved with compare-and-set, so
 * admissions on different coins never need a global lock to respect {@code maxPositions}.
 * A slot is held from placeholder insertion until the position is CLOSED, fails while opening,
 * or fails on close and is acknowledged.
 */
public class PositionBook {

    private final Map<String, Position> positionsByCoin = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> coinLocks = new ConcurrentHashMap<>();
    private final AtomicInteger occupiedSlots = new AtomicInteger();

    public ReentrantLock lockFor(String coin) {
        return coinLocks.computeIfAbsent(coin, key -> new ReentrantLock());
    }

    /**
     * Reserves one slot if fewer than {@code maxPositions} are occupied.
     */
    public boolean tryReserveSlot(int maxPositions) {
        while (true) {
            int current = occupiedSlots.get();
            if (current >= maxPositions) {
                return false;
            }
            if (occupiedSlots.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void releaseSlot() {
        int after = occupiedSlots.decrementAndGet();
        if (after < 0) {
            occupiedSlots.compareAndSet(after, 0);
            throw new IllegalStateException("Position slot released more often than reserved");
        }
    }

    public int getOccupiedSlots() {
        return occupiedSlots.get();
    }

    /**
     * Position currently occupying {@code coin}, if any. Caller should hold the coin lock when
     * acting on the answer.
     */
    public Position get(String coin) {
        return positionsByCoin.get(coin);
    }

    /**
     * Inserts {@code position} for its coin. Caller must hold the coin lock.
     *
     * @throws IllegalStateException if the coin is already occupied
     */
    public void insert(Position position) {
        Position existing = positionsByCoin.putIfAbsent(position.getCoin(), position);
        if (existing != null) {
            throw new IllegalStateException("Coin " + position.getCoin() + " already has position " + existing.getId());
        }
    }

    /**
     * Removes {@code position} if it still occupies its coin. Caller must hold the coin lock.
     */
    public boolean remove(Position position) {
        return positionsByCoin.remove(position.getCoin(), position);
    }

    /**
     * Positions the monitoring loop must look at: OPEN and CLOSING.
     */
    public List<Position> monitoredPositions() {
        List<Position> result = new ArrayList<>();
        for (Position position : positionsByCoin.values()) {
            PositionStatus status = position.getStatus();
            if (status == PositionStatus.OPEN || status == PositionStatus.CLOSING) {
                result.add(position);
            }
        }
        return result;
    }

    /**
     * Positions that exhausted their close retries and await operator acknowledgement.
     */
    public List<Position> attentionPositions() {
        List<Position> result = new ArrayList<>();
        for (Position position : positionsByCoin.values()) {
            if (position.getStatus() == PositionStatus.FAILED && position.isFailedOnClose()) {
                result.add(position);
            }
        }
        return result;
    }

    public List<Position> allPositions() {
        return new ArrayList<>(positionsByCoin.values());
    }

    public int countByStatus(PositionStatus status) {
        int count = 0;
        for (Position position : positionsByCoin.values()) {
            if (position.getStatus() == status) {
                count++;
            }
        }
        return count;
    }
}
