package com.coinbot.service.scheduler;

import com.coinbot.model.Signal;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded hand-off between the scheduler and the order gate.
 * <p>
 * Offering never blocks: when full, the oldest pending signal is evicted and counted, since a
 * fresh signal is worth more than a stale one.
 */
@Slf4j
public class SignalQueue {

    private final BlockingQueue<Signal> queue;
    private final int capacity;
    private final AtomicLong offered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public SignalQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Signal queue capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    public void offer(Signal signal) {
        offered.incrementAndGet();
        while (!queue.offer(signal)) {
            Signal evicted = queue.poll();
            if (evicted != null) {
                dropped.incrementAndGet();
                log.debug("Signal queue full ({}), dropped oldest signal {} {} from {}",
                        capacity, evicted.getAction(), evicted.getCoin(), evicted.getSource());
            }
        }
    }

    /**
     * Waits up to {@code timeout} for the next signal.
     *
     * @return the signal, or null on timeout
     */
    public Signal poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Signal poll() {
        return queue.poll();
    }

    public int size() {
        return queue.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public long getOfferedCount() {
        return offered.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }
}
