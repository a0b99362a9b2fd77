package com.coinbot.service.sink;

import com.coinbot.model.CompletedTrade;
import com.coinbot.model.PositionSnapshot;
import com.coinbot.model.Signal;
import com.coinbot.model.StateAlert;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Write-behind {@link StateSink}.
 * <p>
 * Publishing only offers to a bounded queue: a full queue drops the event and counts it,
 * so engine threads never wait on the dashboard. A scheduled flush drains the queues into
 * the {@link StateSnapshotStore} in batches.
 */
@Service
@Slf4j
public class BufferedStateSink implements StateSink {

    private static final int FLUSH_BATCH = 200;

    private final StateSnapshotStore store;

    private final BlockingQueue<Signal> signalBuffer = new LinkedBlockingQueue<>(1000);
    private final BlockingQueue<PositionSnapshot> positionBuffer = new LinkedBlockingQueue<>(2000);
    private final BlockingQueue<CompletedTrade> tradeBuffer = new LinkedBlockingQueue<>(1000);
    private final BlockingQueue<StateAlert> alertBuffer = new LinkedBlockingQueue<>(500);

    private final AtomicLong bufferedCount = new AtomicLong(0);
    private final AtomicLong flushedCount = new AtomicLong(0);
    private final AtomicLong droppedCount = new AtomicLong(0);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);

    public BufferedStateSink(StateSnapshotStore store) {
        this.store = store;
    }

    @Override
    public void publishSignal(Signal signal) {
        buffer(signalBuffer, signal, "signal");
    }

    @Override
    public void publishPositionUpdate(PositionSnapshot position) {
        buffer(positionBuffer, position, "position");
    }

    @Override
    public void publishTrade(CompletedTrade trade) {
        buffer(tradeBuffer, trade, "trade");
    }

    @Override
    public void publishAlert(StateAlert alert) {
        buffer(alertBuffer, alert, "alert");
    }

    private <T> void buffer(BlockingQueue<T> queue, T item, String kind) {
        if (item == null) {
            return;
        }
        if (queue.offer(item)) {
            bufferedCount.incrementAndGet();
        } else {
            droppedCount.incrementAndGet();
            log.trace("State sink {} buffer full, dropping event", kind);
        }
    }

    /**
     * Drains all buffers into the snapshot store.
     */
    @Scheduled(fixedDelayString = "${sink.flush-interval-ms:500}")
    public void flushBuffers() {
        try {
            int flushed = 0;
            flushed += drain(signalBuffer, store::recordSignal);
            flushed += drain(positionBuffer, store::recordPosition);
            flushed += drain(tradeBuffer, trade -> {
                store.recordTrade(trade);
                log.info("Trade closed: {} {} {} entry={} exit={} pnl={} ({}%)",
                        trade.getCoin(), trade.getSide(), trade.getReason(), trade.getEntryPrice(),
                        trade.getExitPrice(), String.format("%.4f", trade.getPnl()),
                        String.format("%.2f", trade.getPnlPercent()));
            });
            flushed += drain(alertBuffer, store::recordAlert);

            if (flushed > 0) {
                flushedCount.addAndGet(flushed);
                log.trace("Flushed {} state events", flushed);
            }
            consecutiveFailures.set(0);
        } catch (RuntimeException e) {
            int failures = consecutiveFailures.incrementAndGet();
            log.error("State sink flush failed ({} consecutive): {}", failures, e.getMessage(), e);
        }
    }

    private static <T> int drain(BlockingQueue<T> queue, Consumer<T> target) {
        List<T> batch = new ArrayList<>(Math.min(queue.size(), FLUSH_BATCH));
        queue.drainTo(batch, FLUSH_BATCH);
        for (T item : batch) {
            target.accept(item);
        }
        return batch.size();
    }

    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("buffered", bufferedCount.get());
        metrics.put("flushed", flushedCount.get());
        metrics.put("dropped", droppedCount.get());
        metrics.put("pending", signalBuffer.size() + positionBuffer.size() + tradeBuffer.size() + alertBuffer.size());
        return metrics;
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    @PreDestroy
    public void forceFlush() {
        log.info("Flushing state sink buffers before shutdown");
        while (!signalBuffer.isEmpty() || !positionBuffer.isEmpty()
                || !tradeBuffer.isEmpty() || !alertBuffer.isEmpty()) {
            flushBuffers();
            if (consecutiveFailures.get() > 0) {
                break;
            }
        }
    }
}
