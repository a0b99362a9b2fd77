package com.coinbot.service.scheduler;

import com.coinbot.model.AdmissionResult;
import com.coinbot.model.Signal;
import com.coinbot.service.order.OrderGate;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drains the {@link SignalQueue} and submits each signal to the {@link OrderGate}.
 * <p>
 * Signals from one source go through a serial lane (a chain of futures), so they are admitted
 * in the order they were generated; different sources are admitted in parallel on the
 * admission pool. In monitor-only mode signals are logged and never submitted.
 */
@Slf4j
public class SignalDispatcher {

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    private final SignalQueue signalQueue;
    private final OrderGate orderGate;
    private final Executor admissionExecutor;
    private final boolean executeOrders;

    private final Map<String, CompletableFuture<Void>> lanes = new ConcurrentHashMap<>();
    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicLong monitored = new AtomicLong();

    private volatile boolean running;
    private volatile Thread loopThread;

    public SignalDispatcher(SignalQueue signalQueue, OrderGate orderGate, Executor admissionExecutor,
                            boolean executeOrders) {
        this.signalQueue = signalQueue;
        this.orderGate = orderGate;
        this.admissionExecutor = admissionExecutor;
        this.executeOrders = executeOrders;
    }

    public void start(Executor loopExecutor) {
        if (running) {
            throw new IllegalStateException("Dispatcher already running");
        }
        running = true;
        loopExecutor.execute(this::loop);
        log.info("Signal dispatcher started ({})", executeOrders ? "executing orders" : "monitor only");
    }

    public void stop() {
        running = false;
        Thread thread = loopThread;
        if (thread != null) {
            thread.interrupt();
        }
    }

    private void loop() {
        loopThread = Thread.currentThread();
        try {
            while (running) {
                Signal signal;
                try {
                    signal = signalQueue.poll(POLL_TIMEOUT);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (signal != null) {
                    dispatch(signal);
                }
            }
        } finally {
            loopThread = null;
            log.info("Signal dispatcher stopped");
        }
    }

    /**
     * Dispatches everything currently queued without waiting for admission to finish.
     *
     * @return the number of signals taken from the queue
     */
    public int drainPending() {
        int count = 0;
        Signal signal;
        while ((signal = signalQueue.poll()) != null) {
            dispatch(signal);
            count++;
        }
        return count;
    }

    /**
     * Appends {@code signal} to its source lane.
     *
     * @return a future completing when this signal's admission has finished
     */
    public CompletableFuture<Void> dispatch(Signal signal) {
        if (!executeOrders) {
            monitored.incrementAndGet();
            log.info("[MONITOR] {} {} from {} (strength {})", signal.getAction(), signal.getCoin(),
                    signal.getSource(), String.format("%.2f", signal.getStrength()));
            return CompletableFuture.completedFuture(null);
        }
        dispatched.incrementAndGet();
        String lane = signal.getSource() == null ? "" : signal.getSource();
        return lanes.compute(lane, (key, previous) -> {
            // A failed predecessor must not block the rest of the lane
            CompletableFuture<Void> base = previous == null
                    ? CompletableFuture.completedFuture(null)
                    : previous.exceptionally(ex -> null);
            return base.thenRunAsync(() -> admit(signal), admissionExecutor);
        });
    }

    private void admit(Signal signal) {
        try {
            AdmissionResult result = orderGate.submit(signal);
            if (result.isAdmitted()) {
                log.info("Admitted {} {} from {}", signal.getAction(), signal.getCoin(), signal.getSource());
            } else {
                log.debug("Signal {} {} from {} not admitted: {} ({})", signal.getAction(), signal.getCoin(),
                        signal.getSource(), result.getDecision(), result.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Admission of {} {} from {} failed: {}", signal.getAction(), signal.getCoin(),
                    signal.getSource(), e.getMessage(), e);
        }
    }

    public boolean isExecuteOrders() {
        return executeOrders;
    }

    public long getDispatchedCount() {
        return dispatched.get();
    }

    public long getMonitoredCount() {
        return monitored.get();
    }
}
