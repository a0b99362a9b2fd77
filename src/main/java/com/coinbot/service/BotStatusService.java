package com.coinbot.service;

import com.coinbot.dto.BotStatusResponse;
import com.coinbot.model.BotStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

@Service
@Slf4j
public class BotStatusService {

    private final Clock clock;
    private final AtomicReference<BotStatus> state = new AtomicReference<>(BotStatus.STOPPED);
    private volatile Instant lastUpdated;

    public BotStatusService(Clock clock) {
        this.clock = clock;
        this.lastUpdated = clock.instant();
    }

    public void markRunning() {
        transition(BotStatus.RUNNING);
    }

    public void markStopped() {
        transition(BotStatus.STOPPED);
    }

    private void transition(BotStatus next) {
        BotStatus previous = state.getAndSet(next);
        lastUpdated = clock.instant();
        if (previous != next) {
            log.info("Bot status {} -> {} at {}", previous, next, lastUpdated);
        }
    }

    public boolean isRunning() {
        return state.get() == BotStatus.RUNNING;
    }

    public BotStatusResponse getStatus() {
        return new BotStatusResponse(state.get().name(), lastUpdated);
    }
}
