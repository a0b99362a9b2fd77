package com.coinbot.controller;

import com.coinbot.service.RateLimiterService;
import com.coinbot.service.session.TradingSessionService;
import com.coinbot.service.sink.BufferedStateSink;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "Application health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final TradingSessionService sessionService;
    private final RateLimiterService rateLimiterService;
    private final BufferedStateSink stateSink;
    private final Clock clock;

    @GetMapping("/health")
    @Operation(summary = "Get application health status")
    public Map<String, Object> health() {
        return Map.of(
            "status", "UP",
            "timestamp", Instant.now(clock),
            "application", "Coin Signal Bot",
            "sessionRunning", sessionService.isRunning()
        );
    }

    @GetMapping("/health/engine")
    @Operation(summary = "Get engine diagnostics",
               description = "Rate limiter usage, state sink buffer metrics and attention list size")
    public Map<String, Object> engineDiagnostics() {
        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("timestamp", Instant.now(clock));
        diagnostics.put("sessionRunning", sessionService.isRunning());
        diagnostics.put("attentionPositions", sessionService.getAttentionPositions().size());
        diagnostics.put("rateLimiter", rateLimiterService.getStatistics());
        diagnostics.put("stateSink", stateSink.getMetrics());
        return diagnostics;
    }
}
