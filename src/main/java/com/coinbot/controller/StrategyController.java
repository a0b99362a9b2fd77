package com.coinbot.controller;

import com.coinbot.dto.ApiResponse;
import com.coinbot.dto.StrategyInfo;
import com.coinbot.model.StrategyType;
import com.coinbot.service.scheduler.ScheduleEntry;
import com.coinbot.service.session.TradingSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/strategies")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Strategies", description = "Signal strategies and their schedules")
public class StrategyController {

    private final TradingSessionService sessionService;

    @GetMapping
    @Operation(summary = "List strategies of the current session",
               description = "Name, timeframe, check interval and enabled flag of every registered strategy")
    public ResponseEntity<ApiResponse<List<StrategyInfo>>> getStrategies() {
        return ResponseEntity.ok(ApiResponse.success(sessionService.getStrategies()));
    }

    @GetMapping("/types")
    @Operation(summary = "Get available strategy types",
               description = "Every strategy name that can be listed in signals.enabled-strategies")
    public ResponseEntity<ApiResponse<List<Map<String, String>>>> getStrategyTypes() {
        List<Map<String, String>> types = Arrays.stream(StrategyType.values())
                .map(type -> {
                    Map<String, String> info = new LinkedHashMap<>();
                    info.put("name", type.getStrategyName());
                    info.put("interval", type.getInterval());
                    info.put("description", type.getDescription());
                    return info;
                })
                .toList();
        return ResponseEntity.ok(ApiResponse.success(types));
    }

    @GetMapping("/schedule")
    @Operation(summary = "Get schedule entries",
               description = "Per (strategy, coin) cadence, last run, in-flight flag and run/skip/failure counters")
    public ResponseEntity<ApiResponse<List<ScheduleEntry.ScheduleEntryView>>> getSchedule() {
        return ResponseEntity.ok(ApiResponse.success(sessionService.getScheduleEntries()));
    }

    @PostMapping("/{name}/enable")
    @Operation(summary = "Enable a strategy for every coin")
    public ResponseEntity<ApiResponse<Void>> enable(@PathVariable String name) {
        log.info("API Request - Enable strategy {}", name);
        sessionService.setStrategyEnabled(name, true);
        return ResponseEntity.ok(ApiResponse.success("Strategy " + name + " enabled", null));
    }

    @PostMapping("/{name}/disable")
    @Operation(summary = "Disable a strategy for every coin",
               description = "Disabled entries are skipped by the scheduler. Open positions are unaffected.")
    public ResponseEntity<ApiResponse<Void>> disable(@PathVariable String name) {
        log.info("API Request - Disable strategy {}", name);
        sessionService.setStrategyEnabled(name, false);
        return ResponseEntity.ok(ApiResponse.success("Strategy " + name + " disabled", null));
    }
}
