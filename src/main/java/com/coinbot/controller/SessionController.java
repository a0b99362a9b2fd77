package com.coinbot.controller;

import com.coinbot.dto.ApiResponse;
import com.coinbot.dto.BotStatusResponse;
import com.coinbot.dto.DashboardSnapshot;
import com.coinbot.dto.RiskConfigRequest;
import com.coinbot.dto.SessionStatusResponse;
import com.coinbot.dto.StartSessionRequest;
import com.coinbot.model.RiskConfig;
import com.coinbot.service.BotStatusService;
import com.coinbot.service.session.TradingSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/session")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Session", description = "Trading session lifecycle")
public class SessionController {

    private final TradingSessionService sessionService;
    private final BotStatusService botStatusService;

    @PostMapping("/start")
    @Operation(summary = "Start a trading session",
               description = "Builds the configured strategies, registers them for every monitored coin and starts "
                       + "the scheduler, dispatcher and position monitor. Set executeOrders=false for signal "
                       + "monitoring only.")
    public ResponseEntity<ApiResponse<SessionStatusResponse>> start(
            @RequestBody(required = false) StartSessionRequest request) {
        log.info("API Request - Start session: {}", request);
        SessionStatusResponse status = sessionService.start(request);
        return ResponseEntity.ok(ApiResponse.success("Trading session started", status));
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop the trading session",
               description = "Halts strategy runs, signal dispatch and position monitoring. In-flight calls finish.")
    public ResponseEntity<ApiResponse<SessionStatusResponse>> stop() {
        log.info("API Request - Stop session");
        return ResponseEntity.ok(ApiResponse.success("Trading session stopped", sessionService.stop()));
    }

    @PostMapping("/emergency-stop")
    @Operation(summary = "Emergency stop",
               description = "Stops signal generation and closes every open position with reason EMERGENCY")
    public ResponseEntity<ApiResponse<Map<String, Object>>> emergencyStop() {
        log.warn("API Request - Emergency stop");
        return ResponseEntity.ok(ApiResponse.success("Emergency stop executed", sessionService.emergencyStop()));
    }

    @PostMapping("/reload")
    @Operation(summary = "Reload risk configuration",
               description = "Atomically replaces the risk snapshot of the running session. Unset fields keep "
                       + "their current values. An invalid snapshot is rejected and the previous one stays.")
    public ResponseEntity<ApiResponse<RiskConfig>> reload(@Valid @RequestBody(required = false) RiskConfigRequest request) {
        log.info("API Request - Reload risk config: {}", request);
        return ResponseEntity.ok(ApiResponse.success("Risk configuration reloaded", sessionService.reload(request)));
    }

    @GetMapping("/status")
    @Operation(summary = "Get session status")
    public ResponseEntity<ApiResponse<SessionStatusResponse>> status() {
        return ResponseEntity.ok(ApiResponse.success(sessionService.getStatus()));
    }

    @GetMapping("/bot-status")
    @Operation(summary = "Get bot status", description = "RUNNING or STOPPED with the time of the last change")
    public ResponseEntity<ApiResponse<BotStatusResponse>> botStatus() {
        return ResponseEntity.ok(ApiResponse.success(botStatusService.getStatus()));
    }

    @GetMapping("/dashboard")
    @Operation(summary = "Get dashboard snapshot",
               description = "Positions, recent signals, trades and alerts, P&L summary and sink metrics")
    public ResponseEntity<ApiResponse<DashboardSnapshot>> dashboard() {
        return ResponseEntity.ok(ApiResponse.success(sessionService.getDashboard()));
    }
}
