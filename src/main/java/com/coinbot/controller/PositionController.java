package com.coinbot.controller;

import com.coinbot.dto.ApiResponse;
import com.coinbot.model.CompletedTrade;
import com.coinbot.model.PositionSnapshot;
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

import java.util.List;

@RestController
@RequestMapping("/api/positions")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Positions", description = "Positions, trades and manual operations")
public class PositionController {

    private final TradingSessionService sessionService;

    @GetMapping
    @Operation(summary = "Get tracked positions", description = "Every position currently occupying a coin")
    public ResponseEntity<ApiResponse<List<PositionSnapshot>>> getPositions() {
        return ResponseEntity.ok(ApiResponse.success(sessionService.getPositions()));
    }

    @GetMapping("/attention")
    @Operation(summary = "Get positions needing attention",
               description = "Positions whose close failed after all retries. The exchange position may still be live.")
    public ResponseEntity<ApiResponse<List<PositionSnapshot>>> getAttention() {
        return ResponseEntity.ok(ApiResponse.success(sessionService.getAttentionPositions()));
    }

    @GetMapping("/trades")
    @Operation(summary = "Get completed trades", description = "Most recent first")
    public ResponseEntity<ApiResponse<List<CompletedTrade>>> getTrades() {
        return ResponseEntity.ok(ApiResponse.success(sessionService.getTrades()));
    }

    @PostMapping("/{coin}/close")
    @Operation(summary = "Close a position manually", description = "Closes the position with reason MANUAL")
    public ResponseEntity<ApiResponse<PositionSnapshot>> close(@PathVariable String coin) {
        log.info("API Request - Manual close of {}", coin);
        return ResponseEntity.ok(ApiResponse.success("Close requested", sessionService.closePosition(coin)));
    }

    @PostMapping("/{coin}/acknowledge")
    @Operation(summary = "Acknowledge a failed close",
               description = "Confirms the exchange position was handled by hand and frees the coin and its slot")
    public ResponseEntity<ApiResponse<PositionSnapshot>> acknowledge(@PathVariable String coin) {
        log.info("API Request - Acknowledge failed position on {}", coin);
        return ResponseEntity.ok(ApiResponse.success("Failure acknowledged", sessionService.acknowledgeFailure(coin)));
    }
}
