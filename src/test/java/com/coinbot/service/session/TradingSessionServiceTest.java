package com.coinbot.service.session;

import com.coinbot.config.SchedulerConfig;
import com.coinbot.config.TradingConfig;
import com.coinbot.dto.RiskConfigRequest;
import com.coinbot.dto.SessionStatusResponse;
import com.coinbot.dto.StartSessionRequest;
import com.coinbot.dto.StrategyInfo;
import com.coinbot.exception.ConfigurationException;
import com.coinbot.exception.PositionNotFoundException;
import com.coinbot.model.RiskConfig;
import com.coinbot.service.BotStatusService;
import com.coinbot.service.signal.SignalStrategy;
import com.coinbot.service.signal.StrategyFactory;
import com.coinbot.service.sink.BufferedStateSink;
import com.coinbot.service.sink.StateSnapshotStore;
import com.coinbot.testutil.FakeExchangeClient;
import com.coinbot.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TradingSessionServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    private TradingConfig tradingConfig;
    private BotStatusService botStatusService;
    private ScheduledFuture<?> monitoringFuture;
    private List<Runnable> loopTasks;
    private TradingSessionService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(T0);
        tradingConfig = new TradingConfig();
        tradingConfig.setMonitoredCoins(new ArrayList<>(List.of("btc", " eth ", "BTC")));

        SignalStrategy rsi = mock(SignalStrategy.class);
        when(rsi.getName()).thenReturn("rsi_1h");
        when(rsi.getTimeframe()).thenReturn("1h");
        when(rsi.getDescription()).thenReturn("RSI on 1h candles");
        StrategyFactory strategyFactory = mock(StrategyFactory.class);
        when(strategyFactory.createEnabledStrategies()).thenReturn(List.of(rsi));

        monitoringFuture = mock(ScheduledFuture.class);
        TaskScheduler taskScheduler = mock(TaskScheduler.class);
        doReturn(monitoringFuture).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));

        // Loop bodies are captured, not run, so no background threads are started
        loopTasks = new ArrayList<>();
        botStatusService = new BotStatusService(clock);
        StateSnapshotStore store = new StateSnapshotStore();

        service = new TradingSessionService(tradingConfig, new SchedulerConfig(), strategyFactory,
                new FakeExchangeClient().price("BTC", 100.0), new BufferedStateSink(store), store,
                botStatusService, clock, Runnable::run, Runnable::run, Runnable::run, loopTasks::add,
                taskScheduler);
    }

    @Nested
    @DisplayName("Session lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Start registers each strategy for every distinct coin and marks the bot running")
        void start() {
            SessionStatusResponse status = service.start(null);

            assertEquals("RUNNING", status.getStatus());
            assertEquals(List.of("BTC", "ETH"), status.getCoins());
            assertEquals(List.of("rsi_1h"), status.getStrategies());
            assertTrue(status.isExecuteOrders());
            assertEquals(T0, status.getStartedAt());
            assertEquals(2, service.getScheduleEntries().size());
            assertEquals(2, loopTasks.size());
            assertTrue(service.isRunning());
            assertEquals(0, status.getPositionChecks());
            assertEquals(0, status.getSkippedPositionChecks());
        }

        @Test
        @DisplayName("Request overrides pick the coins and monitor-only mode")
        void startWithOverrides() {
            StartSessionRequest request = new StartSessionRequest();
            request.setExecuteOrders(false);
            request.setCoins(List.of("sol"));

            SessionStatusResponse status = service.start(request);

            assertFalse(status.isExecuteOrders());
            assertEquals(List.of("SOL"), status.getCoins());
        }

        @Test
        @DisplayName("A second start while running is rejected")
        void startTwice() {
            service.start(null);

            assertThrows(IllegalStateException.class, () -> service.start(null));
        }

        @Test
        @DisplayName("Starting with no usable coin is rejected")
        void noCoins() {
            StartSessionRequest request = new StartSessionRequest();
            request.setCoins(List.of(" ", ""));

            assertThrows(IllegalArgumentException.class, () -> service.start(request));
            assertFalse(botStatusService.isRunning());
        }

        @Test
        @DisplayName("Stop halts monitoring and a fresh session can be started afterwards")
        void stopAndRestart() {
            String firstId = service.start(null).getSessionId();

            SessionStatusResponse stopped = service.stop();

            assertEquals("STOPPED", stopped.getStatus());
            assertNotNull(stopped.getStoppedAt());
            assertFalse(service.isRunning());
            verify(monitoringFuture).cancel(false);

            String secondId = service.start(null).getSessionId();
            assertNotEquals(firstId, secondId);
        }

        @Test
        @DisplayName("Session operations require a started session")
        void noSession() {
            assertThrows(IllegalStateException.class, () -> service.stop());
            assertThrows(IllegalStateException.class, () -> service.emergencyStop());
            assertThrows(IllegalStateException.class, () -> service.closePosition("BTC"));
            assertTrue(service.getPositions().isEmpty());
            assertNull(service.getStatus().getSessionId());
        }

        @Test
        @DisplayName("Emergency stop reports the session and marks the bot stopped")
        void emergencyStop() {
            String id = service.start(null).getSessionId();

            var result = service.emergencyStop();

            assertEquals(id, result.get("sessionId"));
            assertEquals(0, result.get("positionsClosing"));
            assertFalse(botStatusService.isRunning());
        }

        @Test
        @DisplayName("Closing a coin without a position is reported as not found")
        void closeUnknown() {
            service.start(null);

            assertThrows(PositionNotFoundException.class, () -> service.closePosition("doge"));
        }
    }

    @Nested
    @DisplayName("Strategies")
    class StrategyTests {

        @Test
        @DisplayName("Strategies report their interval and enabled flag")
        void toggle() {
            service.start(null);

            service.setStrategyEnabled("rsi_1h", false);
            StrategyInfo info = service.getStrategies().get(0);

            assertEquals("rsi_1h", info.name());
            assertEquals(3600, info.checkIntervalSeconds());
            assertFalse(info.enabled());
            assertEquals(2, info.coins());
        }

        @Test
        @DisplayName("Unknown strategy names are rejected")
        void unknown() {
            service.start(null);

            assertThrows(IllegalArgumentException.class, () -> service.setStrategyEnabled("nope", true));
        }
    }

    @Nested
    @DisplayName("Risk reload")
    class ReloadTests {

        @Test
        @DisplayName("Partial reloads accumulate on the running snapshot")
        void accumulate() {
            service.start(null);

            RiskConfigRequest first = new RiskConfigRequest();
            first.setStopLossPercent(1.5);
            service.reload(first);
            RiskConfigRequest second = new RiskConfigRequest();
            second.setMaxPositions(3);
            RiskConfig result = service.reload(second);

            assertEquals(1.5, result.getStopLossPercent());
            assertEquals(3, result.getMaxPositions());
            assertEquals(result, service.getStatus().getRiskConfig());
        }

        @Test
        @DisplayName("An invalid reload keeps the previous snapshot")
        void invalid() {
            service.start(null);
            RiskConfig before = service.getStatus().getRiskConfig();

            RiskConfigRequest request = new RiskConfigRequest();
            request.setMinSignalStrength(1.5);

            assertThrows(ConfigurationException.class, () -> service.reload(request));
            assertEquals(before, service.getStatus().getRiskConfig());
        }
    }

    @Nested
    @DisplayName("Merging overrides")
    class MergeTests {

        private final RiskConfig base = RiskConfig.builder()
                .maxPositions(10)
                .positionSizeUsd(20.0)
                .stopLossPercent(2.2)
                .takeProfitPercent(10.12)
                .trailingStopPercent(0.2)
                .trailingActivationPercent(0.3)
                .minSignalStrength(0.75)
                .cooldownSeconds(300)
                .build();

        @Test
        @DisplayName("A missing request returns the base unchanged")
        void nullRequest() {
            assertSame(base, TradingSessionService.merge(base, null));
        }

        @Test
        @DisplayName("Only the fields set on the request are replaced")
        void partial() {
            RiskConfigRequest request = new RiskConfigRequest();
            request.setPositionSizeUsd(50.0);
            request.setCooldownSeconds(0L);

            RiskConfig merged = TradingSessionService.merge(base, request);

            assertEquals(50.0, merged.getPositionSizeUsd());
            assertEquals(0L, merged.getCooldownSeconds());
            assertEquals(base.toBuilder().positionSizeUsd(50.0).cooldownSeconds(0).build(), merged);
        }

        @Test
        @DisplayName("Every field can be overridden")
        void full() {
            RiskConfigRequest request = new RiskConfigRequest();
            request.setMaxPositions(2);
            request.setPositionSizeUsd(15.0);
            request.setStopLossPercent(0.6);
            request.setTakeProfitPercent(1.6);
            request.setTrailingStopPercent(0.3);
            request.setTrailingActivationPercent(0.5);
            request.setMinSignalStrength(0.6);
            request.setCooldownSeconds(60L);

            RiskConfig merged = TradingSessionService.merge(base, request);

            assertEquals(RiskConfig.builder()
                    .maxPositions(2)
                    .positionSizeUsd(15.0)
                    .stopLossPercent(0.6)
                    .takeProfitPercent(1.6)
                    .trailingStopPercent(0.3)
                    .trailingActivationPercent(0.5)
                    .minSignalStrength(0.6)
                    .cooldownSeconds(60)
                    .build(), merged);
        }
    }
}
