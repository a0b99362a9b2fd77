package com.coinbot.service.session;

import com.coinbot.exception.ConfigurationException;
import com.coinbot.exception.ExchangeException;
import com.coinbot.model.AdmissionDecision;
import com.coinbot.model.CloseReason;
import com.coinbot.model.CompletedTrade;
import com.coinbot.model.OrderFill;
import com.coinbot.model.Position;
import com.coinbot.model.PositionSide;
import com.coinbot.model.PositionStatus;
import com.coinbot.model.RiskConfig;
import com.coinbot.model.Signal;
import com.coinbot.model.SignalAction;
import com.coinbot.service.monitoring.exit.StopLossExitRule;
import com.coinbot.service.monitoring.exit.TakeProfitExitRule;
import com.coinbot.service.monitoring.exit.TrailingStopExitRule;
import com.coinbot.service.order.PositionBook;
import com.coinbot.service.signal.SignalStrategy;
import com.coinbot.testutil.FakeExchangeClient;
import com.coinbot.testutil.MutableClock;
import com.coinbot.testutil.RecordingStateSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class TradingSessionTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");
    private static final double P = 100.0;

    private static final RiskConfig SCENARIO_RISK = RiskConfig.builder()
            .maxPositions(1)
            .positionSizeUsd(20.0)
            .stopLossPercent(0.6)
            .takeProfitPercent(1.6)
            .trailingStopPercent(0.3)
            .trailingActivationPercent(0.3)
            .minSignalStrength(0.6)
            .cooldownSeconds(0)
            .build();

    private MutableClock clock;
    private FakeExchangeClient exchange;
    private RecordingStateSink sink;
    private PositionBook book;
    private TradingSession session;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        exchange = new FakeExchangeClient().price("BTC", P).price("ETH", 2000.0);
        sink = new RecordingStateSink();
        book = new PositionBook();
        session = newSession(SCENARIO_RISK, true);
    }

    private TradingSession newSession(RiskConfig risk, boolean executeOrders) {
        return newSession(risk, executeOrders, Runnable::run);
    }

    private TradingSession newSession(RiskConfig risk, boolean executeOrders, Executor admissionExecutor) {
        return TradingSession.builder()
                .riskConfig(risk)
                .executeOrders(executeOrders)
                .positionBook(book)
                .exchangeClient(exchange)
                .stateSink(sink)
                .clock(clock)
                .workerExecutor(Runnable::run)
                .admissionExecutor(admissionExecutor)
                .monitorExecutor(Runnable::run)
                .schedulerTick(Duration.ofSeconds(1))
                .queueCapacity(16)
                .maxCloseRetries(3)
                .exitRules(List.of(new StopLossExitRule(), new TakeProfitExitRule(), new TrailingStopExitRule()))
                .build();
    }

    /** Runs one scheduler pass at the current clock time and admits whatever it produced. */
    private void schedulePass() {
        session.getScheduler().tick(clock.instant());
        session.getDispatcher().drainPending();
    }

    private void priceTick(String coin, double price) {
        exchange.price(coin, price);
        clock.advance(Duration.ofSeconds(3));
        session.getLifecycleManager().runMonitoringCycle();
    }

    @Test
    @DisplayName("Scenario: slot limit, trailing activation and a profitable trailing exit")
    void endToEndTrailingScenario() {
        session.getScheduler().register(new ScriptedStrategy("rsi_1h", SignalAction.BUY, 0.8), "BTC",
                Duration.ofMinutes(5));
        schedulePass();

        Position btc = book.get("BTC");
        assertNotNull(btc);
        assertEquals(PositionStatus.OPEN, btc.getStatus());
        assertEquals(0.2, btc.getSize(), 1e-9);

        session.getScheduler().register(new ScriptedStrategy("macd_4h", SignalAction.BUY, 0.9), "ETH",
                Duration.ofMinutes(5));
        clock.advance(Duration.ofSeconds(1));
        schedulePass();

        assertNull(book.get("ETH"));
        assertEquals(1, session.getOrderGate().getStatistics().getCount(AdmissionDecision.REJECTED_MAX_POSITIONS));

        priceTick("BTC", P * 1.015);
        assertTrue(btc.isTrailingActive());
        assertEquals(P * 1.015 * 0.997, btc.getTrailingStopPrice(), 1e-9);
        assertEquals(PositionStatus.OPEN, btc.getStatus());

        priceTick("BTC", P * 1.0115);

        assertEquals(PositionStatus.CLOSED, btc.getStatus());
        assertEquals(CloseReason.TRAILING_STOP, btc.getCloseReason());
        CompletedTrade trade = sink.trades.get(0);
        assertEquals(CloseReason.TRAILING_STOP, trade.getReason());
        assertTrue(trade.getPnl() > 0.0);
        assertEquals(0, book.getOccupiedSlots());

        session.getScheduler().unregister("rsi_1h", "BTC");
        clock.advance(Duration.ofMinutes(5));
        schedulePass();
        assertEquals(PositionStatus.OPEN, book.get("ETH").getStatus());
    }

    @Test
    @DisplayName("Monitor-only session publishes signals but never opens positions")
    void monitorOnlySession() {
        session = newSession(SCENARIO_RISK, false);
        session.getScheduler().register(new ScriptedStrategy("rsi_1h", SignalAction.SELL, 0.95), "BTC",
                Duration.ofMinutes(5));

        schedulePass();

        assertEquals(1, sink.signals.size());
        assertNull(book.get("BTC"));
        assertEquals(0, exchange.getPlaceCalls());
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("start wires monitoring and loops, and a session cannot be started twice")
        void startOnce() {
            List<Runnable> loops = new ArrayList<>();
            TaskScheduler tickScheduler = mock(TaskScheduler.class);

            session.start(loops::add, tickScheduler, Duration.ofSeconds(3), T0);

            assertTrue(session.isActive());
            assertEquals(2, loops.size());
            verify(tickScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
            assertThrows(IllegalStateException.class,
                    () -> session.start(loops::add, tickScheduler, Duration.ofSeconds(3), T0));

            session.stop(T0.plusSeconds(60));
            assertFalse(session.isActive());
            assertEquals(T0.plusSeconds(60), session.getStoppedAt());
        }

        @Test
        @DisplayName("Emergency stop closes every open position with reason EMERGENCY")
        void emergencyStop() {
            session = newSession(SCENARIO_RISK.toBuilder().maxPositions(3).build(), true);
            session.getOrderGate().submit(Signal.actionable("BTC", SignalAction.BUY, 0.9, T0, "rsi_1h", null));
            session.getOrderGate().submit(Signal.actionable("ETH", SignalAction.SELL, 0.9, T0, "rsi_1h", null));

            assertEquals(2, session.emergencyStop());

            assertEquals(2, sink.trades.size());
            assertTrue(sink.trades.stream().allMatch(trade -> trade.getReason() == CloseReason.EMERGENCY));
            assertTrue(book.allPositions().isEmpty());
        }

        @Test
        @DisplayName("Admissions still queued on a lane are rejected after an emergency stop")
        void queuedAdmissionAfterEmergencyStop() {
            List<Runnable> deferred = new ArrayList<>();
            session = newSession(SCENARIO_RISK, true, deferred::add);
            session.getDispatcher().dispatch(Signal.actionable("BTC", SignalAction.BUY, 0.9, T0, "rsi_1h", null));
            assertEquals(1, deferred.size());

            assertEquals(0, session.emergencyStop());
            deferred.forEach(Runnable::run);

            assertNull(book.get("BTC"));
            assertEquals(0, exchange.getPlaceCalls());
            assertEquals(1, session.getOrderGate().getStatistics().getCount(AdmissionDecision.REJECTED_HALTED));
        }

        @Test
        @DisplayName("Admissions still queued on a lane are rejected after a stop")
        void queuedAdmissionAfterStop() {
            List<Runnable> deferred = new ArrayList<>();
            session = newSession(SCENARIO_RISK, true, deferred::add);
            session.getDispatcher().dispatch(Signal.actionable("ETH", SignalAction.SELL, 0.9, T0, "rsi_1h", null));

            session.stop(T0);
            deferred.forEach(Runnable::run);

            assertNull(book.get("ETH"));
            assertEquals(0, exchange.getPlaceCalls());
        }

        @Test
        @DisplayName("An order filled during an emergency stop is closed with reason EMERGENCY")
        void fillDuringEmergencyStop() {
            exchange = new FakeExchangeClient() {
                @Override
                public OrderFill placeOrder(String coin, PositionSide side, double size) throws ExchangeException {
                    session.emergencyStop();
                    return super.placeOrder(coin, side, size);
                }
            }.price("BTC", P);
            session = newSession(SCENARIO_RISK, true);

            session.getOrderGate().submit(Signal.actionable("BTC", SignalAction.BUY, 0.9, T0, "rsi_1h", null));

            assertEquals(1, sink.trades.size());
            assertEquals(CloseReason.EMERGENCY, sink.trades.get(0).getReason());
            assertNull(book.get("BTC"));
            assertEquals(0, book.getOccupiedSlots());
        }

        @Test
        @DisplayName("Reload swaps the risk snapshot and rejects invalid values")
        void reload() {
            RiskConfig wider = SCENARIO_RISK.toBuilder().maxPositions(4).build();

            session.reload(wider);
            assertEquals(4, session.currentRiskConfig().getMaxPositions());
            assertEquals(4, session.getOrderGate().currentRiskConfig().getMaxPositions());

            RiskConfig invalid = SCENARIO_RISK.toBuilder().stopLossPercent(-1.0).build();
            assertThrows(ConfigurationException.class, () -> session.reload(invalid));
            assertEquals(4, session.currentRiskConfig().getMaxPositions());
        }

        @Test
        @DisplayName("Positions outlive a stopped session and are picked up by the next one")
        void positionsSurviveSession() {
            session.getOrderGate().submit(Signal.actionable("BTC", SignalAction.BUY, 0.9, T0, "rsi_1h", null));
            session.stop(T0);

            TradingSession next = newSession(SCENARIO_RISK, true);
            exchange.price("BTC", 99.0);
            next.getLifecycleManager().runMonitoringCycle();

            assertEquals(CloseReason.STOP_LOSS, sink.trades.get(0).getReason());
            assertTrue(next.getOrderGate().getStatistics().getTradesToday().isEmpty());
        }
    }

    /** Always answers with the same signal. */
    private class ScriptedStrategy implements SignalStrategy {

        private final String name;
        private final SignalAction action;
        private final double strength;

        ScriptedStrategy(String name, SignalAction action, double strength) {
            this.name = name;
            this.action = action;
            this.strength = strength;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getTimeframe() {
            return name.substring(name.indexOf('_') + 1);
        }

        @Override
        public Signal generate(String coin) {
            return Signal.actionable(coin, action, strength, clock.instant(), name, null);
        }
    }
}
