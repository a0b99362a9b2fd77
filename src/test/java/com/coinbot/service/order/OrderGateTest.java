package com.coinbot.service.order;

import com.coinbot.exception.ExchangeException;
import com.coinbot.model.AdmissionDecision;
import com.coinbot.model.AdmissionResult;
import com.coinbot.model.AlertLevel;
import com.coinbot.model.CloseReason;
import com.coinbot.model.OrderFill;
import com.coinbot.model.Position;
import com.coinbot.model.PositionSide;
import com.coinbot.model.PositionStatus;
import com.coinbot.model.RiskConfig;
import com.coinbot.model.Signal;
import com.coinbot.model.SignalAction;
import com.coinbot.testutil.FakeExchangeClient;
import com.coinbot.testutil.MutableClock;
import com.coinbot.testutil.RecordingStateSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class OrderGateTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private FakeExchangeClient exchange;
    private RecordingStateSink sink;
    private PositionBook book;
    private AtomicReference<RiskConfig> risk;
    private List<Position> handedOff;
    private OrderGate gate;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        exchange = new FakeExchangeClient().price("BTC", 50_000.0).price("ETH", 2_500.0).price("SOL", 100.0);
        sink = new RecordingStateSink();
        book = new PositionBook();
        risk = new AtomicReference<>(RiskConfig.builder()
                .maxPositions(2)
                .positionSizeUsd(20.0)
                .stopLossPercent(0.6)
                .takeProfitPercent(1.6)
                .trailingStopPercent(0.3)
                .trailingActivationPercent(0.3)
                .minSignalStrength(0.6)
                .cooldownSeconds(300)
                .build());
        handedOff = new CopyOnWriteArrayList<>();
        gate = new OrderGate(book, exchange, risk::get, sink, handedOff::add, clock);
    }

    private Signal buy(String coin, double strength) {
        return Signal.actionable(coin, SignalAction.BUY, strength, clock.instant(), "rsi_1h", Map.of());
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("HOLD signals are rejected before any exchange call")
        void holdIsRejected() {
            AdmissionResult result = gate.submit(Signal.hold("BTC", T0, "rsi_1h", Map.of()));

            assertEquals(AdmissionDecision.REJECTED_HOLD, result.getDecision());
            assertEquals(0, exchange.getPlaceCalls());
            assertNull(book.get("BTC"));
        }

        @Test
        @DisplayName("BUY with zero strength violates the strength/action invariant")
        void zeroStrengthBuyIsInvalid() {
            Signal bad = new Signal("BTC", SignalAction.BUY, 0.0, T0, "rsi_1h", null);

            assertEquals(AdmissionDecision.REJECTED_INVALID, gate.submit(bad).getDecision());
        }

        @Test
        @DisplayName("Strength outside [0, 1] is invalid")
        void outOfRangeStrengthIsInvalid() {
            Signal bad = new Signal("BTC", SignalAction.SELL, 1.5, T0, "rsi_1h", null);

            assertEquals(AdmissionDecision.REJECTED_INVALID, gate.submit(bad).getDecision());
        }

        @Test
        @DisplayName("Null signal is invalid")
        void nullSignalIsInvalid() {
            assertEquals(AdmissionDecision.REJECTED_INVALID, gate.submit(null).getDecision());
        }

        @Test
        @DisplayName("Strength below the minimum is rejected as weak")
        void weakSignalIsRejected() {
            AdmissionResult result = gate.submit(buy("BTC", 0.5));

            assertEquals(AdmissionDecision.REJECTED_WEAK, result.getDecision());
            assertEquals(0, book.getOccupiedSlots());
        }
    }

    @Nested
    @DisplayName("Admission")
    class AdmissionTests {

        @Test
        @DisplayName("Admitted BUY opens a LONG with SL/TP derived from the entry price")
        void admittedBuyOpensLong() {
            AdmissionResult result = gate.submit(buy("BTC", 0.8));

            assertTrue(result.isAdmitted());
            Position position = book.get("BTC");
            assertNotNull(position);
            assertEquals(PositionStatus.OPEN, position.getStatus());
            assertEquals(PositionSide.LONG, position.getSide());
            assertEquals(50_000.0, position.getEntryPrice(), 1e-9);
            assertEquals(0.0004, position.getSize(), 1e-12);
            assertEquals(50_000.0 * 0.994, position.getStopLossPrice(), 1e-6);
            assertEquals(50_000.0 * 1.016, position.getTakeProfitPrice(), 1e-6);
            assertEquals(50_000.0, position.getTrailingWatermark(), 1e-9);
            assertEquals(position.getStopLossPrice(), position.getTrailingStopPrice(), 1e-9);
            assertEquals(1, book.getOccupiedSlots());
            assertEquals(List.of(position), handedOff);
        }

        @Test
        @DisplayName("SELL opens a SHORT with mirrored thresholds")
        void sellOpensShort() {
            Signal sell = Signal.actionable("ETH", SignalAction.SELL, 0.9, T0, "macd_15min", Map.of());

            assertTrue(gate.submit(sell).isAdmitted());

            Position position = book.get("ETH");
            assertEquals(PositionSide.SHORT, position.getSide());
            assertEquals(2_500.0 * 1.006, position.getStopLossPrice(), 1e-9);
            assertEquals(2_500.0 * 0.984, position.getTakeProfitPrice(), 1e-9);
        }

        @Test
        @DisplayName("Placeholder is published as OPENING before the OPEN update")
        void publishesOpeningThenOpen() {
            gate.submit(buy("BTC", 0.8));

            assertEquals(2, sink.positionUpdates.size());
            assertEquals(PositionStatus.OPENING, sink.positionUpdates.get(0).getStatus());
            assertEquals(PositionStatus.OPEN, sink.positionUpdates.get(1).getStatus());
        }

        @Test
        @DisplayName("Second signal for an occupied coin is a duplicate")
        void duplicateIsRejected() {
            gate.submit(buy("BTC", 0.8));

            AdmissionResult second = gate.submit(buy("BTC", 0.95));

            assertEquals(AdmissionDecision.REJECTED_DUPLICATE, second.getDecision());
            assertEquals(1, exchange.getPlaceCalls());
        }

        @Test
        @DisplayName("maxPositions is enforced across coins")
        void maxPositionsEnforced() {
            assertTrue(gate.submit(buy("BTC", 0.8)).isAdmitted());
            assertTrue(gate.submit(buy("ETH", 0.8)).isAdmitted());

            AdmissionResult third = gate.submit(buy("SOL", 0.9));

            assertEquals(AdmissionDecision.REJECTED_MAX_POSITIONS, third.getDecision());
            assertNull(book.get("SOL"));
            assertEquals(2, book.getOccupiedSlots());
        }

        @Test
        @DisplayName("CLOSING and unacknowledged failed-close positions keep their coin and slot")
        void closingAndFailedCloseStillCount() {
            assertTrue(gate.submit(buy("BTC", 0.8)).isAdmitted());
            assertTrue(gate.submit(buy("ETH", 0.8)).isAdmitted());
            book.get("BTC").markClosing(CloseReason.STOP_LOSS);
            Position eth = book.get("ETH");
            eth.markClosing(CloseReason.TAKE_PROFIT);
            eth.markCloseFailed("exchange unavailable", clock.instant());
            clock.advance(Duration.ofHours(1));

            assertEquals(AdmissionDecision.REJECTED_DUPLICATE, gate.submit(buy("BTC", 0.9)).getDecision());
            assertEquals(AdmissionDecision.REJECTED_DUPLICATE, gate.submit(buy("ETH", 0.9)).getDecision());
            assertEquals(AdmissionDecision.REJECTED_MAX_POSITIONS, gate.submit(buy("SOL", 0.9)).getDecision());
            assertEquals(2, exchange.getPlaceCalls());
        }

        @Test
        @DisplayName("Cooldown blocks a coin after its last open until it expires")
        void cooldownAfterOpen() {
            assertTrue(gate.submit(buy("BTC", 0.8)).isAdmitted());
            Position first = book.get("BTC");
            first.markClosing(CloseReason.MANUAL);
            first.markClosed(50_000.0, clock.instant());
            book.remove(first);
            book.releaseSlot();

            clock.advance(Duration.ofSeconds(120));
            assertEquals(AdmissionDecision.REJECTED_COOLDOWN, gate.submit(buy("BTC", 0.8)).getDecision());

            clock.advance(Duration.ofSeconds(181));
            assertTrue(gate.submit(buy("BTC", 0.8)).isAdmitted());
        }

        @Test
        @DisplayName("Statistics count every decision and today's trades")
        void statisticsAreRecorded() {
            gate.submit(buy("BTC", 0.8));
            gate.submit(buy("BTC", 0.8));
            gate.submit(buy("ETH", 0.1));

            GateStatistics stats = gate.getStatistics();
            assertEquals(1, stats.getCount(AdmissionDecision.ADMITTED));
            assertEquals(1, stats.getCount(AdmissionDecision.REJECTED_DUPLICATE));
            assertEquals(1, stats.getCount(AdmissionDecision.REJECTED_WEAK));
            assertEquals(Map.of("BTC", 1), stats.getTradesToday());
            assertEquals(300L, stats.getCooldownsRemaining(300).get("BTC"));
        }

        @Test
        @DisplayName("A reloaded risk snapshot applies to later admissions")
        void reloadAppliesToNextAdmission() {
            risk.set(risk.get().toBuilder().minSignalStrength(0.9).build());

            assertEquals(AdmissionDecision.REJECTED_WEAK, gate.submit(buy("BTC", 0.8)).getDecision());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Exchange rejection fails the placeholder and releases the slot")
        void exchangeFailureReleasesSlot() {
            exchange.setFailPlacement(true);

            AdmissionResult result = gate.submit(buy("BTC", 0.8));

            assertEquals(AdmissionDecision.FAILED_EXCHANGE, result.getDecision());
            assertEquals(PositionStatus.FAILED, result.getPosition().getStatus());
            assertNull(book.get("BTC"));
            assertEquals(0, book.getOccupiedSlots());
            assertTrue(handedOff.isEmpty());
            assertEquals(1, sink.alerts.size());
            assertEquals(AlertLevel.WARNING, sink.alerts.get(0).getLevel());

            exchange.setFailPlacement(false);
            assertTrue(gate.submit(buy("BTC", 0.8)).isAdmitted(), "a later signal retries naturally");
        }

        @Test
        @DisplayName("Insufficient balance is rejected without placing an order")
        void insufficientBalance() {
            exchange.setAvailableBalance(5.0);

            AdmissionResult result = gate.submit(buy("BTC", 0.8));

            assertEquals(AdmissionDecision.REJECTED_INSUFFICIENT_BALANCE, result.getDecision());
            assertEquals(0, exchange.getPlaceCalls());
            assertEquals(0, book.getOccupiedSlots());
        }

        @Test
        @DisplayName("Price fetch failure fails the admission")
        void priceFailure() {
            exchange.setFailPrice(true);

            assertEquals(AdmissionDecision.FAILED_EXCHANGE, gate.submit(buy("BTC", 0.8)).getDecision());
            assertNull(book.get("BTC"));
        }
    }

    @Nested
    @DisplayName("Halting")
    class HaltTests {

        @Test
        @DisplayName("A halted gate rejects submissions without touching the exchange")
        void haltedGateRejects() {
            gate.halt();

            AdmissionResult result = gate.submit(buy("BTC", 0.9));

            assertEquals(AdmissionDecision.REJECTED_HALTED, result.getDecision());
            assertTrue(gate.isHalted());
            assertEquals(0, exchange.getPlaceCalls());
            assertNull(book.get("BTC"));
            assertEquals(0, book.getOccupiedSlots());
            assertEquals(1, gate.getStatistics().getCount(AdmissionDecision.REJECTED_HALTED));
        }

        @Test
        @DisplayName("An order already being placed when the gate halts is still handed off")
        void inFlightPlacementCompletes() {
            FakeExchangeClient haltingExchange = new FakeExchangeClient() {
                @Override
                public OrderFill placeOrder(String coin, PositionSide side, double size) throws ExchangeException {
                    gate.halt();
                    return super.placeOrder(coin, side, size);
                }
            }.price("BTC", 50_000.0);
            gate = new OrderGate(book, haltingExchange, risk::get, sink, handedOff::add, clock);

            AdmissionResult result = gate.submit(buy("BTC", 0.9));

            assertEquals(AdmissionDecision.ADMITTED, result.getDecision());
            assertEquals(1, handedOff.size());
            assertEquals(AdmissionDecision.REJECTED_HALTED, gate.submit(buy("ETH", 0.9)).getDecision());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Concurrent admissions for one coin open exactly one position")
        void atMostOnePositionPerCoin() throws Exception {
            risk.set(risk.get().toBuilder().maxPositions(50).build());
            int threads = 16;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch startGate = new CountDownLatch(1);
            List<Future<AdmissionResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    startGate.await();
                    return gate.submit(buy("BTC", 0.8));
                }));
            }
            startGate.countDown();

            int admitted = 0;
            for (Future<AdmissionResult> future : futures) {
                AdmissionResult result = future.get(5, TimeUnit.SECONDS);
                if (result.isAdmitted()) {
                    admitted++;
                } else {
                    assertEquals(AdmissionDecision.REJECTED_DUPLICATE, result.getDecision());
                }
            }
            pool.shutdownNow();

            assertEquals(1, admitted);
            assertEquals(1, exchange.getPlaceCalls());
            assertEquals(1, book.getOccupiedSlots());
        }

        @Test
        @DisplayName("Concurrent admissions across coins never exceed maxPositions")
        void slotLimitHoldsAcrossCoins() throws Exception {
            risk.set(risk.get().toBuilder().maxPositions(3).build());
            List<String> coins = List.of("C0", "C1", "C2", "C3", "C4", "C5", "C6", "C7", "C8", "C9");
            coins.forEach(coin -> exchange.price(coin, 10.0));

            ExecutorService pool = Executors.newFixedThreadPool(coins.size());
            CountDownLatch startGate = new CountDownLatch(1);
            List<Future<AdmissionResult>> futures = new ArrayList<>();
            for (String coin : coins) {
                futures.add(pool.submit(() -> {
                    startGate.await();
                    return gate.submit(buy(coin, 0.8));
                }));
            }
            startGate.countDown();

            int admitted = 0;
            for (Future<AdmissionResult> future : futures) {
                if (future.get(5, TimeUnit.SECONDS).isAdmitted()) {
                    admitted++;
                }
            }
            pool.shutdownNow();

            assertEquals(3, admitted);
            assertEquals(3, book.getOccupiedSlots());
            assertEquals(7, gate.getStatistics().getCount(AdmissionDecision.REJECTED_MAX_POSITIONS));
        }
    }

    @Test
    @DisplayName("Order size is USD over price rounded to 5 decimals")
    void sizing() {
        assertEquals(0.0004, OrderGate.sizeFor(20.0, 50_000.0), 1e-12);
        assertEquals(0.33333, OrderGate.sizeFor(20.0, 60.0), 1e-12);
        assertEquals(0.0, OrderGate.sizeFor(20.0, 0.0));
        assertEquals(0.0, OrderGate.sizeFor(20.0, Double.NaN));
    }
}
