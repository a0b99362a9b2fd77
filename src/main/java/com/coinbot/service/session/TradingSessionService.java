package com.coinbot.service.session;

import com.coinbot.config.SchedulerConfig;
import com.coinbot.config.TradingConfig;
import com.coinbot.dto.DashboardSnapshot;
import com.coinbot.dto.RiskConfigRequest;
import com.coinbot.dto.SessionStatusResponse;
import com.coinbot.dto.StartSessionRequest;
import com.coinbot.dto.StrategyInfo;
import com.coinbot.model.CloseReason;
import com.coinbot.model.CompletedTrade;
import com.coinbot.model.PositionSnapshot;
import com.coinbot.model.PositionStatus;
import com.coinbot.model.RiskConfig;
import com.coinbot.service.BotStatusService;
import com.coinbot.service.exchange.ExchangeClient;
import com.coinbot.service.monitoring.exit.StopLossExitRule;
import com.coinbot.service.monitoring.exit.TakeProfitExitRule;
import com.coinbot.service.monitoring.exit.TrailingStopExitRule;
import com.coinbot.service.order.GateStatistics;
import com.coinbot.service.order.PositionBook;
import com.coinbot.service.scheduler.ScheduleEntry;
import com.coinbot.service.signal.SignalStrategy;
import com.coinbot.service.signal.StrategyFactory;
import com.coinbot.service.sink.BufferedStateSink;
import com.coinbot.service.sink.StateSnapshotStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Owns the current {@link TradingSession} and exposes the operations the REST layer needs.
 * <p>
 * The {@link PositionBook} lives as long as this service, so a new session picks up positions
 * left open or flagged for attention by the previous one.
 */
@Service
@Slf4j
public class TradingSessionService {

    private final TradingConfig tradingConfig;
    private final SchedulerConfig schedulerConfig;
    private final StrategyFactory strategyFactory;
    private final ExchangeClient exchangeClient;
    private final BufferedStateSink stateSink;
    private final StateSnapshotStore snapshotStore;
    private final BotStatusService botStatusService;
    private final Clock clock;
    private final Executor workerExecutor;
    private final Executor admissionExecutor;
    private final Executor monitorExecutor;
    private final Executor loopExecutor;
    private final TaskScheduler positionMonitorScheduler;

    private final PositionBook positionBook = new PositionBook();

    private volatile TradingSession session;
    private volatile List<String> sessionCoins = List.of();
    private volatile List<SignalStrategy> sessionStrategies = List.of();

    public TradingSessionService(TradingConfig tradingConfig,
                                 SchedulerConfig schedulerConfig,
                                 StrategyFactory strategyFactory,
                                 ExchangeClient exchangeClient,
                                 BufferedStateSink stateSink,
                                 StateSnapshotStore snapshotStore,
                                 BotStatusService botStatusService,
                                 Clock clock,
                                 @Qualifier("signalWorkerExecutor") Executor workerExecutor,
                                 @Qualifier("orderGateExecutor") Executor admissionExecutor,
                                 @Qualifier("positionMonitorExecutor") Executor monitorExecutor,
                                 @Qualifier("sessionLoopExecutor") Executor loopExecutor,
                                 @Qualifier("positionMonitorScheduler") TaskScheduler positionMonitorScheduler) {
        this.tradingConfig = tradingConfig;
        this.schedulerConfig = schedulerConfig;
        this.strategyFactory = strategyFactory;
        this.exchangeClient = exchangeClient;
        this.stateSink = stateSink;
        this.snapshotStore = snapshotStore;
        this.botStatusService = botStatusService;
        this.clock = clock;
        this.workerExecutor = workerExecutor;
        this.admissionExecutor = admissionExecutor;
        this.monitorExecutor = monitorExecutor;
        this.loopExecutor = loopExecutor;
        this.positionMonitorScheduler = positionMonitorScheduler;
    }

    /**
     * Builds and starts a new session from the current configuration.
     *
     * @throws IllegalStateException if a session is already running
     * @throws com.coinbot.exception.ConfigurationException if the risk or strategy configuration is invalid
     */
    public synchronized SessionStatusResponse start(StartSessionRequest request) {
        TradingSession current = session;
        if (current != null && current.isActive()) {
            throw new IllegalStateException("Trading session " + current.getId() + " is already running");
        }

        boolean executeOrders = request != null && request.getExecuteOrders() != null
                ? request.getExecuteOrders() : tradingConfig.isExecuteOrders();
        List<String> coins = normalizeCoins(request != null && request.getCoins() != null
                ? request.getCoins() : tradingConfig.getMonitoredCoins());
        if (coins.isEmpty()) {
            throw new IllegalArgumentException("At least one coin must be monitored");
        }

        RiskConfig risk = tradingConfig.toRiskConfig().validate();
        List<SignalStrategy> strategies = strategyFactory.createEnabledStrategies();

        TradingSession next = TradingSession.builder()
                .riskConfig(risk)
                .executeOrders(executeOrders)
                .positionBook(positionBook)
                .exchangeClient(exchangeClient)
                .stateSink(stateSink)
                .clock(clock)
                .workerExecutor(workerExecutor)
                .admissionExecutor(admissionExecutor)
                .monitorExecutor(monitorExecutor)
                .schedulerTick(Duration.ofMillis(schedulerConfig.getTickMillis()))
                .queueCapacity(schedulerConfig.getSignalQueueCapacity())
                .maxCloseRetries(schedulerConfig.getMaxCloseRetries())
                .exitRules(List.of(new StopLossExitRule(), new TakeProfitExitRule(), new TrailingStopExitRule()))
                .build();

        for (SignalStrategy strategy : strategies) {
            Duration interval = schedulerConfig.checkIntervalFor(strategy.getName());
            for (String coin : coins) {
                next.getScheduler().register(strategy, coin, interval);
            }
        }

        next.start(loopExecutor, positionMonitorScheduler,
                Duration.ofSeconds(schedulerConfig.getPositionCheckIntervalSeconds()), clock.instant());
        session = next;
        sessionCoins = coins;
        sessionStrategies = List.copyOf(strategies);
        botStatusService.markRunning();
        log.info("Session {} monitoring {} coins with {} strategies, risk {}", next.getId(), coins.size(),
                strategies.size(), risk);
        return getStatus();
    }

    /**
     * Stops the running session. Open positions stay in the book unmonitored until the next start.
     */
    public synchronized SessionStatusResponse stop() {
        TradingSession current = requireSession();
        current.stop(clock.instant());
        botStatusService.markStopped();
        return getStatus();
    }

    /**
     * Closes every open position with reason EMERGENCY and stops signal generation.
     * Position monitoring continues until {@link #stop()} so failed closes are retried.
     */
    public synchronized Map<String, Object> emergencyStop() {
        TradingSession current = requireSession();
        int closing = current.emergencyStop();
        botStatusService.markStopped();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("sessionId", current.getId());
        result.put("positionsClosing", closing);
        result.put("positionsRemaining", positionBook.allPositions().size());
        return result;
    }

    /**
     * Replaces the running session's risk snapshot. Fields not set in {@code request} keep
     * their current values.
     *
     * @throws com.coinbot.exception.ConfigurationException if the merged snapshot is invalid
     */
    public RiskConfig reload(RiskConfigRequest request) {
        TradingSession current = requireSession();
        RiskConfig merged = merge(current.currentRiskConfig(), request);
        return current.reload(merged);
    }

    static RiskConfig merge(RiskConfig base, RiskConfigRequest request) {
        if (request == null) {
            return base;
        }
        RiskConfig.RiskConfigBuilder builder = base.toBuilder();
        if (request.getMaxPositions() != null) {
            builder.maxPositions(request.getMaxPositions());
        }
        if (request.getPositionSizeUsd() != null) {
            builder.positionSizeUsd(request.getPositionSizeUsd());
        }
        if (request.getStopLossPercent() != null) {
            builder.stopLossPercent(request.getStopLossPercent());
        }
        if (request.getTakeProfitPercent() != null) {
            builder.takeProfitPercent(request.getTakeProfitPercent());
        }
        if (request.getTrailingStopPercent() != null) {
            builder.trailingStopPercent(request.getTrailingStopPercent());
        }
        if (request.getTrailingActivationPercent() != null) {
            builder.trailingActivationPercent(request.getTrailingActivationPercent());
        }
        if (request.getMinSignalStrength() != null) {
            builder.minSignalStrength(request.getMinSignalStrength());
        }
        if (request.getCooldownSeconds() != null) {
            builder.cooldownSeconds(request.getCooldownSeconds());
        }
        return builder.build();
    }

    public SessionStatusResponse getStatus() {
        TradingSession current = session;
        SessionStatusResponse.SessionStatusResponseBuilder builder = SessionStatusResponse.builder()
                .status(botStatusService.getStatus().getStatus())
                .openPositions(positionBook.countByStatus(PositionStatus.OPEN))
                .closingPositions(positionBook.countByStatus(PositionStatus.CLOSING))
                .attentionPositions(positionBook.attentionPositions().size())
                .occupiedSlots(positionBook.getOccupiedSlots());
        if (current == null) {
            return builder.riskConfig(tradingConfig.toRiskConfig())
                    .coins(List.of())
                    .strategies(List.of())
                    .admissionDecisions(Map.of())
                    .build();
        }
        return builder.sessionId(current.getId())
                .executeOrders(current.isExecuteOrders())
                .startedAt(current.getStartedAt())
                .stoppedAt(current.getStoppedAt())
                .coins(sessionCoins)
                .strategies(sessionStrategies.stream().map(SignalStrategy::getName).toList())
                .riskConfig(current.currentRiskConfig())
                .queuedSignals(current.getSignalQueue().size())
                .droppedSignals(current.getScheduler().getDroppedSignals())
                .admissionDecisions(current.getOrderGate().getStatistics().getDecisionCounts())
                .positionChecks(current.getLifecycleManager().getCheckCount())
                .skippedPositionChecks(current.getLifecycleManager().getSkippedCheckCount())
                .build();
    }

    public List<StrategyInfo> getStrategies() {
        TradingSession current = session;
        List<StrategyInfo> infos = new ArrayList<>();
        for (SignalStrategy strategy : sessionStrategies) {
            boolean enabled = current == null || current.getScheduler().isEnabled(strategy.getName());
            infos.add(new StrategyInfo(strategy.getName(), strategy.getTimeframe(), strategy.getDescription(),
                    schedulerConfig.checkIntervalFor(strategy.getName()).toSeconds(), enabled,
                    sessionCoins.size()));
        }
        return infos;
    }

    public List<ScheduleEntry.ScheduleEntryView> getScheduleEntries() {
        TradingSession current = session;
        return current == null ? List.of() : current.getScheduler().getEntries();
    }

    /**
     * @throws IllegalArgumentException if the running session has no such strategy
     */
    public void setStrategyEnabled(String strategyName, boolean enabled) {
        TradingSession current = requireSession();
        if (!current.getScheduler().setEnabled(strategyName, enabled)) {
            throw new IllegalArgumentException("Unknown strategy: " + strategyName);
        }
    }

    public List<PositionSnapshot> getPositions() {
        TradingSession current = session;
        if (current == null) {
            return List.of();
        }
        return current.getLifecycleManager().getPositions();
    }

    public List<PositionSnapshot> getAttentionPositions() {
        TradingSession current = session;
        if (current == null) {
            return List.of();
        }
        return current.getLifecycleManager().getAttentionPositions();
    }

    public List<CompletedTrade> getTrades() {
        return snapshotStore.recentTrades();
    }

    /**
     * @throws com.coinbot.exception.PositionNotFoundException if the coin has no position
     * @throws IllegalStateException if the position is not OPEN
     */
    public PositionSnapshot closePosition(String coin) {
        return requireSession().getLifecycleManager().closePosition(normalizeCoin(coin), CloseReason.MANUAL);
    }

    public PositionSnapshot acknowledgeFailure(String coin) {
        return requireSession().getLifecycleManager().acknowledgeFailure(normalizeCoin(coin));
    }

    public DashboardSnapshot getDashboard() {
        double unrealised = 0.0;
        List<PositionSnapshot> positions = getPositions();
        for (PositionSnapshot position : positions) {
            unrealised += position.getUnrealizedPnl();
        }

        TradingSession current = session;
        Map<String, Integer> tradesToday = Collections.emptyMap();
        Map<String, Long> cooldowns = Collections.emptyMap();
        if (current != null) {
            GateStatistics statistics = current.getOrderGate().getStatistics();
            tradesToday = statistics.getTradesToday();
            cooldowns = statistics.getCooldownsRemaining(current.currentRiskConfig().getCooldownSeconds());
        }

        return DashboardSnapshot.builder()
                .generatedAt(clock.instant())
                .botStatus(botStatusService.getStatus().getStatus())
                .positions(positions)
                .recentSignals(snapshotStore.recentSignals())
                .recentTrades(snapshotStore.recentTrades())
                .recentAlerts(snapshotStore.recentAlerts())
                .realisedPnl(snapshotStore.realisedPnl())
                .unrealisedPnl(unrealised)
                .tradeCount(snapshotStore.tradeCount())
                .winRatePercent(snapshotStore.winRatePercent())
                .tradesToday(tradesToday)
                .cooldowns(cooldowns)
                .sinkMetrics(stateSink.getMetrics())
                .build();
    }

    public boolean isRunning() {
        TradingSession current = session;
        return current != null && current.isActive();
    }

    @PreDestroy
    public void shutdown() {
        TradingSession current = session;
        if (current != null && current.isActive()) {
            log.info("Application shutting down, stopping session {}", current.getId());
            current.stop(clock.instant());
            botStatusService.markStopped();
        }
    }

    private TradingSession requireSession() {
        TradingSession current = session;
        if (current == null) {
            throw new IllegalStateException("No trading session has been started");
        }
        return current;
    }

    private static List<String> normalizeCoins(List<String> coins) {
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String coin : coins) {
            if (coin != null && !coin.isBlank()) {
                normalized.add(normalizeCoin(coin));
            }
        }
        return List.copyOf(normalized);
    }

    private static String normalizeCoin(String coin) {
        return coin.trim().toUpperCase(Locale.ROOT);
    }
}
