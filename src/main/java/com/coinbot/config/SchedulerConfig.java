package com.coinbot.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scheduler Configuration
 * Loop cadences, per-strategy check intervals and the thread pools the engine runs on.
 * <p>
 * Pools that feed CompletableFuture chains or track in-flight flags use the default abort
 * policy, so a rejected task surfaces as an exception the caller can clean up after.
 */
@Configuration
@ConfigurationProperties(prefix = "scheduler")
@Data
@Slf4j
public class SchedulerConfig {

    // Control loop wake-up period
    private long tickMillis = 1000;

    // Position monitoring cadence
    private long positionCheckIntervalSeconds = 3;

    /**
     * Check interval per strategy name, in seconds. Strategies not listed here fall
     * back to {@link #defaultCheckIntervalSeconds}.
     */
    private Map<String, Long> checkIntervals = new LinkedHashMap<>(Map.of(
            "rsi_1min", 60L,
            "rsi_5min", 300L,
            "rsi_1h", 3600L,
            "rsi_4h", 14400L,
            "sma_5min", 300L,
            "macd_15min", 900L,
            "range_24h_low", 1800L
    ));
    private long defaultCheckIntervalSeconds = 300;

    private int signalQueueCapacity = 500;

    // Pool sizes
    private int workerPoolSize = 8;
    private int admissionPoolSize = 4;
    private int monitorPoolSize = 4;

    // Exchange call bounds
    private long callTimeoutSeconds = 10;
    private int maxCloseRetries = 5;

    public Duration checkIntervalFor(String strategyName) {
        Long seconds = checkIntervals.get(strategyName);
        return Duration.ofSeconds(seconds != null ? seconds : defaultCheckIntervalSeconds);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "signalWorkerExecutor")
    public ThreadPoolTaskExecutor signalWorkerExecutor() {
        return buildExecutor("signal-worker-", workerPoolSize, workerPoolSize * 2, 1000);
    }

    @Bean(name = "orderGateExecutor")
    public ThreadPoolTaskExecutor orderGateExecutor() {
        return buildExecutor("order-gate-", admissionPoolSize, admissionPoolSize, signalQueueCapacity * 2);
    }

    @Bean(name = "positionMonitorExecutor")
    public ThreadPoolTaskExecutor positionMonitorExecutor() {
        return buildExecutor("position-monitor-", monitorPoolSize, monitorPoolSize * 2, 500);
    }

    @Bean(name = "exchangeCallExecutor")
    public ThreadPoolTaskExecutor exchangeCallExecutor() {
        return buildExecutor("exchange-call-", 4, 16, 200);
    }

    /**
     * Hosts the long-running scheduler loop and the signal dispatcher loop.
     */
    @Bean(name = "sessionLoopExecutor")
    public ThreadPoolTaskExecutor sessionLoopExecutor() {
        return buildExecutor("session-loop-", 2, 4, 0);
    }

    @Bean(name = "positionMonitorScheduler")
    public TaskScheduler positionMonitorScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("position-tick-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor buildExecutor(String prefix, int core, int max, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(Math.max(core, max));
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);
        executor.initialize();
        log.info("Executor {} initialized: core={}, max={}, queue={}",
                prefix, executor.getCorePoolSize(), executor.getMaxPoolSize(), queueCapacity);
        return executor;
    }
}
