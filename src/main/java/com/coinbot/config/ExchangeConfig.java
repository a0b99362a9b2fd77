package com.coinbot.config;

import com.coinbot.paper.PaperExchangeClient;
import com.coinbot.service.RateLimiterService;
import com.coinbot.service.exchange.ExchangeClient;
import com.coinbot.service.exchange.TimeLimitedExchangeClient;
import com.coinbot.service.marketdata.MarketDataClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;

/**
 * Wires the exchange client the engine talks to. Only the simulated exchange is bound;
 * it is always wrapped with the timeout and rate-limit decorator.
 */
@Configuration
@Slf4j
public class ExchangeConfig {

    @Bean
    public PaperExchangeClient paperExchangeClient(MarketDataClient marketDataClient,
                                                   PaperTradingConfig paperTradingConfig) {
        return new PaperExchangeClient(marketDataClient, paperTradingConfig);
    }

    @Bean
    @Primary
    public ExchangeClient exchangeClient(PaperExchangeClient paperExchangeClient,
                                         RateLimiterService rateLimiterService,
                                         @Qualifier("exchangeCallExecutor") ThreadPoolTaskExecutor exchangeCallExecutor,
                                         SchedulerConfig schedulerConfig) {
        Duration timeout = Duration.ofSeconds(schedulerConfig.getCallTimeoutSeconds());
        log.info("Exchange client: paper exchange with {}s call timeout", timeout.toSeconds());
        return new TimeLimitedExchangeClient(paperExchangeClient, rateLimiterService, exchangeCallExecutor, timeout);
    }
}
