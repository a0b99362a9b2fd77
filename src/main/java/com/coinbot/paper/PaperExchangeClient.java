package com.coinbot.paper;

import com.coinbot.config.PaperTradingConfig;
import com.coinbot.exception.ExchangeException;
import com.coinbot.exception.FetchException;
import com.coinbot.model.AccountState;
import com.coinbot.model.CloseFill;
import com.coinbot.model.OrderFill;
import com.coinbot.model.PositionSide;
import com.coinbot.model.PositionSnapshot;
import com.coinbot.service.exchange.ExchangeClient;
import com.coinbot.service.marketdata.MarketDataClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;

/**
 * Simulated exchange backed by live market prices.
 * <p>
 * Fills at the current price adjusted by the configured slippage, blocks notional as margin,
 * charges a proportional fee and can randomly reject orders to exercise failure paths.
 * One simulated position per coin.
 */
@Slf4j
public class PaperExchangeClient implements ExchangeClient {

    private final MarketDataClient marketData;
    private final PaperTradingConfig config;
    private final DoubleSupplier random;

    private final PaperAccount account;
    private final Map<String, PaperPosition> positions = new ConcurrentHashMap<>();
    private final AtomicLong orderSequence = new AtomicLong();

    public PaperExchangeClient(MarketDataClient marketData, PaperTradingConfig config) {
        this(marketData, config, () -> ThreadLocalRandom.current().nextDouble());
    }

    public PaperExchangeClient(MarketDataClient marketData, PaperTradingConfig config, DoubleSupplier random) {
        this.marketData = marketData;
        this.config = config;
        this.random = random;
        this.account = PaperAccount.createNew(config.getInitialBalance());
        log.info("Paper exchange initialized with balance {} (slippage {}%, fee {}%)",
                config.getInitialBalance(), config.getSlippagePercentage(), config.getFeePercentage());
    }

    @Override
    public OrderFill placeOrder(String coin, PositionSide side, double size) throws ExchangeException {
        if (size <= 0.0) {
            throw new ExchangeException("Order size must be positive, got " + size);
        }
        if (positions.containsKey(coin)) {
            throw new ExchangeException("Paper exchange already holds a position for " + coin);
        }
        simulateExecutionDelay();
        if (config.isEnableOrderRejection() && random.getAsDouble() < config.getRejectionProbability()) {
            log.warn("[PAPER] Order for {} {} rejected by simulation", side, coin);
            throw new ExchangeException("Order rejected by exchange simulation");
        }

        double marketPrice = getMarkPrice(coin);
        double fillPrice = applySlippage(marketPrice, side == PositionSide.LONG);
        double notional = fillPrice * size;
        double fee = notional * config.getFeePercentage() / 100.0;

        String orderId = nextOrderId();
        synchronized (account) {
            if (!account.hasSufficientBalance(notional + fee)) {
                throw new ExchangeException(String.format(
                        "Insufficient paper balance: required %.2f, available %.2f",
                        notional + fee, account.getAvailableBalance()));
            }
            account.blockMargin(notional);
            account.chargeFee(fee);
        }
        positions.put(coin, new PaperPosition(orderId, coin, side, fillPrice, size, notional, Instant.now()));

        log.info("[PAPER] Opened {} {} size={} at {} (market {}), orderId={}",
                side, coin, size, fillPrice, marketPrice, orderId);
        return new OrderFill(orderId, fillPrice, size);
    }

    @Override
    public CloseFill closePosition(PositionSnapshot position) throws ExchangeException {
        String coin = position.getCoin();
        PaperPosition held = positions.get(coin);
        if (held == null) {
            throw new ExchangeException("No paper position to close for " + coin);
        }
        simulateExecutionDelay();

        double marketPrice = getMarkPrice(coin);
        // Closing a LONG sells, closing a SHORT buys
        double exitPrice = applySlippage(marketPrice, held.getSide() == PositionSide.SHORT);
        double pnl = (exitPrice - held.getEntryPrice()) * held.getSize() * held.getSide().getDirectionMultiplier();
        double fee = exitPrice * held.getSize() * config.getFeePercentage() / 100.0;

        if (!positions.remove(coin, held)) {
            throw new ExchangeException("Paper position for " + coin + " was closed concurrently");
        }
        synchronized (account) {
            account.settle(held.getMargin(), pnl);
            account.chargeFee(fee);
        }

        String orderId = nextOrderId();
        log.info("[PAPER] Closed {} {} at {} (market {}), pnl={}, orderId={}",
                held.getSide(), coin, exitPrice, marketPrice, String.format("%.4f", pnl), orderId);
        return new CloseFill(orderId, exitPrice);
    }

    @Override
    public double getMarkPrice(String coin) throws ExchangeException {
        try {
            return marketData.fetchPrice(coin);
        } catch (FetchException e) {
            throw new ExchangeException("Price unavailable for " + coin + ": " + e.getMessage(), e);
        }
    }

    @Override
    public AccountState getAccountState() {
        synchronized (account) {
            return account.toAccountState();
        }
    }

    public List<String> getOpenCoins() {
        return new ArrayList<>(positions.keySet());
    }

    public PaperAccount getAccountCopy() {
        synchronized (account) {
            return account.toBuilder().build();
        }
    }

    private double applySlippage(double price, boolean buying) {
        double slippage = config.getSlippagePercentage() / 100.0;
        return buying ? price * (1.0 + slippage) : price * (1.0 - slippage);
    }

    private void simulateExecutionDelay() throws ExchangeException {
        if (!config.isEnableExecutionDelay() || config.getExecutionDelayMs() <= 0) {
            return;
        }
        try {
            Thread.sleep(config.getExecutionDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeException("Paper execution interrupted", e);
        }
    }

    private String nextOrderId() {
        return "PAPER-" + orderSequence.incrementAndGet();
    }
}
