package com.coinbot.service.exchange;

import com.coinbot.exception.ExchangeException;
import com.coinbot.model.AccountState;
import com.coinbot.model.CloseFill;
import com.coinbot.model.OrderFill;
import com.coinbot.model.PositionSide;
import com.coinbot.model.PositionSnapshot;
import com.coinbot.service.RateLimiterService;
import com.coinbot.service.RateLimiterService.ApiType;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorator that bounds every exchange call in time and routes it through the shared rate limiter.
 * <p>
 * The delegate runs on {@code callExecutor}; the caller waits at most {@code timeout}. A timed-out
 * call is cancelled with interruption and reported as {@link ExchangeException}, so no caller
 * (and in particular no lock holder) can hang on the exchange.
 */
@Slf4j
public class TimeLimitedExchangeClient implements ExchangeClient {

    private final ExchangeClient delegate;
    private final RateLimiterService rateLimiter;
    private final Executor callExecutor;
    private final Duration timeout;

    public TimeLimitedExchangeClient(ExchangeClient delegate, RateLimiterService rateLimiter,
                                     Executor callExecutor, Duration timeout) {
        this.delegate = delegate;
        this.rateLimiter = rateLimiter;
        this.callExecutor = callExecutor;
        this.timeout = timeout;
    }

    @Override
    public OrderFill placeOrder(String coin, PositionSide side, double size) throws ExchangeException {
        return call("placeOrder " + coin, ApiType.ORDER, () -> delegate.placeOrder(coin, side, size));
    }

    @Override
    public CloseFill closePosition(PositionSnapshot position) throws ExchangeException {
        return call("closePosition " + position.getCoin(), ApiType.ORDER, () -> delegate.closePosition(position));
    }

    @Override
    public double getMarkPrice(String coin) throws ExchangeException {
        return call("getMarkPrice " + coin, ApiType.TICKER, () -> delegate.getMarkPrice(coin));
    }

    @Override
    public AccountState getAccountState() throws ExchangeException {
        return call("getAccountState", ApiType.ACCOUNT, delegate::getAccountState);
    }

    private <T> T call(String operation, ApiType apiType, Callable<T> action) throws ExchangeException {
        if (!rateLimiter.acquire(apiType, timeout.toMillis())) {
            throw new ExchangeException(operation + " rejected: rate limit exceeded for " + apiType);
        }

        FutureTask<T> task = new FutureTask<>(action);
        try {
            callExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            throw new ExchangeException(operation + " rejected: exchange call pool saturated", e);
        }

        try {
            return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Exchange call {} timed out after {}ms", operation, timeout.toMillis());
            throw new ExchangeException(operation + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExchangeException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExchangeException exchangeException) {
                throw exchangeException;
            }
            throw new ExchangeException(operation + " failed: " + cause.getMessage(), cause);
        }
    }
}
