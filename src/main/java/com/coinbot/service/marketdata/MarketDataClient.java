package com.coinbot.service.marketdata;

import com.coinbot.exception.FetchException;
import com.coinbot.model.Candle;

import java.util.List;

/**
 * Read-only market data used by the signal strategies and the paper exchange.
 */
public interface MarketDataClient {

    /**
     * Most recent candles for {@code coin}, oldest first.
     *
     * @param interval exchange interval code, e.g. "1m", "1h", "4h"
     */
    List<Candle> fetchCandles(String coin, String interval, int limit) throws FetchException;

    double fetchPrice(String coin) throws FetchException;
}
