package com.coinbot.service.marketdata;

import com.coinbot.config.SignalConfig;
import com.coinbot.exception.FetchException;
import com.coinbot.model.Candle;
import com.coinbot.service.RateLimiterService;
import com.coinbot.service.RateLimiterService.ApiType;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Public Binance REST client for klines and ticker prices. No authentication required.
 * <p>
 * Every request passes through the shared {@link RateLimiterService}; HTTP, parse and
 * rate-limit failures all surface as {@link FetchException}.
 */
@Component
@Slf4j
public class BinanceMarketDataClient implements MarketDataClient {

    private static final int MAX_KLINES_PER_REQUEST = 1000;

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final RateLimiterService rateLimiter;
    private final HttpUrl baseUrl;
    private final String quoteAsset;

    @Autowired
    public BinanceMarketDataClient(SignalConfig signalConfig, RateLimiterService rateLimiter) {
        this(httpClient(signalConfig), rateLimiter, signalConfig.getMarketDataBaseUrl(),
                signalConfig.getQuoteAsset());
    }

    public BinanceMarketDataClient(OkHttpClient client, RateLimiterService rateLimiter,
                                   String baseUrl, String quoteAsset) {
        this.client = client;
        this.rateLimiter = rateLimiter;
        this.baseUrl = HttpUrl.get(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
        this.quoteAsset = quoteAsset;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    static OkHttpClient httpClient(SignalConfig signalConfig) {
        return new OkHttpClient.Builder()
                .connectionPool(new ConnectionPool(5, 5, TimeUnit.MINUTES))
                .connectTimeout(signalConfig.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(signalConfig.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .callTimeout(signalConfig.getCallTimeoutSeconds(), TimeUnit.SECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }

    @Override
    public List<Candle> fetchCandles(String coin, String interval, int limit) throws FetchException {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("klines")
                .addQueryParameter("symbol", symbolFor(coin))
                .addQueryParameter("interval", interval)
                .addQueryParameter("limit", String.valueOf(Math.min(limit, MAX_KLINES_PER_REQUEST)))
                .build();

        JsonNode root = get(url, ApiType.KLINES);
        if (!root.isArray()) {
            throw new FetchException("Unexpected klines payload for " + coin + ": " + root.getNodeType());
        }

        List<Candle> candles = new ArrayList<>(root.size());
        try {
            for (JsonNode kline : root) {
                // [openTime, open, high, low, close, volume, closeTime, ...]
                candles.add(new Candle(
                        kline.get(0).asLong(),
                        Double.parseDouble(kline.get(1).asText()),
                        Double.parseDouble(kline.get(2).asText()),
                        Double.parseDouble(kline.get(3).asText()),
                        Double.parseDouble(kline.get(4).asText()),
                        Double.parseDouble(kline.get(5).asText())));
            }
        } catch (RuntimeException e) {
            throw new FetchException("Malformed kline for " + coin + ": " + e.getMessage(), e);
        }
        return candles;
    }

    @Override
    public double fetchPrice(String coin) throws FetchException {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("ticker")
                .addPathSegment("price")
                .addQueryParameter("symbol", symbolFor(coin))
                .build();

        JsonNode root = get(url, ApiType.TICKER);
        JsonNode price = root.get("price");
        if (price == null) {
            throw new FetchException("Ticker response for " + coin + " has no price");
        }
        try {
            double value = Double.parseDouble(price.asText());
            if (value <= 0.0) {
                throw new FetchException("Non-positive price " + value + " for " + coin);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new FetchException("Unparseable price for " + coin + ": " + price.asText(), e);
        }
    }

    String symbolFor(String coin) {
        return coin.trim().toUpperCase(Locale.ROOT) + quoteAsset;
    }

    private JsonNode get(HttpUrl url, ApiType apiType) throws FetchException {
        if (!rateLimiter.acquire(apiType)) {
            throw new FetchException("Rate limit exceeded for " + apiType);
        }

        Request request = new Request.Builder().url(url).get().build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new FetchException("Binance API error: " + response.code() + " " + response.message()
                        + " for " + url.encodedPath());
            }
            return mapper.readTree(body.string());
        } catch (IOException e) {
            log.debug("Request to {} failed: {}", url.encodedPath(), e.getMessage());
            throw new FetchException("Request to " + url.encodedPath() + " failed: " + e.getMessage(), e);
        }
    }
}
