package com.coinbot.service.marketdata;

import com.coinbot.config.SignalConfig;
import com.coinbot.exception.FetchException;
import com.coinbot.model.Candle;
import com.coinbot.service.RateLimiterService;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BinanceMarketDataClientTest {

    private MockWebServer server;
    private BinanceMarketDataClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        OkHttpClient http = new OkHttpClient.Builder()
                .readTimeout(2, TimeUnit.SECONDS)
                .build();
        client = new BinanceMarketDataClient(http, new RateLimiterService(50, 100, 1000, 1000),
                server.url("/api/v3").toString(), "USDT");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Klines are requested with symbol, interval and limit and parsed oldest first")
    void fetchCandles() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                [[1709280000000,"62000.1","62500.0","61800.5","62400.2","123.45",1709283599999,"0",10,"0","0","0"],
                 [1709283600000,"62400.2","62600.0","62100.0","62150.0","98.7",1709287199999,"0",8,"0","0","0"]]
                """));

        List<Candle> candles = client.fetchCandles("btc", "1h", 2);

        assertEquals(2, candles.size());
        assertEquals(1709280000000L, candles.get(0).openTime());
        assertEquals(62400.2, candles.get(0).close(), 1e-9);
        assertEquals(62100.0, candles.get(1).low(), 1e-9);

        RecordedRequest request = server.takeRequest();
        assertEquals("/api/v3/klines", request.getRequestUrl().encodedPath());
        assertEquals("BTCUSDT", request.getRequestUrl().queryParameter("symbol"));
        assertEquals("1h", request.getRequestUrl().queryParameter("interval"));
        assertEquals("2", request.getRequestUrl().queryParameter("limit"));
    }

    @Test
    @DisplayName("Ticker price is parsed from its string field")
    void fetchPrice() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"symbol\":\"ETHUSDT\",\"price\":\"3412.55000000\"}"));

        assertEquals(3412.55, client.fetchPrice("ETH"), 1e-9);
        assertEquals("/api/v3/ticker/price", server.takeRequest().getRequestUrl().encodedPath());
    }

    @Test
    @DisplayName("HTTP errors and malformed payloads surface as FetchException")
    void failures() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"code\":-1003}"));
        server.enqueue(new MockResponse().setBody("{\"code\":-1121,\"msg\":\"Invalid symbol.\"}"));
        server.enqueue(new MockResponse().setBody("{\"symbol\":\"BTCUSDT\"}"));
        server.enqueue(new MockResponse().setBody("[[1709280000000,\"abc\"]]"));

        FetchException httpError = assertThrows(FetchException.class, () -> client.fetchPrice("BTC"));
        assertTrue(httpError.getMessage().contains("429"));
        assertThrows(FetchException.class, () -> client.fetchCandles("XYZ", "1h", 10));
        assertThrows(FetchException.class, () -> client.fetchPrice("BTC"));
        assertThrows(FetchException.class, () -> client.fetchCandles("BTC", "1h", 10));
    }

    @Test
    @DisplayName("Symbols are upper-cased and suffixed with the quote asset")
    void symbolMapping() {
        assertEquals("SOLUSDT", client.symbolFor("sol"));
    }

    @Test
    @DisplayName("Symbol mapping does not depend on the default locale")
    void symbolMappingIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals("SUIUSDT", client.symbolFor("sui"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("A body that trickles in is cut off by the call timeout")
    void callTimeoutBoundsSlowBody() {
        SignalConfig config = new SignalConfig();
        config.setReadTimeoutSeconds(30);
        config.setCallTimeoutSeconds(1);
        OkHttpClient http = BinanceMarketDataClient.httpClient(config);
        assertEquals(1_000, http.callTimeoutMillis());

        BinanceMarketDataClient slowClient = new BinanceMarketDataClient(http,
                new RateLimiterService(50, 100, 1000, 1000), server.url("/api/v3").toString(), "USDT");
        server.enqueue(new MockResponse()
                .setBody("{\"symbol\":\"BTCUSDT\",\"price\":\"62000.00000000\"}")
                .throttleBody(1, 200, TimeUnit.MILLISECONDS));

        long start = System.nanoTime();
        assertThrows(FetchException.class, () -> slowClient.fetchPrice("BTC"));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 5_000);
    }
}
