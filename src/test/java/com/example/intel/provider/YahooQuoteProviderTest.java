package com.example.intel.provider;

import com.example.intel.config.BriefingProperties;
import com.example.intel.exception.ProviderFetchException;
import com.example.intel.http.YahooApiClient;
import com.example.intel.model.market.PriceHistory;
import com.example.intel.model.market.QuoteData;
import com.example.intel.service.cache.RedisCacheService;
import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class YahooQuoteProviderTest {

    private YahooApiClient yahoo;
    private RedisCacheService l2;
    private YahooQuoteProvider provider;

    @BeforeEach
    void setUp() {
        yahoo = mock(YahooApiClient.class);
        l2 = mock(RedisCacheService.class);
        provider = new YahooQuoteProvider(yahoo, l2, new BriefingProperties());
        when(l2.get(anyString(), any())).thenReturn(Mono.empty());
        when(l2.set(anyString(), any(), any())).thenReturn(Mono.just(true));
    }

    private static Map<String, Object> quoteBody(Map<String, Object> row) {
        return Map.of("quoteResponse", Map.of("result", List.of(row)));
    }

    @Test
    @DisplayName("v7 quote 응답 매핑: raw 객체와 숫자 모두 허용")
    void mapsQuote() {
        Map<String, Object> row = new HashMap<>();
        row.put("symbol", "AAPL");
        row.put("regularMarketPrice", 180.5);
        row.put("regularMarketPreviousClose", Map.of("raw", 178.0, "fmt", "178.00"));
        row.put("fiftyTwoWeekHigh", 199.62);
        row.put("fiftyTwoWeekLow", 164.08);
        row.put("trailingPE", 29.1);
        row.put("marketCap", 2_800_000_000_000L);

        QuoteData q = YahooQuoteProvider.mapQuote("AAPL", quoteBody(row));

        assertEquals(180.5, q.getPrice());
        assertEquals(178.0, q.getPreviousClose());
        assertEquals(29.1, q.getTrailingPe());
        assertNull(q.getForwardPe());
        assertEquals(2.8e12, q.getMarketCap());
        assertNull(YahooQuoteProvider.mapQuote("AAPL", Map.of("quoteResponse", Map.of("result", List.of()))));
    }

    @Test
    @DisplayName("v8 chart 응답 매핑: null 종가는 시계열에서 제외")
    void mapsHistory() {
        Map<String, Object> quote = new HashMap<>();
        quote.put("close", Arrays.asList(100.0, null, 110.0));
        quote.put("volume", Arrays.asList(1000, 2000, null));
        Map<String, Object> body = Map.of("chart", Map.of("result", List.of(Map.of(
                "timestamp", List.of(1767571200, 1767657600, 1767744000),
                "indicators", Map.of("quote", List.of(quote))))));

        PriceHistory h = YahooQuoteProvider.mapHistory("AAPL", body);

        assertEquals(3, h.getBars().size());
        assertEquals(Instant.ofEpochSecond(1767571200), h.getBars().get(0).getTime());
        assertEquals(List.of(100.0, 110.0), h.closes());
        assertEquals(List.of(1000L, 2000L), h.volumes());
        assertTrue(YahooQuoteProvider.mapHistory("AAPL", Map.of()).getBars().isEmpty());
    }

    @Test
    void quoteFetchesAndStoresInL2() {
        Map<String, Object> row = Map.of("symbol", "^VIX", "regularMarketPrice", 15.2);
        when(yahoo.getJson(anyString(), anyString())).thenReturn(Mono.just(quoteBody(row)));

        StepVerifier.create(provider.quote("^VIX"))
                .assertNext(q -> assertEquals(15.2, q.getPrice()))
                .verifyComplete();

        verify(l2).set(eq("quote:^VIX"), any(QuoteData.class), any());
    }

    @Test
    @DisplayName("L2 캐시 적중 시 Yahoo를 호출하지 않는다")
    void quoteServedFromL2() {
        QuoteData cached = new QuoteData();
        cached.setSymbol("AAPL");
        cached.setPrice(181.0);
        when(l2.get(eq("quote:AAPL"), any(TypeReference.class))).thenReturn(Mono.just(cached));

        StepVerifier.create(provider.quote("AAPL"))
                .assertNext(q -> assertEquals(181.0, q.getPrice()))
                .verifyComplete();

        verify(yahoo, never()).getJson(anyString(), anyString());
    }

    @Test
    void emptyQuoteResultIsFetchError() {
        when(yahoo.getJson(anyString(), anyString()))
                .thenReturn(Mono.just(Map.of("quoteResponse", Map.of("result", List.of()))));

        StepVerifier.create(provider.quote("NOPE"))
                .expectError(ProviderFetchException.class)
                .verify();
    }
}
