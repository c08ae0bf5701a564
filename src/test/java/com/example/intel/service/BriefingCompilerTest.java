package com.example.intel.service;

import com.example.intel.analysis.AnalysisCollaborator;
import com.example.intel.analysis.AnalysisContext;
import com.example.intel.analysis.AnalysisItem;
import com.example.intel.analysis.AnalysisOutput;
import com.example.intel.config.BriefingProperties;
import com.example.intel.exception.AnalysisTimeoutException;
import com.example.intel.exception.AnalysisUnavailableException;
import com.example.intel.exception.EmptyPortfolioException;
import com.example.intel.exception.MalformedCollaboratorOutputException;
import com.example.intel.exception.ProviderFetchException;
import com.example.intel.model.BriefingResponse;
import com.example.intel.model.Holding;
import com.example.intel.model.HoldingAnalysis;
import com.example.intel.model.MarketSnapshot;
import com.example.intel.model.NewsItem;
import com.example.intel.model.Portfolio;
import com.example.intel.model.market.QuoteData;
import com.example.intel.provider.NewsProvider;
import com.example.intel.provider.QuoteProvider;
import com.example.intel.service.cache.MarketSnapshotCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static com.example.intel.service.MarketFixtures.NOW;
import static com.example.intel.service.MarketFixtures.history;
import static com.example.intel.service.MarketFixtures.quote;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class BriefingCompilerTest {

    private QuoteProvider quotes;
    private NewsProvider news;
    private BriefingProperties props;
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        quotes = mock(QuoteProvider.class);
        news = mock(NewsProvider.class);
        props = new BriefingProperties();
        props.setProviderTimeout(Duration.ofMillis(300));
        props.setAnalysisTimeout(Duration.ofSeconds(5));

        when(quotes.quote(anyString())).thenAnswer(inv ->
                Mono.error(new ProviderFetchException(inv.getArgument(0), "No quote returned for " + inv.getArgument(0))));
        when(quotes.dailyHistory(anyString())).thenAnswer(inv -> Mono.just(history(inv.getArgument(0), 30)));
        when(news.fetch(anyString(), anyInt())).thenReturn(Mono.just(List.of()));
        when(quotes.quote("AAPL")).thenReturn(Mono.just(quote("AAPL", 180.0)));
    }

    private BriefingCompiler compiler(AnalysisCollaborator collaborator) {
        MarketSnapshotCache cache = new MarketSnapshotCache(Caffeine.newBuilder().build(), props, clock);
        SnapshotAssembler assembler = new SnapshotAssembler(quotes, news, cache, props, clock);
        return new BriefingCompiler(assembler, collaborator, props, clock);
    }

    private static Holding holding(String symbol, double qty, double avgCost, String thesis) {
        return new Holding(symbol + "-id", symbol, qty, avgCost, thesis, NOW);
    }

    private static Portfolio portfolio(Holding... holdings) {
        return new Portfolio("p-1", "Default", NOW, new ArrayList<>(List.of(holdings)));
    }

    private static AnalysisOutput output(AnalysisItem... items) {
        return new AnalysisOutput(new ArrayList<>(List.of(items)), "Book is long duration.", new ArrayList<>(List.of("Long AAPL = long China supply chain")));
    }

    @Test
    @DisplayName("AAPL 정상/TSLA 실패, 분석은 AAPL만: 두 종목 모두 응답, TSLA는 중립 대체 분석")
    void aaplAndTslaScenario() {
        AtomicReference<AnalysisContext> seen = new AtomicReference<>();
        AnalysisCollaborator collaborator = ctx -> {
            seen.set(ctx);
            return Mono.just(output(new AnalysisItem("AAPL", null, "The trade is long.", "bullish")));
        };

        BriefingResponse r = compiler(collaborator)
                .compile(portfolio(holding("AAPL", 10, 150, "Services margin"), holding("TSLA", 5, 200, null)))
                .block();

        assertNotNull(r);
        assertEquals("p-1", r.getPortfolioId());
        assertEquals(2, r.getHoldingsAnalyses().size());

        HoldingAnalysis aapl = r.getHoldingsAnalyses().get(0);
        assertEquals("AAPL", aapl.getSymbol());
        assertEquals("bullish", aapl.getSentiment());
        assertEquals("BULLISH", aapl.getSentimentLabel());
        assertEquals("Services margin", aapl.getThesis());
        assertEquals(20.0, aapl.getProfitLossPct());
        assertFalse(aapl.isPlaceholder());

        HoldingAnalysis tsla = r.getHoldingsAnalyses().get(1);
        assertEquals("TSLA", tsla.getSymbol());
        assertEquals("neutral", tsla.getSentiment());
        assertTrue(tsla.isPlaceholder());
        assertTrue(tsla.getAnalysis().startsWith("Insufficient data"));
        assertNull(tsla.getProfitLossPct());

        assertNotNull(r.getMarketSnapshot().stock("TSLA").getError());
        assertTrue(r.isMarketDataAvailable());
        assertFalse(r.getGeneratedAt().isBefore(r.getMarketSnapshot().getFetchedAt()));

        AnalysisContext ctx = seen.get();
        assertEquals(2, ctx.getHoldings().size());
        assertEquals(20.0, ctx.getHoldings().get(0).getProfitLossPct());
        assertEquals(List.of("VIX", "US_10Y_YIELD", "DXY", "CRUDE_OIL"), ctx.getMacroIndicatorNames());
    }

    @Test
    @DisplayName("보유 종목이 없으면 조회 없이 EmptyPortfolioException")
    void emptyPortfolioFailsBeforeFetch() {
        AnalysisCollaborator collaborator = mock(AnalysisCollaborator.class);
        QuoteProvider untouched = mock(QuoteProvider.class);
        NewsProvider untouchedNews = mock(NewsProvider.class);
        MarketSnapshotCache cache = new MarketSnapshotCache(Caffeine.newBuilder().build(), props, clock);
        BriefingCompiler compiler = new BriefingCompiler(
                new SnapshotAssembler(untouched, untouchedNews, cache, props, clock), collaborator, props, clock);

        StepVerifier.create(compiler.compile(portfolio()))
                .expectError(EmptyPortfolioException.class)
                .verify();

        verifyNoInteractions(untouched, untouchedNews, collaborator);
    }

    @Test
    @DisplayName("결과는 보유 순서를 따르고 포트폴리오 밖 종목/중복 결과는 버린다")
    void validatesAgainstHoldings() {
        AnalysisCollaborator collaborator = ctx -> Mono.just(output(
                new AnalysisItem("MSFT", null, "first msft", "bearish"),
                new AnalysisItem("NVDA", null, "not held", "bullish"),
                new AnalysisItem("aapl", null, "first aapl", "  "),
                new AnalysisItem("AAPL", null, "second aapl", "bearish"),
                new AnalysisItem("MSFT", null, "second msft", "bullish")));

        BriefingResponse r = compiler(collaborator)
                .compile(portfolio(holding("AAPL", 1, 100, null), holding("MSFT", 1, 100, null)))
                .block();

        List<HoldingAnalysis> a = r.getHoldingsAnalyses();
        assertEquals(List.of("AAPL", "MSFT"), a.stream().map(HoldingAnalysis::getSymbol).toList());
        assertEquals("first aapl", a.get(0).getAnalysis());
        assertEquals("neutral", a.get(0).getSentiment());
        assertEquals("first msft", a.get(1).getAnalysis());
        assertEquals("bearish", a.get(1).getSentiment());
    }

    @Test
    @DisplayName("같은 종목을 두 번 보유하면 각각 분석을 받는다")
    void duplicateHoldingsEachGetAnalysis() {
        AnalysisCollaborator collaborator = ctx ->
                Mono.just(output(new AnalysisItem("AAPL", null, "long", "high-conviction-long")));

        BriefingResponse r = compiler(collaborator)
                .compile(portfolio(holding("AAPL", 10, 150, "lot 1"), holding("AAPL", 5, 200, "lot 2")))
                .block();

        assertEquals(2, r.getHoldingsAnalyses().size());
        assertEquals("lot 1", r.getHoldingsAnalyses().get(0).getThesis());
        assertEquals(20.0, r.getHoldingsAnalyses().get(0).getProfitLossPct());
        assertEquals(-10.0, r.getHoldingsAnalyses().get(1).getProfitLossPct());
        assertEquals("HIGH CONVICTION LONG", r.getHoldingsAnalyses().get(1).getSentimentLabel());
    }

    @Test
    @DisplayName("알 수 없는 감성 태그는 그대로 전달하고 라벨은 대문자 원문")
    void unknownSentimentPassesThrough() {
        AnalysisCollaborator collaborator = ctx ->
                Mono.just(output(new AnalysisItem("AAPL", null, "spicy", "contrarian-long")));

        BriefingResponse r = compiler(collaborator).compile(portfolio(holding("AAPL", 1, 100, null))).block();

        assertEquals("contrarian-long", r.getHoldingsAnalyses().get(0).getSentiment());
        assertEquals("CONTRARIAN-LONG", r.getHoldingsAnalyses().get(0).getSentimentLabel());
    }

    @Test
    @DisplayName("시장 데이터 전체 실패여도 브리핑은 생성되고 market_data_available=false")
    void totalMarketFailureStillBriefs() {
        when(quotes.quote("AAPL")).thenReturn(Mono.error(new IllegalStateException("blocked")));
        AnalysisCollaborator collaborator = ctx ->
                Mono.just(output(new AnalysisItem("AAPL", null, "blind call", "neutral")));

        BriefingResponse r = compiler(collaborator).compile(portfolio(holding("AAPL", 1, 100, null))).block();

        assertFalse(r.isMarketDataAvailable());
        assertTrue(r.getMarketSnapshot().getStocks().isEmpty());
        assertEquals(NOW, r.getMarketSnapshot().getFetchedAt());
        assertEquals(1, r.getHoldingsAnalyses().size());
        assertNull(r.getHoldingsAnalyses().get(0).getProfitLossPct());
    }

    @Test
    @DisplayName("분석 응답 지연은 AnalysisTimeoutException")
    void analysisTimeout() {
        props.setAnalysisTimeout(Duration.ofMillis(100));
        AnalysisCollaborator collaborator = ctx -> Mono.never();

        StepVerifier.create(compiler(collaborator).compile(portfolio(holding("AAPL", 1, 100, null))))
                .expectError(AnalysisTimeoutException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void analysisFailuresPropagate() {
        AnalysisCollaborator malformed = ctx -> Mono.error(new MalformedCollaboratorOutputException("bad json", null));
        StepVerifier.create(compiler(malformed).compile(portfolio(holding("AAPL", 1, 100, null))))
                .expectError(MalformedCollaboratorOutputException.class)
                .verify();

        AnalysisCollaborator broken = ctx -> Mono.error(new IllegalStateException("socket closed"));
        StepVerifier.create(compiler(broken).compile(portfolio(holding("AAPL", 1, 100, null))))
                .expectError(AnalysisUnavailableException.class)
                .verify();

        AnalysisCollaborator silent = ctx -> Mono.empty();
        StepVerifier.create(compiler(silent).compile(portfolio(holding("AAPL", 1, 100, null))))
                .expectError(AnalysisUnavailableException.class)
                .verify();
    }

    @Test
    @DisplayName("분석 항목 목록이 null이면 모든 보유 종목에 대체 분석")
    void nullItemsBecomePlaceholders() {
        AnalysisCollaborator collaborator = ctx -> Mono.just(new AnalysisOutput(null, "s", null));

        BriefingResponse r = compiler(collaborator)
                .compile(portfolio(holding("AAPL", 1, 100, null), holding("TSLA", 1, 100, null)))
                .block();

        assertEquals(2, r.getHoldingsAnalyses().size());
        assertTrue(r.getHoldingsAnalyses().stream().allMatch(HoldingAnalysis::isPlaceholder));
        assertEquals("s", r.getPortfolioSummary());
        assertTrue(r.getRiskAlerts().isEmpty());
    }

    @Test
    @DisplayName("분석 응답 자체가 null이면 MalformedCollaboratorOutputException")
    void nullAnalysisIsMalformed() {
        AnalysisCollaborator collaborator = ctx -> null;

        StepVerifier.create(compiler(collaborator).compile(portfolio(holding("AAPL", 1, 100, null))))
                .expectError(MalformedCollaboratorOutputException.class)
                .verify();

        assertThrows(MalformedCollaboratorOutputException.class, () -> compiler(ctx -> Mono.empty())
                .validate("p-1", List.of(holding("AAPL", 1, 100, null)), MarketSnapshot.empty(NOW), null));
    }

    @Test
    @DisplayName("알 수 없는 감성 태그는 공백까지 원문 그대로")
    void unknownSentimentIsNotTrimmed() {
        AnalysisCollaborator collaborator = ctx ->
                Mono.just(output(new AnalysisItem("AAPL", null, "spicy", " contrarian-long ")));

        BriefingResponse r = compiler(collaborator).compile(portfolio(holding("AAPL", 1, 100, null))).block();

        assertEquals(" contrarian-long ", r.getHoldingsAnalyses().get(0).getSentiment());
        assertEquals("CONTRARIAN-LONG", r.getHoldingsAnalyses().get(0).getSentimentLabel());
    }

    @Test
    @DisplayName("시세는 실패하고 뉴스만 있으면 market_data_available=true")
    void newsOnlyMarksMarketDataAvailable() {
        when(quotes.quote("AAPL")).thenReturn(Mono.error(new IllegalStateException("blocked")));
        when(news.fetch("AAPL", props.getMaxNewsPerSymbol()))
                .thenReturn(Mono.just(List.of(new NewsItem("Antitrust ruling", "Reuters", "https://x/3", NOW))));
        AnalysisCollaborator collaborator = ctx ->
                Mono.just(output(new AnalysisItem("AAPL", null, "headline driven", "bearish")));

        BriefingResponse r = compiler(collaborator).compile(portfolio(holding("AAPL", 1, 100, null))).block();

        assertTrue(r.isMarketDataAvailable());
        assertEquals(1, r.getMarketSnapshot().newsFor("AAPL").size());
        assertNull(r.getHoldingsAnalyses().get(0).getProfitLossPct());
    }

    @Test
    @DisplayName("브리핑 구독 취소 시 시세 호출도 취소된다")
    void cancellingCompileCancelsQuoteCalls() {
        AtomicBoolean cancelled = new AtomicBoolean();
        when(quotes.quote("AAPL")).thenReturn(Mono.<QuoteData>never().doOnCancel(() -> cancelled.set(true)));
        AnalysisCollaborator collaborator = mock(AnalysisCollaborator.class);

        StepVerifier.create(compiler(collaborator).compile(portfolio(holding("AAPL", 1, 100, null))))
                .expectSubscription()
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertTrue(cancelled.get());
        verifyNoInteractions(collaborator);
    }
}
