package com.example.intel;

import com.example.intel.exception.AnalysisTimeoutException;
import com.example.intel.exception.AnalysisUnavailableException;
import com.example.intel.exception.EmptyPortfolioException;
import com.example.intel.exception.NotFoundException;
import com.example.intel.model.BriefingResponse;
import com.example.intel.model.HoldingAnalysis;
import com.example.intel.model.MarketSnapshot;
import com.example.intel.service.PortfolioService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;

@WebFluxTest(controllers = BriefingController.class)
class BriefingControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    PortfolioService portfolioService;

    private WebTestClient.ResponseSpec post(String body) {
        return webTestClient.post().uri("/briefing")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    @Test
    @DisplayName("브리핑 응답은 snake_case, null 값도 키로 포함")
    void briefingOk() {
        Instant at = Instant.parse("2026-01-05T15:00:00Z");
        HoldingAnalysis a = new HoldingAnalysis("AAPL", null, "The trade is long.", "bullish");
        a.setProfitLossPct(20.0);
        BriefingResponse r = new BriefingResponse();
        r.setPortfolioId("p-1");
        r.setGeneratedAt(at);
        r.setHoldingsAnalyses(List.of(a));
        r.setPortfolioSummary("summary");
        r.setRiskAlerts(List.of("alert"));
        r.setMarketSnapshot(new MarketSnapshot(Map.of(), Map.of(), Map.of(), at));
        when(portfolioService.briefing("p-1")).thenReturn(Mono.just(r));

        post("{\"portfolio_id\":\"p-1\"}")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.portfolio_id").isEqualTo("p-1")
                .jsonPath("$.generated_at").isEqualTo("2026-01-05T15:00:00Z")
                .jsonPath("$.holdings_analyses[0].symbol").isEqualTo("AAPL")
                .jsonPath("$.holdings_analyses[0].sentiment_label").isEqualTo("BULLISH")
                .jsonPath("$.holdings_analyses[0].profit_loss_pct").isEqualTo(20.0)
                .jsonPath("$.market_snapshot.fetched_at").isEqualTo("2026-01-05T15:00:00Z")
                .jsonPath("$.market_data_available").isEqualTo(false);
    }

    @Test
    void missingPortfolioIdIsBadRequest() {
        post("{}")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.scope").isEqualTo("request");
    }

    @Test
    void unknownPortfolioIsNotFound() {
        when(portfolioService.briefing("nope")).thenReturn(Mono.error(new NotFoundException("Portfolio not found: nope")));

        post("{\"portfolio_id\":\"nope\"}")
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.scope").isEqualTo("holdings")
                .jsonPath("$.message").isEqualTo("Portfolio not found: nope");
    }

    @Test
    void emptyPortfolioIsBadRequest() {
        when(portfolioService.briefing("p-empty")).thenReturn(Mono.error(new EmptyPortfolioException("p-empty")));

        post("{\"portfolio_id\":\"p-empty\"}")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.scope").isEqualTo("holdings")
                .jsonPath("$.message").isEqualTo("Portfolio has no holdings to analyze");
    }

    @Test
    @DisplayName("분석 실패는 scope=analysis, 타임아웃 504 / 그 외 502")
    void analysisFailures() {
        when(portfolioService.briefing("slow"))
                .thenReturn(Mono.error(new AnalysisTimeoutException(Duration.ofSeconds(120), null)));
        when(portfolioService.briefing("down"))
                .thenReturn(Mono.error(new AnalysisUnavailableException("Intelligence service returned HTTP 529")));

        post("{\"portfolio_id\":\"slow\"}")
                .expectStatus().isEqualTo(504)
                .expectBody().jsonPath("$.scope").isEqualTo("analysis");
        post("{\"portfolio_id\":\"down\"}")
                .expectStatus().isEqualTo(502)
                .expectBody().jsonPath("$.scope").isEqualTo("analysis");
    }
}
