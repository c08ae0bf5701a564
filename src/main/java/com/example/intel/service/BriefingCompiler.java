package com.example.intel.service;

import com.example.intel.analysis.AnalysisCollaborator;
import com.example.intel.analysis.AnalysisContext;
import com.example.intel.analysis.AnalysisItem;
import com.example.intel.analysis.AnalysisOutput;
import com.example.intel.analysis.HoldingContext;
import com.example.intel.config.BriefingProperties;
import com.example.intel.exception.AnalysisException;
import com.example.intel.exception.AnalysisTimeoutException;
import com.example.intel.exception.AnalysisUnavailableException;
import com.example.intel.exception.EmptyPortfolioException;
import com.example.intel.exception.MalformedCollaboratorOutputException;
import com.example.intel.model.BriefingResponse;
import com.example.intel.model.BriefingStage;
import com.example.intel.model.Holding;
import com.example.intel.model.HoldingAnalysis;
import com.example.intel.model.MarketSnapshot;
import com.example.intel.model.Portfolio;
import com.example.intel.model.Sentiment;
import com.example.intel.model.StockSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * 보유 종목 → 시장 스냅샷 → 분석 → 검증 순으로 브리핑을 만든다.
 * 시장 데이터 실패는 흡수하고, 분석 실패만 요청 실패로 전파한다.
 */
@Service
public class BriefingCompiler {

    private static final Logger log = LoggerFactory.getLogger(BriefingCompiler.class);

    static final String PLACEHOLDER_ANALYSIS =
            "Insufficient data: no analysis was produced for this position in this briefing.";

    private final SnapshotAssembler assembler;
    private final AnalysisCollaborator collaborator;
    private final BriefingProperties props;
    private final Clock clock;

    public BriefingCompiler(SnapshotAssembler assembler, AnalysisCollaborator collaborator,
                            BriefingProperties props, Clock clock) {
        this.assembler = assembler;
        this.collaborator = collaborator;
        this.props = props;
        this.clock = clock;
    }

    public Mono<BriefingResponse> compile(Portfolio portfolio) {
        return Mono.defer(() -> {
            String portfolioId = portfolio.getId();
            List<Holding> holdings = portfolio.getHoldings() == null ? List.of() : portfolio.getHoldings();
            if (holdings.isEmpty()) {
                transition(portfolioId, BriefingStage.IDLE, BriefingStage.FAILED);
                return Mono.error(new EmptyPortfolioException(portfolioId));
            }

            List<String> symbols = new ArrayList<>(new LinkedHashSet<>(holdings.stream().map(Holding::getSymbol).toList()));
            Map<String, String> indicators = props.getMacroIndicators();
            log.info("Compiling briefing portfolio={} holdings={} symbols={}", portfolioId, holdings.size(), symbols);
            transition(portfolioId, BriefingStage.IDLE, BriefingStage.FETCHING_SNAPSHOT);

            return assembler.assemble(symbols, indicators)
                    .flatMap(snapshot -> {
                        transition(portfolioId, BriefingStage.FETCHING_SNAPSHOT, BriefingStage.AWAITING_ANALYSIS);
                        AnalysisContext context = buildContext(portfolioId, holdings, snapshot, indicators);
                        return analyze(context)
                                .doOnError(e -> transition(portfolioId, BriefingStage.AWAITING_ANALYSIS, BriefingStage.FAILED))
                                .map(output -> {
                                    transition(portfolioId, BriefingStage.AWAITING_ANALYSIS, BriefingStage.VALIDATING);
                                    BriefingResponse response = validate(portfolioId, holdings, snapshot, output);
                                    transition(portfolioId, BriefingStage.VALIDATING, BriefingStage.COMPLETE);
                                    return response;
                                });
                    })
                    .doOnSuccess(r -> log.info("Briefing complete portfolio={} analyses={} marketData={}",
                            portfolioId, r.getHoldingsAnalyses().size(), r.isMarketDataAvailable()));
        });
    }

    private Mono<AnalysisOutput> analyze(AnalysisContext context) {
        Duration timeout = props.getAnalysisTimeout();
        return Mono.defer(() -> {
                    Mono<AnalysisOutput> call = collaborator.analyze(context);
                    return call != null ? call : Mono.<AnalysisOutput>error(
                            new MalformedCollaboratorOutputException("Intelligence service returned no response", null));
                })
                .timeout(timeout)
                .switchIfEmpty(Mono.error(() -> new AnalysisUnavailableException("Intelligence service returned no analysis")))
                .onErrorMap(TimeoutException.class, e -> new AnalysisTimeoutException(timeout, e))
                .onErrorMap(e -> !(e instanceof AnalysisException),
                        e -> new AnalysisUnavailableException("Intelligence service failed: " + e.getMessage(), e));
    }

    AnalysisContext buildContext(String portfolioId, List<Holding> holdings, MarketSnapshot snapshot,
                                 Map<String, String> indicators) {
        List<HoldingContext> rows = new ArrayList<>(holdings.size());
        for (Holding h : holdings) {
            StockSnapshot s = snapshot.stock(h.getSymbol());
            rows.add(new HoldingContext(h.getSymbol(), h.getQuantity(), h.getAvgCost(), h.getThesis(), s,
                    MetricDeriver.profitLossPct(s == null ? null : s.getCurrentPrice(), h.getAvgCost())));
        }
        return new AnalysisContext(portfolioId, rows, new ArrayList<>(indicators.keySet()),
                new LinkedHashMap<>(snapshot.getMacro()), new LinkedHashMap<>(snapshot.getNews()));
    }

    /**
     * 분석 결과를 포트폴리오와 대조한다. 보유 종목마다 정확히 하나의 분석을 보유 순서대로 돌려준다.
     */
    BriefingResponse validate(String portfolioId, List<Holding> holdings, MarketSnapshot snapshot, AnalysisOutput output) {
        if (output == null) {
            throw new MalformedCollaboratorOutputException("Intelligence service returned no analysis object", null);
        }
        List<AnalysisItem> items = output.getItems() == null ? List.of() : output.getItems();
        Set<String> held = new LinkedHashSet<>();
        for (Holding h : holdings) held.add(normalize(h.getSymbol()));

        Map<String, AnalysisItem> bySymbol = new LinkedHashMap<>();
        for (AnalysisItem item : items) {
            if (item == null) continue;
            String sym = normalize(item.getSymbol());
            if (!held.contains(sym)) {
                log.debug("Discarding analysis for symbol {} not in portfolio {}", item.getSymbol(), portfolioId);
                continue;
            }
            bySymbol.putIfAbsent(sym, item);
        }

        List<HoldingAnalysis> analyses = new ArrayList<>(holdings.size());
        for (Holding h : holdings) {
            AnalysisItem item = bySymbol.get(normalize(h.getSymbol()));
            HoldingAnalysis a;
            if (item == null) {
                log.debug("No analysis for {} in portfolio {}; using placeholder", h.getSymbol(), portfolioId);
                a = new HoldingAnalysis(h.getSymbol(), h.getThesis(), PLACEHOLDER_ANALYSIS, Sentiment.NEUTRAL.tag());
                a.setPlaceholder(true);
            } else {
                String sentiment = (item.getSentiment() == null || item.getSentiment().isBlank())
                        ? Sentiment.NEUTRAL.tag()
                        : item.getSentiment();
                a = new HoldingAnalysis(h.getSymbol(), h.getThesis(), item.getAnalysis(), sentiment);
            }
            StockSnapshot s = snapshot.stock(h.getSymbol());
            a.setProfitLossPct(MetricDeriver.profitLossPct(s == null ? null : s.getCurrentPrice(), h.getAvgCost()));
            analyses.add(a);
        }

        BriefingResponse r = new BriefingResponse();
        r.setPortfolioId(portfolioId);
        r.setHoldingsAnalyses(analyses);
        r.setPortfolioSummary(output.getPortfolioSummary() == null ? "" : output.getPortfolioSummary());
        r.setRiskAlerts(output.getRiskAlerts() == null ? new ArrayList<>() : new ArrayList<>(output.getRiskAlerts()));
        r.setMarketSnapshot(snapshot);
        r.setMarketDataAvailable(snapshot.hasMarketData());
        Instant now = Instant.now(clock);
        Instant fetchedAt = snapshot.getFetchedAt();
        r.setGeneratedAt(fetchedAt != null && now.isBefore(fetchedAt) ? fetchedAt : now);
        return r;
    }

    private static String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }

    private static void transition(String portfolioId, BriefingStage from, BriefingStage to) {
        log.debug("Briefing portfolio={} {} -> {}", portfolioId, from, to);
    }
}
