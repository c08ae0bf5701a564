package com.example.intel.service;

import com.example.intel.config.BriefingProperties;
import com.example.intel.exception.ProviderFetchException;
import com.example.intel.model.MacroIndicator;
import com.example.intel.model.MarketSnapshot;
import com.example.intel.model.NewsItem;
import com.example.intel.model.StockSnapshot;
import com.example.intel.model.market.PriceHistory;
import com.example.intel.provider.NewsProvider;
import com.example.intel.provider.QuoteProvider;
import com.example.intel.service.cache.MarketSnapshotCache;
import com.example.intel.service.cache.SnapshotKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * 종목/매크로/뉴스를 병렬 조회해 하나의 MarketSnapshot으로 묶는다.
 * 항목별 실패는 해당 항목의 error로만 남기고 전체 조립은 실패하지 않는다.
 */
@Service
public class SnapshotAssembler {

    private static final Logger log = LoggerFactory.getLogger(SnapshotAssembler.class);

    private final QuoteProvider quotes;
    private final NewsProvider news;
    private final MarketSnapshotCache cache;
    private final BriefingProperties props;
    private final Clock clock;

    public SnapshotAssembler(QuoteProvider quotes, NewsProvider news, MarketSnapshotCache cache,
                             BriefingProperties props, Clock clock) {
        this.quotes = quotes;
        this.news = news;
        this.cache = cache;
        this.props = props;
        this.clock = clock;
    }

    public Mono<MarketSnapshot> assemble(Collection<String> symbols, Map<String, String> indicators) {
        List<String> uniqueSymbols = new ArrayList<>(new LinkedHashSet<>(symbols));
        SnapshotKey key = SnapshotKey.of(uniqueSymbols, indicators);
        return Mono.defer(() -> {
            MarketSnapshot cached = cache.getFresh(key);
            if (cached != null) {
                log.debug("Snapshot cache hit {}", key);
                return Mono.just(cached);
            }
            Instant fetchedAt = Instant.now(clock);
            long t0 = System.nanoTime();
            return fetchAll(uniqueSymbols, indicators, fetchedAt)
                    .doOnNext(s -> {
                        cache.put(key, s);
                        log.debug("Snapshot assembled symbols={} indicators={} in {}ms",
                                uniqueSymbols.size(), indicators.size(), (System.nanoTime() - t0) / 1_000_000);
                    });
        });
    }

    private Mono<MarketSnapshot> fetchAll(List<String> symbols, Map<String, String> indicators, Instant fetchedAt) {
        Mono<List<StockSnapshot>> stocks = Flux.fromIterable(symbols)
                .flatMapSequential(sym -> fetchStock(sym, fetchedAt))
                .collectList();
        Mono<List<Map.Entry<String, MacroIndicator>>> macro = Flux.fromIterable(indicators.entrySet())
                .flatMapSequential(e -> fetchIndicator(e.getKey(), e.getValue())
                        .map(m -> Map.entry(e.getKey(), m)))
                .collectList();
        Mono<List<Map.Entry<String, List<NewsItem>>>> headlines = Flux.fromIterable(symbols)
                .flatMapSequential(sym -> fetchNews(sym).map(items -> Map.entry(sym, items)))
                .collectList();

        return Mono.zip(stocks, macro, headlines)
                .map(t -> build(t.getT1(), t.getT2(), t.getT3(), fetchedAt));
    }

    private static MarketSnapshot build(List<StockSnapshot> stockList,
                                        List<Map.Entry<String, MacroIndicator>> macroList,
                                        List<Map.Entry<String, List<NewsItem>>> newsList,
                                        Instant fetchedAt) {
        Map<String, StockSnapshot> stocks = new LinkedHashMap<>();
        for (StockSnapshot s : stockList) stocks.put(s.getSymbol(), s);
        Map<String, MacroIndicator> macro = new LinkedHashMap<>();
        for (Map.Entry<String, MacroIndicator> e : macroList) macro.put(e.getKey(), e.getValue());
        Map<String, List<NewsItem>> headlines = new LinkedHashMap<>();
        for (Map.Entry<String, List<NewsItem>> e : newsList) headlines.put(e.getKey(), List.copyOf(e.getValue()));
        MarketSnapshot snapshot = new MarketSnapshot(stocks, macro, headlines, fetchedAt);
        if (!snapshot.hasMarketData()) {
            log.warn("All market data fetches failed; returning empty snapshot as of {}", fetchedAt);
            return MarketSnapshot.empty(fetchedAt);
        }
        return snapshot;
    }

    private Mono<StockSnapshot> fetchStock(String symbol, Instant fetchedAt) {
        Duration timeout = props.getProviderTimeout();
        // 일봉 실패는 수익률/거래량 필드만 비운다
        Mono<Optional<PriceHistory>> history = quotes.dailyHistory(symbol)
                .timeout(timeout)
                .map(Optional::of)
                .onErrorResume(e -> {
                    log.debug("History fetch failed for {}: {}", symbol, e.toString());
                    return Mono.just(Optional.empty());
                })
                .defaultIfEmpty(Optional.empty());

        return quotes.quote(symbol)
                .timeout(timeout)
                .switchIfEmpty(Mono.error(() -> new ProviderFetchException(symbol, "No quote returned for " + symbol)))
                .zipWith(history)
                .map(t -> MetricDeriver.toStockSnapshot(symbol, t.getT1(), t.getT2().orElse(null), fetchedAt))
                .onErrorResume(e -> {
                    ProviderFetchException pfe = toFetchException(symbol, e, timeout);
                    log.warn("Quote fetch failed for {}: {}", symbol, pfe.getMessage());
                    return Mono.just(MetricDeriver.errorSnapshot(symbol, pfe.getMessage(), fetchedAt));
                });
    }

    private Mono<MacroIndicator> fetchIndicator(String name, String providerSymbol) {
        Duration timeout = props.getProviderTimeout();
        return quotes.quote(providerSymbol)
                .timeout(timeout)
                .switchIfEmpty(Mono.error(() -> new ProviderFetchException(name, "No quote returned for " + providerSymbol)))
                .map(MetricDeriver::toMacroIndicator)
                .onErrorResume(e -> {
                    ProviderFetchException pfe = toFetchException(providerSymbol, e, timeout);
                    log.warn("Macro indicator {} ({}) fetch failed: {}", name, providerSymbol, pfe.getMessage());
                    return Mono.just(MetricDeriver.errorIndicator(pfe.getMessage()));
                });
    }

    private Mono<List<NewsItem>> fetchNews(String symbol) {
        return news.fetch(symbol, props.getMaxNewsPerSymbol())
                .timeout(props.getProviderTimeout())
                .map(items -> items.size() > props.getMaxNewsPerSymbol()
                        ? items.subList(0, props.getMaxNewsPerSymbol())
                        : items)
                .onErrorResume(e -> {
                    log.debug("News fetch failed for {}: {}", symbol, e.toString());
                    return Mono.just(List.of());
                })
                .defaultIfEmpty(List.of());
    }

    static ProviderFetchException toFetchException(String key, Throwable e, Duration timeout) {
        if (e instanceof ProviderFetchException pfe) return pfe;
        if (e instanceof TimeoutException) {
            return new ProviderFetchException(key, "Timed out after " + timeout.toMillis() + "ms fetching " + key, e);
        }
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new ProviderFetchException(key, "Failed to fetch " + key + ": " + reason, e);
    }
}
