package com.example.intel.provider;

import com.example.intel.config.BriefingProperties;
import com.example.intel.exception.ProviderFetchException;
import com.example.intel.http.YahooApiClient;
import com.example.intel.model.market.PriceBar;
import com.example.intel.model.market.PriceHistory;
import com.example.intel.model.market.QuoteData;
import com.example.intel.service.cache.RedisCacheService;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.example.intel.util.JsonMaps.asList;
import static com.example.intel.util.JsonMaps.asListOfMap;
import static com.example.intel.util.JsonMaps.asMap;
import static com.example.intel.util.JsonMaps.d;
import static com.example.intel.util.JsonMaps.l;
import static com.example.intel.util.JsonMaps.s;

@Component
public class YahooQuoteProvider implements QuoteProvider {

    private static final String QUERY_SUFFIX = "&lang=en-US&region=US&corsDomain=finance.yahoo.com";

    private final YahooApiClient yahoo;
    private final RedisCacheService level2Cache;
    private final BriefingProperties props;

    public YahooQuoteProvider(YahooApiClient yahoo, RedisCacheService level2Cache, BriefingProperties props) {
        this.yahoo = yahoo;
        this.level2Cache = level2Cache;
        this.props = props;
    }

    @Override
    public Mono<QuoteData> quote(String symbol) {
        String path = "/v7/finance/quote?symbols=" + symbol + QUERY_SUFFIX;
        String cacheKey = "quote:" + symbol;
        return level2Cache.get(cacheKey, new TypeReference<QuoteData>() {})
                .switchIfEmpty(Mono.defer(() -> yahoo.getJson(path, "/quote/" + symbol)
                        .flatMap(body -> {
                            QuoteData q = mapQuote(symbol, body);
                            return q == null
                                    ? Mono.error(new ProviderFetchException(symbol, "No quote returned for " + symbol))
                                    : Mono.just(q);
                        })
                        .flatMap(q -> level2Cache.set(cacheKey, q, props.getQuoteL2Ttl()).thenReturn(q))));
    }

    @Override
    public Mono<PriceHistory> dailyHistory(String symbol) {
        String path = "/v8/finance/chart/" + symbol
                + "?range=3mo&interval=1d&includePrePost=false" + QUERY_SUFFIX;
        return yahoo.getJson(path, "/quote/" + symbol).map(body -> mapHistory(symbol, body));
    }

    static QuoteData mapQuote(String symbol, Map<String, Object> body) {
        Map<String, Object> qr = asMap(body.get("quoteResponse"));
        if (qr == null) return null;
        List<Map<String, Object>> results = asListOfMap(qr.get("result"));
        if (results == null || results.isEmpty()) return null;
        Map<String, Object> m = results.get(0);
        for (Map<String, Object> r : results) {
            if (symbol.equalsIgnoreCase(s(r.get("symbol")))) { m = r; break; }
        }
        QuoteData q = new QuoteData();
        q.setSymbol(symbol);
        Double price = d(m.get("regularMarketPrice"));
        q.setPrice(price != null ? price : d(m.get("currentPrice")));
        q.setPreviousClose(d(m.get("regularMarketPreviousClose")));
        q.setFiftyTwoWeekHigh(d(m.get("fiftyTwoWeekHigh")));
        q.setFiftyTwoWeekLow(d(m.get("fiftyTwoWeekLow")));
        q.setTrailingPe(d(m.get("trailingPE")));
        q.setForwardPe(d(m.get("forwardPE")));
        q.setMarketCap(d(m.get("marketCap")));
        return q;
    }

    static PriceHistory mapHistory(String symbol, Map<String, Object> body) {
        PriceHistory res = new PriceHistory();
        res.setSymbol(symbol);

        Map<String, Object> chart = asMap(body.get("chart"));
        List<Map<String, Object>> results = chart == null ? null : asListOfMap(chart.get("result"));
        if (results == null || results.isEmpty()) return res;
        Map<String, Object> r = results.get(0);

        List<Object> ts = asList(r.get("timestamp"));
        Map<String, Object> indicators = asMap(r.get("indicators"));
        List<Map<String, Object>> qList = indicators == null ? null : asListOfMap(indicators.get("quote"));
        Map<String, Object> q = (qList == null || qList.isEmpty()) ? null : qList.get(0);
        if (q == null || ts.isEmpty()) return res;

        List<Object> closes = asList(q.get("close"));
        List<Object> volumes = asList(q.get("volume"));
        List<PriceBar> bars = new ArrayList<>(ts.size());
        for (int i = 0; i < ts.size(); i++) {
            Long epoch = l(ts.get(i));
            bars.add(new PriceBar(
                    epoch == null ? null : Instant.ofEpochSecond(epoch),
                    i < closes.size() ? d(closes.get(i)) : null,
                    i < volumes.size() ? l(volumes.get(i)) : null));
        }
        res.setBars(bars);
        return res;
    }
}
