package com.example.intel.service.news;

import com.example.intel.model.NewsItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.example.intel.util.JsonMaps.asListOfMap;
import static com.example.intel.util.JsonMaps.asMap;
import static com.example.intel.util.JsonMaps.s;

/** NewsAPI.org /v2/everything. 키가 없으면 호출하지 않는다. */
@Component
public class NewsApiAdapter {

    private static final Logger log = LoggerFactory.getLogger(NewsApiAdapter.class);

    private final WebClient http;
    private final String apiKey;

    public NewsApiAdapter(@Qualifier("newsApiHttp") WebClient http,
                          @Value("${newsapi.api-key:}") String apiKey) {
        this.http = http;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean isEnabled() { return !apiKey.isBlank(); }

    public Mono<List<NewsItem>> fetch(String symbol, int count) {
        if (!isEnabled()) return Mono.just(List.of());
        String query = CompetitorDirectory.searchQuery(symbol, 5);
        return http.get()
                .uri(b -> b.path("/v2/everything")
                        .queryParam("q", "{q}")
                        .queryParam("sortBy", "publishedAt")
                        .queryParam("pageSize", count)
                        .queryParam("language", "en")
                        .build(query))
                .header("X-Api-Key", apiKey)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .map(NewsApiAdapter::mapArticles)
                .doOnError(e -> log.warn("NewsAPI fetch failed for {}: {}", symbol, e.toString()));
    }

    static List<NewsItem> mapArticles(Map<String, Object> body) {
        List<Map<String, Object>> articles = asListOfMap(body.get("articles"));
        if (articles == null) return List.of();
        List<NewsItem> out = new ArrayList<>(articles.size());
        for (Map<String, Object> a : articles) {
            String title = s(a.get("title"));
            if (title == null || title.isBlank()) continue;
            Map<String, Object> src = asMap(a.get("source"));
            String source = (src == null || src.get("name") == null) ? "" : s(src.get("name"));
            String url = a.get("url") == null ? "" : s(a.get("url"));
            out.add(new NewsItem(title, source, url, parseInstant(s(a.get("publishedAt")))));
        }
        return out;
    }

    private static Instant parseInstant(String v) {
        if (v == null || v.isBlank()) return null;
        try {
            return Instant.parse(v);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
