package com.example.intel.service.news;

import com.example.intel.model.NewsItem;
import com.example.intel.provider.NewsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 뉴스 소스를 병렬 조회해 합친다. 소스별 실패는 빈 목록으로 처리하고,
 * 제목/URL 기준 중복 제거 후 최신순으로 max건을 남긴다.
 */
@Component
public class NewsAggregator implements NewsProvider {

    private static final Logger log = LoggerFactory.getLogger(NewsAggregator.class);

    private final NewsApiAdapter newsApi;
    private final GoogleNewsAdapter google;

    public NewsAggregator(NewsApiAdapter newsApi, GoogleNewsAdapter google) {
        this.newsApi = newsApi;
        this.google = google;
    }

    @Override
    public Mono<List<NewsItem>> fetch(String symbol, int max) {
        Mono<List<NewsItem>> primary = newsApi.fetch(symbol, max).onErrorReturn(List.of());
        Mono<List<NewsItem>> rss = google.fetch(symbol, max)
                .doOnError(e -> log.debug("Google News fetch failed for {}: {}", symbol, e.toString()))
                .onErrorReturn(List.of());
        return Mono.zip(primary.defaultIfEmpty(List.of()), rss.defaultIfEmpty(List.of()))
                .map(t -> merge(List.of(t.getT1(), t.getT2()), max));
    }

    static List<NewsItem> merge(List<List<NewsItem>> sources, int max) {
        Map<String, NewsItem> unique = new LinkedHashMap<>();
        for (List<NewsItem> src : sources) {
            for (NewsItem n : src) {
                String key = (n.getUrl() != null && !n.getUrl().isBlank())
                        ? n.getUrl()
                        : n.getTitle().trim().toLowerCase(Locale.ROOT);
                unique.putIfAbsent(key, n);
            }
        }
        List<NewsItem> out = new ArrayList<>(unique.values());
        out.sort(Comparator.comparing(NewsItem::getPublishedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return out.size() > max ? new ArrayList<>(out.subList(0, max)) : out;
    }
}
