package com.example.intel.service.news;

import com.example.intel.model.NewsItem;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/** Google News RSS 검색. API 키가 필요 없어 NewsAPI 미설정 환경의 기본 소스가 된다. */
@Component
public class GoogleNewsAdapter {
    private final WebClient googleNewsClient;

    public GoogleNewsAdapter(@Qualifier("googleNewsClient") WebClient googleNewsClient) {
        this.googleNewsClient = googleNewsClient;
    }

    public Mono<List<NewsItem>> fetch(String symbol, int count) {
        int c = (count <= 0 || count > 50) ? 10 : count;
        String q = CompetitorDirectory.searchQuery(symbol, 3) + " stock";
        return googleNewsClient.get()
                .uri(b -> b.path("/rss/search")
                        .queryParam("q", "{q}")
                        .queryParam("hl", "en-US")
                        .queryParam("gl", "US")
                        .queryParam("ceid", "US:en")
                        .build(q))
                .retrieve()
                .bodyToMono(String.class)
                .map(RssParser::parse)
                .map(items -> items.size() > c ? items.subList(0, c) : items);
    }
}
