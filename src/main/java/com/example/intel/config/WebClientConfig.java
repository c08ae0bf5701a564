package com.example.intel.config;

import com.example.intel.http.CookieStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    private static WebClient mk(String baseUrl, Duration responseTimeout) {
        HttpClient http = HttpClient.create()
                .followRedirect(true)
                .responseTimeout(responseTimeout)
                .httpResponseDecoder(h -> h
                        .maxHeaderSize(64 * 1024)
                        .maxInitialLineLength(8 * 1024));

        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
                        .build())
                .defaultHeader("User-Agent",
                        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                                + "(KHTML, like Gecko) Chrome Safari")
                .build();
    }

    private static WebClient mk(String baseUrl) {
        return mk(baseUrl, Duration.ofSeconds(12));
    }

    @Bean public WebClient yahooApiClient1() { return mk("https://query1.finance.yahoo.com"); }
    @Bean public WebClient yahooApiClient2() { return mk("https://query2.finance.yahoo.com"); }

    @Bean("browserClient")
    public WebClient browserClient() {
        return mk("https://finance.yahoo.com");
    }

    @Bean("newsApiHttp")
    public WebClient newsApiHttp() {
        return mk("https://newsapi.org", Duration.ofSeconds(10));
    }

    @Bean("googleNewsClient")
    public WebClient googleNewsClient() {
        return mk("https://news.google.com", Duration.ofSeconds(10));
    }

    // 응답 타임아웃은 briefing.analysis-timeout 보다 길어야 한다
    @Bean("anthropicHttp")
    public WebClient anthropicHttp(@Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl) {
        return mk(baseUrl, Duration.ofSeconds(180));
    }

    @Bean
    public CookieStore cookieStore() {
        return new CookieStore();
    }
}
