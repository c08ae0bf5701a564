package com.example.intel.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Yahoo Finance 비공식 JSON API 호출기.
 * 쿠키 워밍업 → crumb 발급 → query2 호출, 401/403이면 crumb을 갱신해 query1로 한 번 더 시도한다.
 */
@Component
public class YahooApiClient {

    private static final Logger log = LoggerFactory.getLogger(YahooApiClient.class);
    private static final String ORIGIN = "https://finance.yahoo.com";

    private final WebClient primary;   // query2
    private final WebClient secondary; // query1
    private final WebClient browserClient;
    private final CookieStore cookieStore;

    private volatile String crumb;

    public YahooApiClient(@Qualifier("yahooApiClient2") WebClient primary,
                          @Qualifier("yahooApiClient1") WebClient secondary,
                          @Qualifier("browserClient") WebClient browserClient,
                          CookieStore cookieStore) {
        this.primary = primary;
        this.secondary = secondary;
        this.browserClient = browserClient;
        this.cookieStore = cookieStore;
    }

    public Mono<Map<String, Object>> getJson(String path, String refererPath) {
        long started = System.nanoTime();
        return warmup(refererPath)
                .then(ensureCrumb().defaultIfEmpty(""))
                .flatMap(c1 -> doRequestJson(primary, attachCrumb(path, c1), refererPath))
                .onErrorResume(this::isBlocked, e ->
                        Mono.delay(Duration.ofMillis(250))
                                .then(Mono.fromRunnable(this::invalidateSession))
                                .then(warmup(refererPath))
                                .then(ensureCrumb().defaultIfEmpty(""))
                                .flatMap(c2 -> doRequestJson(secondary, attachCrumb(path, c2), refererPath)))
                .doOnSuccess(r -> log.debug("Yahoo GET {} took {} ms", path, (System.nanoTime() - started) / 1_000_000))
                .doOnError(err -> log.warn("Yahoo GET {} failed after {} ms: {}", path, (System.nanoTime() - started) / 1_000_000, err.toString()));
    }

    private Mono<Void> warmup(String refererPath) {
        if (!cookieStore.isEmpty()) return Mono.empty();
        String uri = (refererPath == null || refererPath.isBlank()) ? "/" : refererPath;
        return browserClient.get().uri(uri)
                .accept(MediaType.TEXT_HTML)
                .exchangeToMono(resp -> {
                    cookieStore.absorb(resp.headers().header("Set-Cookie"));
                    return resp.releaseBody();
                })
                .onErrorResume(e -> {
                    log.debug("Yahoo cookie warmup failed: {}", e.toString());
                    return Mono.empty();
                });
    }

    private Mono<Map<String, Object>> doRequestJson(WebClient client, String path, String refererPath) {
        return client.get().uri(path)
                .accept(MediaType.APPLICATION_JSON)
                .headers(h -> {
                    h.set("Accept-Language", "en-US,en;q=0.9");
                    h.set("Origin", ORIGIN);
                    if (refererPath != null && !refererPath.isBlank()) {
                        h.set("Referer", ORIGIN + refererPath);
                    }
                    String cookie = cookieStore.asCookieHeader();
                    if (!cookie.isBlank()) h.set("Cookie", cookie);
                })
                .exchangeToMono(this::handleJson);
    }

    private Mono<Map<String, Object>> handleJson(ClientResponse resp) {
        int code = resp.statusCode().value();
        if (code == 401 || code == 403) {
            return resp.releaseBody().then(Mono.error(new YahooBlockedException(code)));
        }
        if (code >= 400) {
            return resp.releaseBody().then(Mono.error(new IllegalStateException("Yahoo HTTP " + code)));
        }
        String ct = resp.headers().contentType().map(MediaType::toString).orElse("<none>");
        if (!ct.contains("json")) {
            return resp.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMap(body -> {
                        String preview = body.length() > 256 ? body.substring(0, 256) + "..." : body;
                        log.warn("Yahoo non-JSON response: contentType={}, preview={}",
                                ct, preview.replace('\n', ' ').replace('\r', ' '));
                        return Mono.error(new IllegalStateException("Yahoo returned non-JSON (" + ct + ")"));
                    });
        }
        return resp.bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {});
    }

    private Mono<String> ensureCrumb() {
        String c = crumb;
        if (c != null && !c.isBlank()) return Mono.just(c);
        return tryGetCrumb(primary)
                .onErrorResume(e -> tryGetCrumb(secondary))
                .doOnNext(v -> this.crumb = v)
                .onErrorResume(e -> {
                    log.debug("Yahoo crumb unavailable: {}", e.toString());
                    return Mono.empty();
                });
    }

    private void invalidateSession() {
        this.crumb = null;
        cookieStore.clear();
    }

    private static String attachCrumb(String path, String c) {
        if (c == null || c.isBlank()) return path;
        return path + (path.contains("?") ? "&" : "?") + "crumb=" + c;
    }

    private Mono<String> tryGetCrumb(WebClient client) {
        return client.get().uri("/v1/test/getcrumb")
                .accept(MediaType.TEXT_PLAIN)
                .headers(h -> {
                    h.set("Origin", ORIGIN);
                    h.set("Referer", ORIGIN + "/");
                    String cookie = cookieStore.asCookieHeader();
                    if (!cookie.isBlank()) h.set("Cookie", cookie);
                })
                .exchangeToMono(resp -> {
                    int code = resp.statusCode().value();
                    if (code >= 400) {
                        return resp.releaseBody().then(Mono.error(new IllegalStateException("crumb fetch failed (" + code + ")")));
                    }
                    return resp.bodyToMono(String.class).map(String::trim).filter(s -> !s.isBlank());
                });
    }

    private boolean isBlocked(Throwable e) {
        if (e instanceof YahooBlockedException) return true;
        if (e instanceof WebClientResponseException w) {
            int s = w.getStatusCode().value();
            return s == 401 || s == 403;
        }
        return false;
    }

    static final class YahooBlockedException extends RuntimeException {
        YahooBlockedException(int status) {
            super("Yahoo blocked (" + status + ")");
        }
    }
}
