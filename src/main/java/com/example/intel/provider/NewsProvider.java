package com.example.intel.provider;

import com.example.intel.model.NewsItem;
import reactor.core.publisher.Mono;

import java.util.List;

public interface NewsProvider {

    /** 종목(및 경쟁사) 관련 최근 헤드라인. 최대 max건 */
    Mono<List<NewsItem>> fetch(String symbol, int max);
}
