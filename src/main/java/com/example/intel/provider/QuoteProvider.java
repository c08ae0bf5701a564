package com.example.intel.provider;

import com.example.intel.model.market.PriceHistory;
import com.example.intel.model.market.QuoteData;
import reactor.core.publisher.Mono;

/**
 * 시세 공급자. 종목과 매크로 지표(^VIX 등) 모두 같은 방식으로 조회한다.
 * 데이터가 없거나 호출이 실패하면 ProviderFetchException 등 오류 신호를 낸다.
 */
public interface QuoteProvider {

    Mono<QuoteData> quote(String symbol);

    /** 최근 3개월 일봉 */
    Mono<PriceHistory> dailyHistory(String symbol);
}
