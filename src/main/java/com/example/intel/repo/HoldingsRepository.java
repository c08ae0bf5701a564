package com.example.intel.repo;

import com.example.intel.model.Holding;
import com.example.intel.model.Portfolio;
import com.example.intel.model.portfolio.HoldingCreateRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 보유 종목 저장소. 브리핑 엔진은 조회만 하고 저장 방식은 구현체가 결정한다.
 * 존재하지 않는 포트폴리오/종목은 NotFoundException으로 알린다.
 */
public interface HoldingsRepository {

    Flux<Portfolio> listPortfolios();

    Mono<Portfolio> findPortfolio(String portfolioId);

    Mono<Portfolio> findPortfolioByName(String name);

    Mono<Portfolio> createPortfolio(String name);

    Mono<Holding> addHolding(String portfolioId, HoldingCreateRequest payload);

    Mono<Void> deleteHolding(String portfolioId, String holdingId);
}
