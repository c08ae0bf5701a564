package com.example.intel.service;

import com.example.intel.model.BriefingResponse;
import com.example.intel.model.Holding;
import com.example.intel.model.Portfolio;
import com.example.intel.model.portfolio.HoldingCreateRequest;
import com.example.intel.repo.HoldingsRepository;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
public class PortfolioService {

    private final HoldingsRepository holdings;
    private final BriefingCompiler compiler;

    public PortfolioService(HoldingsRepository holdings, BriefingCompiler compiler) {
        this.holdings = holdings;
        this.compiler = compiler;
    }

    public Flux<Portfolio> list() {
        return holdings.listPortfolios();
    }

    public Mono<Portfolio> get(String portfolioId) {
        return holdings.findPortfolio(portfolioId);
    }

    public Mono<Portfolio> create(String name) {
        return holdings.createPortfolio(name.trim());
    }

    public Mono<Holding> addHolding(String portfolioId, HoldingCreateRequest payload) {
        return holdings.addHolding(portfolioId, payload);
    }

    public Mono<Void> deleteHolding(String portfolioId, String holdingId) {
        return holdings.deleteHolding(portfolioId, holdingId);
    }

    /** 포트폴리오를 읽어 브리핑을 생성한다. 없는 ID면 NotFoundException */
    public Mono<BriefingResponse> briefing(String portfolioId) {
        return holdings.findPortfolio(portfolioId).flatMap(compiler::compile);
    }
}
