package com.example.intel.repo;

import com.example.intel.exception.NotFoundException;
import com.example.intel.model.Holding;
import com.example.intel.model.Portfolio;
import com.example.intel.model.doc.HoldingDoc;
import com.example.intel.model.doc.PortfolioDoc;
import com.example.intel.model.portfolio.HoldingCreateRequest;
import org.bson.Document;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Repository
public class MongoHoldingsRepository implements HoldingsRepository {

    private final PortfolioDocRepository portfolios;
    private final ReactiveMongoTemplate mongo;
    private final Clock clock;

    public MongoHoldingsRepository(PortfolioDocRepository portfolios, ReactiveMongoTemplate mongo, Clock clock) {
        this.portfolios = portfolios;
        this.mongo = mongo;
        this.clock = clock;
    }

    @Override
    public Flux<Portfolio> listPortfolios() {
        return portfolios.findAllByOrderByCreatedAtAsc().map(MongoHoldingsRepository::toModel);
    }

    @Override
    public Mono<Portfolio> findPortfolio(String portfolioId) {
        return portfolios.findById(portfolioId)
                .switchIfEmpty(Mono.error(new NotFoundException("Portfolio not found: " + portfolioId)))
                .map(MongoHoldingsRepository::toModel);
    }

    @Override
    public Mono<Portfolio> findPortfolioByName(String name) {
        return portfolios.findFirstByName(name).map(MongoHoldingsRepository::toModel);
    }

    @Override
    public Mono<Portfolio> createPortfolio(String name) {
        PortfolioDoc doc = new PortfolioDoc();
        doc.setId(UUID.randomUUID().toString());
        doc.setName(name.trim());
        doc.setCreatedAt(Instant.now(clock));
        return portfolios.save(doc).map(MongoHoldingsRepository::toModel);
    }

    @Override
    public Mono<Holding> addHolding(String portfolioId, HoldingCreateRequest payload) {
        HoldingDoc h = new HoldingDoc();
        h.setHoldingId(UUID.randomUUID().toString());
        h.setSymbol(payload.getSymbol().trim().toUpperCase(Locale.ROOT));
        h.setQuantity(payload.getQuantity());
        h.setAvgCost(payload.getAvgCost());
        h.setThesis(payload.getThesis());
        h.setUpdatedAt(Instant.now(clock));
        // 단일 $push 갱신
        Query q = Query.query(Criteria.where("_id").is(portfolioId));
        return mongo.updateFirst(q, new Update().push("holdings", h), PortfolioDoc.class)
                .flatMap(res -> res.getMatchedCount() == 0
                        ? Mono.error(new NotFoundException("Portfolio not found: " + portfolioId))
                        : Mono.just(toModel(h)));
    }

    @Override
    public Mono<Void> deleteHolding(String portfolioId, String holdingId) {
        Query q = Query.query(Criteria.where("_id").is(portfolioId).and("holdings.holdingId").is(holdingId));
        Update pull = new Update().pull("holdings", new Document("holdingId", holdingId));
        return mongo.updateFirst(q, pull, PortfolioDoc.class)
                .flatMap(res -> res.getModifiedCount() == 0
                        ? Mono.error(new NotFoundException("Holding not found: " + holdingId))
                        : Mono.empty());
    }

    static Portfolio toModel(PortfolioDoc doc) {
        List<Holding> holdings = new ArrayList<>();
        if (doc.getHoldings() != null) {
            for (HoldingDoc h : doc.getHoldings()) holdings.add(toModel(h));
        }
        return new Portfolio(doc.getId(), doc.getName(), doc.getCreatedAt(), holdings);
    }

    static Holding toModel(HoldingDoc h) {
        return new Holding(h.getHoldingId(), h.getSymbol(), h.getQuantity(), h.getAvgCost(), h.getThesis(), h.getUpdatedAt());
    }
}
