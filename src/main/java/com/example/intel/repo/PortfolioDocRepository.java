package com.example.intel.repo;

import com.example.intel.model.doc.PortfolioDoc;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface PortfolioDocRepository extends ReactiveCrudRepository<PortfolioDoc, String> {
    Mono<PortfolioDoc> findFirstByName(String name);

    Flux<PortfolioDoc> findAllByOrderByCreatedAtAsc();
}
