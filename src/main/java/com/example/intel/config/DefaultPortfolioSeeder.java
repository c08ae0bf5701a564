package com.example.intel.config;

import com.example.intel.repo.HoldingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 기동 시 "Default" 포트폴리오가 없으면 만든다. 저장소가 내려가 있어도 기동은 계속한다.
 */
@Component
public class DefaultPortfolioSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DefaultPortfolioSeeder.class);
    static final String DEFAULT_NAME = "Default";

    private final HoldingsRepository repository;
    private final BriefingProperties props;

    public DefaultPortfolioSeeder(HoldingsRepository repository, BriefingProperties props) {
        this.repository = repository;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!props.isSeedDefaultPortfolio()) return;
        repository.findPortfolioByName(DEFAULT_NAME)
                .switchIfEmpty(Mono.defer(() -> repository.createPortfolio(DEFAULT_NAME)
                        .doOnNext(p -> log.info("Seeded default portfolio {}", p.getId()))))
                .subscribe(
                        p -> log.debug("Default portfolio present: {}", p.getId()),
                        e -> log.warn("Default portfolio seeding failed: {}", e.toString()));
    }
}
