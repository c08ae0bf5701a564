package com.example.intel;

import com.example.intel.model.Holding;
import com.example.intel.model.Portfolio;
import com.example.intel.model.portfolio.HoldingCreateRequest;
import com.example.intel.model.portfolio.PortfolioCreateRequest;
import com.example.intel.service.PortfolioService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/portfolios")
@Tag(name = "Portfolio API", description = "포트폴리오/보유 종목 관리")
public class PortfolioController {

    private final PortfolioService portfolioService;

    public PortfolioController(PortfolioService portfolioService) {
        this.portfolioService = portfolioService;
    }

    @GetMapping
    @Operation(summary = "포트폴리오 목록", description = "생성 순서대로 보유 종목과 함께 반환")
    public Flux<Portfolio> list() {
        return portfolioService.list();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "포트폴리오 생성")
    public Mono<Portfolio> create(@Valid @RequestBody PortfolioCreateRequest request) {
        return portfolioService.create(request.getName());
    }

    @GetMapping("/{portfolioId}")
    @Operation(summary = "포트폴리오 조회")
    public Mono<Portfolio> get(@Parameter(description = "포트폴리오 ID") @PathVariable String portfolioId) {
        return portfolioService.get(portfolioId);
    }

    @PostMapping("/{portfolioId}/holdings")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "보유 종목 추가", description = "티커는 공백 제거 후 대문자로 저장")
    public Mono<Holding> addHolding(@Parameter(description = "포트폴리오 ID") @PathVariable String portfolioId,
                                    @Valid @RequestBody HoldingCreateRequest request) {
        return portfolioService.addHolding(portfolioId, request);
    }

    @DeleteMapping("/{portfolioId}/holdings/{holdingId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "보유 종목 삭제")
    public Mono<Void> deleteHolding(@Parameter(description = "포트폴리오 ID") @PathVariable String portfolioId,
                                    @Parameter(description = "보유 종목 ID") @PathVariable String holdingId) {
        return portfolioService.deleteHolding(portfolioId, holdingId);
    }
}
