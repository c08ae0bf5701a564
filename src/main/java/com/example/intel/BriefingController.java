package com.example.intel;

import com.example.intel.model.BriefingRequest;
import com.example.intel.model.BriefingResponse;
import com.example.intel.service.PortfolioService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@Tag(name = "Briefing API", description = "포트폴리오 인텔리전스 브리핑")
public class BriefingController {

    private final PortfolioService portfolioService;

    public BriefingController(PortfolioService portfolioService) {
        this.portfolioService = portfolioService;
    }

    @PostMapping("/briefing")
    @Operation(summary = "브리핑 생성",
            description = "보유 종목의 시세/매크로/뉴스 스냅샷을 조회하고 종목별 분석과 포트폴리오 요약을 생성합니다. "
                    + "시장 데이터 조회 실패는 응답에 error로 표시되며, 분석 실패 시에만 요청이 실패합니다.")
    public Mono<BriefingResponse> briefing(@Valid @RequestBody BriefingRequest request) {
        return portfolioService.briefing(request.getPortfolioId().trim());
    }
}
