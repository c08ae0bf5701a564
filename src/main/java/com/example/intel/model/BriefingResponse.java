package com.example.intel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Schema(description = "포트폴리오 인텔리전스 브리핑")
public class BriefingResponse {
    @Schema(description = "포트폴리오 ID")
    private String portfolioId;
    @Schema(description = "브리핑 생성 시각(항상 market_snapshot.fetched_at 이후)")
    private Instant generatedAt;
    @Schema(description = "보유 종목별 분석(보유 순서)")
    private List<HoldingAnalysis> holdingsAnalyses = new ArrayList<>();
    @Schema(description = "포트폴리오 요약")
    private String portfolioSummary;
    @Schema(description = "리스크 경보")
    private List<String> riskAlerts = new ArrayList<>();
    @Schema(description = "분석에 사용한 시장 스냅샷")
    private MarketSnapshot marketSnapshot;
    @Schema(description = "시장 데이터 조회가 전부 실패했으면 false. as-of 배너 표시 여부 판단용")
    private boolean marketDataAvailable;
}
