package com.example.intel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@Schema(description = "보유 종목별 분석")
public class HoldingAnalysis {
    @Schema(description = "티커", example = "AAPL")
    private String symbol;
    @Schema(description = "사용자 투자 논리(원문)")
    private String thesis;
    @Schema(description = "분석 본문")
    private String analysis;
    @Schema(description = "감성 태그 원문", example = "bullish")
    private String sentiment;
    @Schema(description = "표시용 감성 라벨. 알 수 없는 태그는 대문자 원문", example = "BULLISH")
    private String sentimentLabel;
    @Schema(description = "평가 손익률(%). 현재가 또는 평균단가가 없으면 null")
    private Double profitLossPct;
    @Schema(description = "분석 결과가 없어 대체 문구로 채운 경우 true")
    private boolean placeholder;

    public HoldingAnalysis(String symbol, String thesis, String analysis, String sentiment) {
        this.symbol = symbol;
        this.thesis = thesis;
        this.analysis = analysis;
        this.sentiment = sentiment;
        this.sentimentLabel = Sentiment.displayLabel(sentiment);
    }
}
