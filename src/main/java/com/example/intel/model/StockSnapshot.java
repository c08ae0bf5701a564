package com.example.intel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.Instant;

/**
 * 종목별 시점 스냅샷. 숫자 필드가 null이면 "값 없음"이며 0으로 대체하지 않는다.
 */
@Data
@Schema(description = "종목 시세/펀더멘털 스냅샷")
public class StockSnapshot {
    @Schema(description = "티커", example = "AAPL")
    private String symbol;
    @Schema(description = "현재가")
    private Double currentPrice;
    @Schema(description = "52주 고가")
    private Double fiftyTwoWeekHigh;
    @Schema(description = "52주 저가")
    private Double fiftyTwoWeekLow;
    @Schema(description = "Trailing P/E")
    private Double peRatio;
    @Schema(description = "Forward P/E")
    private Double forwardPe;
    @Schema(description = "시가총액")
    private Double marketCap;
    @Schema(description = "1개월(21거래일) 수익률(%)")
    @JsonProperty("perf_1m_pct")
    private Double perf1mPct;
    @Schema(description = "3개월 수익률(%)")
    @JsonProperty("perf_3m_pct")
    private Double perf3mPct;
    @Schema(description = "5일/20일 평균 거래량 비율")
    @JsonProperty("volume_ratio_5d_20d")
    private Double volumeRatio5d20d;
    @Schema(description = "이 종목 조회 실패 사유")
    private String error;
    @Schema(description = "조회 시각(스냅샷 공통)")
    private Instant fetchedAt;
}
