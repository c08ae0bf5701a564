package com.example.intel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "보유 종목")
public class Holding {
    @Schema(description = "보유 종목 ID(UUID)")
    private String id;
    @Schema(description = "티커(대문자)", example = "AAPL")
    private String symbol;
    @Schema(description = "수량", example = "10")
    private Double quantity;
    @Schema(description = "평균 매입단가", example = "150.0")
    private Double avgCost;
    @Schema(description = "투자 논리(선택)")
    private String thesis;
    @Schema(description = "마지막 수정 시각(UTC)")
    private Instant updatedAt;
}
