package com.example.intel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "매크로 지표")
public class MacroIndicator {
    @Schema(description = "현재 값")
    private Double value;
    @Schema(description = "전일 종가")
    private Double previousClose;
    @Schema(description = "전일 대비 변동률(%)")
    private Double changePct;
    @Schema(description = "조회 실패 사유")
    private String error;
}
