package com.example.intel.model.portfolio;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "보유 종목 추가 입력")
public class HoldingCreateRequest {
    @NotBlank
    @Pattern(regexp = "^\\s*[A-Za-z0-9.^=\\-]{1,20}\\s*$", message = "symbol must be 1-20 ticker characters")
    @Schema(description = "티커", example = "AAPL")
    private String symbol;

    @NotNull
    @DecimalMin("0")
    @Schema(description = "수량", example = "10")
    private Double quantity;

    @NotNull
    @DecimalMin("0")
    @Schema(description = "평균 매입단가", example = "150.0")
    private Double avgCost;

    @Size(max = 1000)
    @Schema(description = "투자 논리(선택)")
    private String thesis;
}
