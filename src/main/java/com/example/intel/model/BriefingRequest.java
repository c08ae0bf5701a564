package com.example.intel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@Schema(description = "브리핑 생성 요청")
public class BriefingRequest {
    @NotBlank
    @Schema(description = "포트폴리오 ID", requiredMode = Schema.RequiredMode.REQUIRED)
    private String portfolioId;
}
