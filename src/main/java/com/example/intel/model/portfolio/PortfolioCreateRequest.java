package com.example.intel.model.portfolio;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "포트폴리오 생성 입력")
public class PortfolioCreateRequest {
    @NotBlank
    @Size(max = 255)
    @Schema(description = "이름", example = "Default")
    private String name;
}
