package com.example.intel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@Schema(description = "포트폴리오")
public class Portfolio {
    @Schema(description = "포트폴리오 ID(UUID)")
    private String id;
    @Schema(description = "이름", example = "Default")
    private String name;
    @Schema(description = "생성 시각(UTC)")
    private Instant createdAt;
    @Schema(description = "보유 종목(입력 순서)")
    private List<Holding> holdings = new ArrayList<>();

    public Portfolio(String id, String name, Instant createdAt, List<Holding> holdings) {
        this.id = id;
        this.name = name;
        this.createdAt = createdAt;
        this.holdings = holdings == null ? new ArrayList<>() : holdings;
    }
}
