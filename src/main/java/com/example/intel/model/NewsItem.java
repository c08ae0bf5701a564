package com.example.intel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "뉴스 헤드라인")
public class NewsItem {
    @Schema(description = "제목")
    private String title;
    @Schema(description = "출처", example = "Reuters")
    private String source;
    @Schema(description = "기사 URL")
    private String url;
    @Schema(description = "게시 시각(UTC)")
    private Instant publishedAt;
}
