package com.example.intel.analysis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** 분석 원본 결과. 포트폴리오 구성과의 대조는 BriefingCompiler가 한다 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisOutput {
    private List<AnalysisItem> items = new ArrayList<>();
    private String portfolioSummary;
    private List<String> riskAlerts = new ArrayList<>();
}
