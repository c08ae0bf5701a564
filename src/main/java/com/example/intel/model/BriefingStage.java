package com.example.intel.model;

/**
 * 브리핑 요청 1건의 진행 단계.
 * IDLE → FETCHING_SNAPSHOT → AWAITING_ANALYSIS → VALIDATING → COMPLETE.
 * FAILED는 빈 포트폴리오(IDLE)나 분석 호출 실패(AWAITING_ANALYSIS)에서만 도달한다.
 */
public enum BriefingStage {
    IDLE,
    FETCHING_SNAPSHOT,
    AWAITING_ANALYSIS,
    VALIDATING,
    COMPLETE,
    FAILED
}
