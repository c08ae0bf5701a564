package com.example.intel.analysis;

import reactor.core.publisher.Mono;

/**
 * 내러티브 분석 생성기. 호출 1회로 포트폴리오 전체 분석을 돌려준다.
 * 실패는 AnalysisException 계열로 알린다.
 */
public interface AnalysisCollaborator {

    Mono<AnalysisOutput> analyze(AnalysisContext context);
}
