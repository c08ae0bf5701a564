package com.example.intel.exception;

/** 분석(내러티브 생성) 단계 실패. 부분 브리핑 없이 요청 전체가 실패한다. */
public abstract class AnalysisException extends RuntimeException {
    protected AnalysisException(String message) {
        super(message);
    }

    protected AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
