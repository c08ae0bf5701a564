package com.example.intel.exception;

/** 분석 응답을 JSON 객체로 해석할 수 없는 경우. 항목 단위 손상은 보정하고 여기까지 오지 않는다. */
public class MalformedCollaboratorOutputException extends AnalysisException {
    public MalformedCollaboratorOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
