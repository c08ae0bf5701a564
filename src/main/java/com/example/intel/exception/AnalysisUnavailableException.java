package com.example.intel.exception;

public class AnalysisUnavailableException extends AnalysisException {
    public AnalysisUnavailableException(String message) {
        super(message);
    }

    public AnalysisUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
