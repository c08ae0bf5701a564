package com.example.intel.exception;

import java.time.Duration;

public class AnalysisTimeoutException extends AnalysisException {
    public AnalysisTimeoutException(Duration timeout, Throwable cause) {
        super("Intelligence service did not respond within " + timeout.toSeconds() + "s", cause);
    }
}
