package com.example.intel.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 오류 응답 본문. scope 값으로 대시보드가 보유 종목 오류와 분석 오류를 구분한다.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String SCOPE_HOLDINGS = "holdings";
    static final String SCOPE_ANALYSIS = "analysis";
    static final String SCOPE_REQUEST = "request";

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), SCOPE_HOLDINGS);
    }

    @ExceptionHandler(EmptyPortfolioException.class)
    public ResponseEntity<Map<String, Object>> handleEmptyPortfolio(EmptyPortfolioException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), SCOPE_HOLDINGS);
    }

    @ExceptionHandler(AnalysisTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleAnalysisTimeout(AnalysisTimeoutException ex) {
        log.warn("Briefing analysis timed out: {}", ex.getMessage());
        return build(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage(), SCOPE_ANALYSIS);
    }

    @ExceptionHandler(AnalysisException.class)
    public ResponseEntity<Map<String, Object>> handleAnalysis(AnalysisException ex) {
        log.warn("Briefing analysis failed: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, ex.getMessage(), SCOPE_ANALYSIS);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return build(HttpStatus.BAD_REQUEST, message.isBlank() ? "Invalid request" : message, SCOPE_REQUEST);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getReason(), SCOPE_REQUEST);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), SCOPE_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), SCOPE_REQUEST);
    }

    private ResponseEntity<Map<String, Object>> build(HttpStatus status, String message, String scope) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        body.put("scope", scope);
        return ResponseEntity.status(status).body(body);
    }
}
