package com.example.intel.exception;

/** 보유 종목이 없는 포트폴리오로 브리핑을 요청한 경우. 조회를 시작하기 전에 던진다. */
public class EmptyPortfolioException extends RuntimeException {
    private final String portfolioId;

    public EmptyPortfolioException(String portfolioId) {
        super("Portfolio has no holdings to analyze");
        this.portfolioId = portfolioId;
    }

    public String getPortfolioId() { return portfolioId; }
}
