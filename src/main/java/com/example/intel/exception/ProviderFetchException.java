package com.example.intel.exception;

/**
 * 종목/지표 1건에 대한 공급자 조회 실패. 스냅샷 조립 단계에서 해당 항목의 error 필드로만 남는다.
 */
public class ProviderFetchException extends RuntimeException {
    private final String key;

    public ProviderFetchException(String key, String message) {
        super(message);
        this.key = key;
    }

    public ProviderFetchException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() { return key; }
}
