package com.nicl.collector.exception;

/**
 * 수집 서비스 관련 예외 기본 클래스
 */
public class CollectorException extends RuntimeException {

    private final String errorCode;

    public CollectorException(String message) {
        super(message);
        this.errorCode = "COLLECTOR_ERROR";
    }

    public CollectorException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "COLLECTOR_ERROR";
    }

    public CollectorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CollectorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
