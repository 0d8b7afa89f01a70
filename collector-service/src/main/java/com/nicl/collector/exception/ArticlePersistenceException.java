package com.nicl.collector.exception;

/**
 * 배치 저장 실패. 트랜잭션은 이미 롤백된 상태다.
 */
public class ArticlePersistenceException extends CollectorException {

    public ArticlePersistenceException(String message, Throwable cause) {
        super("PERSISTENCE_ERROR", message, cause);
    }

    public static ArticlePersistenceException batchFailed(int size, Throwable cause) {
        return new ArticlePersistenceException(
                "Failed to save batch of " + size + " article(s): " + cause.getMessage(), cause);
    }

    public static ArticlePersistenceException singleFailed(String originalLink, Throwable cause) {
        return new ArticlePersistenceException(
                "Failed to save article " + originalLink + ": " + cause.getMessage(), cause);
    }
}
