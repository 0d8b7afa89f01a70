package com.nicl.collector.exception;

/**
 * Raised inside a source adapter when a request or response cannot be used.
 * Adapters convert it into a failed fetch result; it never reaches the orchestrator.
 */
public class SourceFetchException extends CollectorException {

    public SourceFetchException(String message) {
        super("SOURCE_ERROR", message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super("SOURCE_ERROR", message, cause);
    }
}
