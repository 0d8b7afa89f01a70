package com.nicl.collector.exception;

public class CollectionCancelledException extends CollectorException {

    public CollectionCancelledException() {
        super("CANCELLED", "Collection was cancelled");
    }

    public CollectionCancelledException(String message) {
        super("CANCELLED", message);
    }
}
