package com.nicl.collector.util;

import com.nicl.collector.exception.CollectionCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag passed down a collection call.
 * Checked at adapter page boundaries and before each cache retry; a blocking
 * sleep in progress is not interrupted.
 */
public final class CancellationToken {

    /** A token that can never be cancelled. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean cancellable;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    public static CancellationToken orNone(CancellationToken token) {
        return token != null ? token : NONE;
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CollectionCancelledException();
        }
    }
}
