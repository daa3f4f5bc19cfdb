package com.pdp.session;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets a caller abandon an in-flight evaluation, e.g. when the client disconnects.
 * The session checks the token before and after each external attribute lookup.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean cancellable;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Token that can never be cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("This token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws CancellationException if the caller has cancelled the evaluation
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Evaluation cancelled by caller");
        }
    }
}
