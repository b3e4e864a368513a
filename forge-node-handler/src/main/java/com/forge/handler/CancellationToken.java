package com.forge.handler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one execution. The engine checks it at every group
 * boundary; handlers doing long work may poll {@link #isCancelled()} as well.
 * {@link #NONE} never cancels.
 */
public class CancellationToken {

    /** Token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
