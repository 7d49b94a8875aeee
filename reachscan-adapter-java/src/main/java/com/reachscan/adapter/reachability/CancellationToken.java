package com.reachscan.adapter.reachability;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, polled between builder invocations and worklist pops.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new AnalysisCancelledException("Analysis cancelled");
        }
    }
}
