package com.scholarly.citegraph.service.traversal;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative abort signal for a running traversal. The first reason recorded wins.
 */
public class CancellationToken {

    private final AtomicReference<StopReason> reason = new AtomicReference<>();

    public void cancel() {
        cancel(StopReason.CANCELLED);
    }

    public void cancel(StopReason stopReason) {
        reason.compareAndSet(null, stopReason);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public StopReason getReason() {
        return reason.get();
    }
}
