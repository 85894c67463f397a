package com.kubegraph.core.engine;

import java.util.concurrent.atomic.AtomicReference;

/**
 * External stop request, observed between levels.
 */
public class CancellationSignal {

    private final AtomicReference<String> reason = new AtomicReference<>();

    public void cancel(String why) {
        reason.compareAndSet(null, why == null ? "cancelled" : why);
    }

    public void cancel() {
        cancel("cancelled");
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }
}
