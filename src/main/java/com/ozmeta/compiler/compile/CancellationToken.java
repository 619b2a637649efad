package com.ozmeta.compiler.compile;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation, checked between pipeline steps.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    public void throwIfCancellationRequested(String step) {
        if (cancelled.get()) {
            throw new CancellationException("Cancelled before " + step);
        }
    }
}
