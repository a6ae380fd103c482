package com.formulatrace.app.services;

import com.formulatrace.app.exceptions.TraceCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cancellation flag for one trace. The tracer checks it
 * before every workbook read; an interrupted thread counts as cancelled too.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancelled(String where) {
        if (isCancelled()) {
            throw new TraceCancelledException("Trace cancelled before " + where);
        }
    }
}
