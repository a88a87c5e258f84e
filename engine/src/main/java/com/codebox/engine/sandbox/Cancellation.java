package com.codebox.engine.sandbox;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation handle shared between the caller that may cancel a run and
 * the executor thread that owns the process.
 *
 * {@link #cancel()} only signals; the executor thread performs the actual
 * process-tree teardown so the cancelling thread never blocks on it.
 * A cancel that arrives before the executor registers its listener is
 * remembered and delivered on registration.
 */
public final class Cancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<Runnable> listener = new AtomicReference<>();

    public static Cancellation none() {
        return new Cancellation();
    }

    /** @return true if this call moved the handle into the cancelled state */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) return false;
        Runnable r = listener.get();
        if (r != null) r.run();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void onCancel(Runnable r) {
        listener.set(r);
        if (cancelled.get()) r.run();
    }
}
