package com.twinforge.core.collaborator;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-run stop flag shared by every actor working on the run.
 * <p>
 * Listeners registered with {@link #onCancel} run once when the token is cancelled,
 * or immediately if it already is. They are used to abort outstanding collaborator calls.
 */
public class CancellationToken {

    private final String runId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CopyOnWriteArrayList<Runnable> listeners = new CopyOnWriteArrayList<>();

    public CancellationToken(String runId) {
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }

    /**
     * @return true if this call cancelled the token, false if it already was
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        // the side that removes a listener runs it; onCancel may race with this loop
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                listener.run();
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Throws {@link RunCancelledException} if a stop was requested.
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new RunCancelledException(runId);
        }
    }

    public Registration onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
