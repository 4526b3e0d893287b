package com.eyelevel.textextraction.client.monitor;

import reactor.core.Disposable;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop signal handed to {@link DocumentStatusMonitor#start}. One token may stop several sessions.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            listeners.forEach(Runnable::run);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs {@code listener} on cancellation, immediately if the token is already cancelled. The listener
     * may run twice when registration races with {@link #cancel()}, so it must be idempotent.
     *
     * @return removes the listener from this token
     */
    Disposable onCancel(final Runnable listener) {
        listeners.add(listener);
        if (cancelled.get()) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    int listenerCount() {
        return listeners.size();
    }
}
