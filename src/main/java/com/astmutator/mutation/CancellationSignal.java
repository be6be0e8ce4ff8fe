package com.astmutator.mutation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets a caller stop a generation run, typically from inside its callback.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
