package com.selfplay.shutdown;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Process-wide cooperative stop flag. Setting it more than once is harmless.
 *
 * <p>{@link #onSignal()} is the only method called from the shutdown hook; it performs two atomic
 * writes and nothing else.
 */
public final class StopSignal implements BooleanSupplier {
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean signalReceived = new AtomicBoolean(false);

    public void requestStop() {
        stopRequested.set(true);
    }

    public void onSignal() {
        signalReceived.set(true);
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public boolean wasSignalReceived() {
        return signalReceived.get();
    }

    @Override
    public boolean getAsBoolean() {
        return stopRequested.get();
    }
}
