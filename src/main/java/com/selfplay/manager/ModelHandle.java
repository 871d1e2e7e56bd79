package com.selfplay.manager;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.selfplay.inference.Evaluator;
import com.selfplay.pipeline.DataWriteLoop;
import com.selfplay.pipeline.GameRecordSink;

/**
 * Binds one evaluator to its output writers and lifecycle state. The reference count and draining flag
 * are mutated only under the {@link SelfplayManager} lock; they are volatile so tests and log lines can
 * read them without it.
 */
public final class ModelHandle {
    private static final Logger log = LoggerFactory.getLogger(ModelHandle.class);

    private final String name;
    private final Evaluator evaluator;
    private final DataWriteLoop trainLoop;
    private final DataWriteLoop validationLoop;
    private final GameRecordSink recordSink;
    private final long installSequence;
    private final AtomicLong gamesStarted = new AtomicLong();
    private final AtomicBoolean finalized = new AtomicBoolean(false);

    private volatile int refCount;
    private volatile boolean draining;

    ModelHandle(
            String name,
            Evaluator evaluator,
            DataWriteLoop trainLoop,
            DataWriteLoop validationLoop,
            GameRecordSink recordSink,
            long installSequence) {
        this.name = name;
        this.evaluator = evaluator;
        this.trainLoop = trainLoop;
        this.validationLoop = validationLoop;
        this.recordSink = recordSink;
        this.installSequence = installSequence;
    }

    public String name() {
        return name;
    }

    public Evaluator evaluator() {
        return evaluator;
    }

    public int refCount() {
        return refCount;
    }

    public boolean isDraining() {
        return draining;
    }

    public boolean isFinalized() {
        return finalized.get();
    }

    public long installSequence() {
        return installSequence;
    }

    public long gamesStarted() {
        return gamesStarted.get();
    }

    DataWriteLoop trainLoop() {
        return trainLoop;
    }

    DataWriteLoop validationLoop() {
        return validationLoop;
    }

    int incrementRefCount() {
        return ++refCount;
    }

    int decrementRefCount() {
        if (refCount == 0) {
            throw new IllegalStateException("Release of model " + name + " without a matching acquire");
        }
        return --refCount;
    }

    void markDraining() {
        draining = true;
    }

    long countGameStarted() {
        return gamesStarted.incrementAndGet();
    }

    void startDataWriting() {
        trainLoop.start();
        validationLoop.start();
    }

    /**
     * Writes out everything still queued, closes the writers and the record sink, then releases the
     * evaluator. Runs at most once and never under the manager lock.
     */
    void finalizeResources() {
        if (!finalized.compareAndSet(false, true)) {
            return;
        }
        boolean interrupted = finishUninterruptibly(trainLoop);
        interrupted |= finishUninterruptibly(validationLoop);

        close(trainLoop.writer(), "train writer");
        close(validationLoop.writer(), "validation writer");
        if (recordSink != null) {
            close(recordSink, "record sink");
        }
        evaluator.close();

        log.info("selfplay.model.finalized name={} gamesStarted={} trainRows={} valRows={} writeFailures={}",
                name,
                gamesStarted.get(),
                trainLoop.writer().rowsWritten(),
                validationLoop.writer().rowsWritten(),
                trainLoop.writeFailures() + validationLoop.writeFailures());
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean finishUninterruptibly(DataWriteLoop loop) {
        boolean interrupted = false;
        while (true) {
            try {
                loop.finish();
                return interrupted;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
    }

    private void close(Closeable closeable, String what) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.error("selfplay.model.close.failed name={} resource={} reason={}", name, what, e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "ModelHandle{" +
                "name=" + name +
                ", refCount=" + refCount +
                ", draining=" + draining +
                ", installSequence=" + installSequence +
                '}';
    }
}
