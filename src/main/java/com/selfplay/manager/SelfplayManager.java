package com.selfplay.manager;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.selfplay.inference.Evaluator;
import com.selfplay.pipeline.DataWriteLoop;
import com.selfplay.pipeline.FinishedGameData;
import com.selfplay.pipeline.GameDataQueue;
import com.selfplay.pipeline.GameRecordSink;
import com.selfplay.pipeline.TrainingDataWriter;

/**
 * Sole authority over which model is latest. Holds every installed {@link ModelHandle} in install order,
 * hands out reference-counted acquisitions of the latest one, and routes finished games to the data
 * writers of whichever handle produced them.
 *
 * <p>Invariants:
 * <ul>
 *   <li>at most one handle is not draining, and only that handle is ever returned by acquisition;</li>
 *   <li>installing a handle marks every older handle draining in the same critical section;</li>
 *   <li>a handle is finalized exactly when it is draining and its reference count is zero.</li>
 * </ul>
 * Critical sections contain no I/O; finalization always runs after the lock is released.
 */
public class SelfplayManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SelfplayManager.class);

    private final double validationProp;
    private final int maxDataQueueSize;
    private final long logGamesEvery;
    private final DoubleSupplier splitRandom;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<ModelHandle> handles = new ArrayList<>();
    private long nextInstallSequence;
    private boolean everLoaded;
    private boolean closed;

    public SelfplayManager(double validationProp, int maxDataQueueSize, long logGamesEvery) {
        this(validationProp, maxDataQueueSize, logGamesEvery, () -> ThreadLocalRandom.current().nextDouble());
    }

    public SelfplayManager(double validationProp, int maxDataQueueSize, long logGamesEvery, DoubleSupplier splitRandom) {
        if (validationProp < 0.0 || validationProp > 1.0) {
            throw new IllegalArgumentException("validationProp must be within [0, 1]");
        }
        if (maxDataQueueSize < 1) {
            throw new IllegalArgumentException("maxDataQueueSize must be >= 1");
        }
        if (logGamesEvery < 1) {
            throw new IllegalArgumentException("logGamesEvery must be >= 1");
        }
        this.validationProp = validationProp;
        this.maxDataQueueSize = maxDataQueueSize;
        this.logGamesEvery = logGamesEvery;
        this.splitRandom = splitRandom;
    }

    /**
     * Acquires the latest model. Must not be called before the first successful load.
     *
     * @throws IllegalStateException if no model has ever been loaded, or every model is draining
     */
    public ModelHandle acquireLatest() {
        return tryAcquireLatest().orElseThrow(() -> new IllegalStateException("Every model is draining, nothing can be acquired"));
    }

    /**
     * Like {@link #acquireLatest()} but returns empty once every model has been scheduled for draining,
     * which happens during shutdown.
     */
    public Optional<ModelHandle> tryAcquireLatest() {
        lock.lock();
        try {
            if (!everLoaded) {
                throw new IllegalStateException("acquireLatest called before any model was loaded");
            }
            ModelHandle latest = latestLocked();
            if (latest == null) {
                return Optional.empty();
            }
            latest.incrementRefCount();
            return Optional.of(latest);
        } finally {
            lock.unlock();
        }
    }

    public void release(ModelHandle handle) {
        Objects.requireNonNull(handle, "handle");
        ModelHandle toFinalize = null;
        lock.lock();
        try {
            int remaining = handle.decrementRefCount();
            if (remaining == 0 && handle.isDraining()) {
                handles.remove(handle);
                toFinalize = handle;
            }
        } finally {
            lock.unlock();
        }
        if (toFinalize != null) {
            toFinalize.finalizeResources();
        }
    }

    /**
     * Installs a new latest model and starts its data writers. Every previously installed model starts
     * draining atomically with respect to acquisition.
     *
     * @param recordSink may be {@code null}
     */
    public ModelHandle loadModelAndStartDataWriting(
            Evaluator evaluator,
            TrainingDataWriter trainWriter,
            TrainingDataWriter validationWriter,
            GameRecordSink recordSink) {
        return loadModelAndStartDataWriting(evaluator.modelName(), evaluator, trainWriter, validationWriter, recordSink);
    }

    /**
     * Installs {@code evaluator} under {@code name}, which need not match the name the evaluator reports.
     * On failure nothing has been started and the caller still owns every resource passed in.
     *
     * @throws IllegalStateException if the manager is closed
     * @throws IllegalArgumentException if a model called {@code name} is still installed
     */
    public ModelHandle loadModelAndStartDataWriting(
            String name,
            Evaluator evaluator,
            TrainingDataWriter trainWriter,
            TrainingDataWriter validationWriter,
            GameRecordSink recordSink) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(evaluator, "evaluator");
        Objects.requireNonNull(trainWriter, "trainWriter");
        Objects.requireNonNull(validationWriter, "validationWriter");

        DataWriteLoop trainLoop = new DataWriteLoop(name, "train", new GameDataQueue(maxDataQueueSize), trainWriter, recordSink);
        DataWriteLoop validationLoop = new DataWriteLoop(name, "val", new GameDataQueue(maxDataQueueSize), validationWriter, recordSink);

        List<ModelHandle> freed = new ArrayList<>();
        ModelHandle handle;
        String previous;
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Manager is closed, cannot load model " + name);
            }
            for (ModelHandle existing : handles) {
                if (existing.name().equals(name)) {
                    throw new IllegalArgumentException("Model " + name + " is already installed");
                }
            }
            ModelHandle latest = latestLocked();
            previous = latest == null ? null : latest.name();
            handle = new ModelHandle(name, evaluator, trainLoop, validationLoop, recordSink, nextInstallSequence++);
            // writer threads must be running before anyone can enqueue against the handle
            handle.startDataWriting();
            for (ModelHandle existing : handles) {
                existing.markDraining();
                if (existing.refCount() == 0) {
                    freed.add(existing);
                }
            }
            handles.removeAll(freed);
            handles.add(handle);
            everLoaded = true;
        } finally {
            lock.unlock();
        }

        log.info("selfplay.model.installed name={} previous={}", name, previous == null ? "none" : previous);
        for (ModelHandle old : freed) {
            old.finalizeResources();
        }
        return handle;
    }

    /**
     * Routes a finished game to the handle's validation queue with probability {@code validationProp},
     * otherwise to its train queue. Blocks while the chosen queue is full.
     */
    public void enqueueDataToWrite(ModelHandle handle, FinishedGameData gameData) throws InterruptedException {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(gameData, "gameData");
        if (handle.isFinalized()) {
            throw new IllegalStateException("Model " + handle.name() + " is already finalized");
        }
        boolean validation = splitRandom.getAsDouble() < validationProp;
        DataWriteLoop loop = validation ? handle.validationLoop() : handle.trainLoop();
        loop.enqueue(gameData);
    }

    /**
     * Marks the named model draining. It is finalized now if nothing holds it, otherwise by the release
     * that drops its reference count to zero.
     *
     * @return {@code false} if no such model is installed
     */
    public boolean scheduleCleanupModelWhenFree(String name) {
        ModelHandle toFinalize = null;
        ModelHandle found = null;
        lock.lock();
        try {
            for (ModelHandle handle : handles) {
                if (handle.name().equals(name)) {
                    found = handle;
                    break;
                }
            }
            if (found == null) {
                return false;
            }
            found.markDraining();
            if (found.refCount() == 0) {
                handles.remove(found);
                toFinalize = found;
            }
        } finally {
            lock.unlock();
        }

        log.info("selfplay.model.draining name={} holders={}", name, found.refCount());
        if (toFinalize != null) {
            toFinalize.finalizeResources();
        }
        return true;
    }

    public Optional<String> getLatestModelName() {
        lock.lock();
        try {
            ModelHandle latest = latestLocked();
            return latest == null ? Optional.empty() : Optional.of(latest.name());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Names of all installed, not yet finalized models, oldest first.
     */
    public List<String> modelNames() {
        lock.lock();
        try {
            List<String> names = new ArrayList<>(handles.size());
            for (ModelHandle handle : handles) {
                names.add(handle.name());
            }
            return names;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Progress reporting only.
     */
    public void countOneGameStarted(ModelHandle handle) {
        long started = handle.countGameStarted();
        if (started % logGamesEvery == 0) {
            log.info("Started {} games with model {}", started, handle.name());
        }
    }

    /**
     * Drains and finalizes every remaining model. Expected to run after all workers have exited; a
     * handle that is somehow still held is finalized anyway so its data reaches disk.
     */
    @Override
    public void close() {
        List<ModelHandle> remaining;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            for (ModelHandle handle : handles) {
                handle.markDraining();
            }
            remaining = new ArrayList<>(handles);
            handles.clear();
        } finally {
            lock.unlock();
        }

        for (ModelHandle handle : remaining) {
            if (handle.refCount() > 0) {
                log.warn("selfplay.model.still-held name={} holders={} finalizing anyway", handle.name(), handle.refCount());
            }
            handle.finalizeResources();
        }
    }

    private ModelHandle latestLocked() {
        ModelHandle latest = null;
        for (ModelHandle handle : handles) {
            if (!handle.isDraining()) {
                if (latest != null) {
                    throw new IllegalStateException("More than one non-draining model: " + latest.name() + ", " + handle.name());
                }
                latest = handle;
            }
        }
        return latest;
    }
}
