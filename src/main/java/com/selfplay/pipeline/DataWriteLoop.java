package com.selfplay.pipeline;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dedicated thread draining one {@link GameDataQueue} into a {@link TrainingDataWriter} and, when
 * present, the shared raw record sink.
 */
public class DataWriteLoop {
    private static final Logger log = LoggerFactory.getLogger(DataWriteLoop.class);

    private final String modelName;
    private final String split;
    private final GameDataQueue queue;
    private final TrainingDataWriter writer;
    private final GameRecordSink recordSink;
    private final AtomicLong gamesWritten = new AtomicLong();
    private final AtomicLong writeFailures = new AtomicLong();

    private Thread thread;
    private boolean endQueued;

    public DataWriteLoop(String modelName, String split, GameDataQueue queue, TrainingDataWriter writer, GameRecordSink recordSink) {
        this.modelName = modelName;
        this.split = split;
        this.queue = queue;
        this.writer = writer;
        this.recordSink = recordSink;
    }

    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Data write loop already started for " + modelName + "/" + split);
        }
        thread = new Thread(this::drain, "data-write-" + split + "-" + modelName);
        thread.start();
    }

    private void drain() {
        log.debug("Data write loop starting model={} split={}", modelName, split);
        while (true) {
            Optional<FinishedGameData> next;
            try {
                next = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Data write loop interrupted model={} split={} queued={}", modelName, split, queue.size());
                return;
            }
            if (next.isEmpty()) {
                break;
            }
            write(next.get());
        }
        log.debug("Data write loop finished model={} split={} games={}", modelName, split, gamesWritten.get());
    }

    private void write(FinishedGameData game) {
        try {
            writer.writeGame(game);
            gamesWritten.incrementAndGet();
        } catch (IOException | RuntimeException e) {
            writeFailures.incrementAndGet();
            log.error("selfplay.write.failed model={} split={} game={} reason={}", modelName, split, game.gameIndex(), e.getMessage(), e);
        }
        if (recordSink == null) {
            return;
        }
        try {
            recordSink.write(game);
        } catch (IOException | RuntimeException e) {
            writeFailures.incrementAndGet();
            log.error("selfplay.record.failed model={} game={} reason={}", modelName, game.gameIndex(), e.getMessage(), e);
        }
    }

    /**
     * Blocks while the queue is full. The writer thread drains without this monitor, so a blocked
     * producer always makes progress.
     *
     * @throws IllegalStateException once {@link #finish()} has queued the end marker
     */
    public synchronized void enqueue(FinishedGameData game) throws InterruptedException {
        if (endQueued) {
            throw new IllegalStateException("Data write loop " + modelName + "/" + split + " is finished, game "
                    + game.gameIndex() + " would be lost");
        }
        queue.put(game);
    }

    /**
     * Lets the loop write everything already queued, then waits for its thread to exit.
     */
    public void finish() throws InterruptedException {
        Thread running;
        synchronized (this) {
            running = thread;
            if (running == null) {
                return;
            }
            if (!endQueued) {
                queue.closeForWriting();
                endQueued = true;
            }
        }
        running.join();
    }

    public TrainingDataWriter writer() {
        return writer;
    }

    public long gamesWritten() {
        return gamesWritten.get();
    }

    public long writeFailures() {
        return writeFailures.get();
    }
}
