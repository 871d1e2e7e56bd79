package com.selfplay.pipeline;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Bounded FIFO between game workers and a writer. {@link #put} blocks while the queue is full so no
 * game is ever dropped; worker throughput slows to match disk I/O instead.
 */
public class GameDataQueue {
    private static final Entry END = new Entry(null);

    private final BlockingQueue<Entry> entries;
    private final int capacity;

    public GameDataQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.entries = new ArrayBlockingQueue<>(capacity);
    }

    public void put(FinishedGameData game) throws InterruptedException {
        entries.put(new Entry(game));
    }

    /**
     * @return the next game, or empty once the queue has been closed and drained
     */
    public Optional<FinishedGameData> take() throws InterruptedException {
        Entry entry = entries.take();
        if (entry == END) {
            return Optional.empty();
        }
        return Optional.of(entry.game());
    }

    /**
     * Appends the end-of-stream marker behind any queued games. Producers must be finished.
     */
    public void closeForWriting() throws InterruptedException {
        entries.put(END);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    private record Entry(FinishedGameData game) {
    }
}
