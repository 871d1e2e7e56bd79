package com.selfplay.worker;

import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared store of forked starting positions. Game runners deposit interesting positions from one game
 * and draw them as openings for later games. Oldest entries are evicted once full.
 */
public class ForkData {
    private final ConcurrentLinkedDeque<String> positions = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final int capacity;

    public ForkData() {
        this(1000);
    }

    public ForkData(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    public void add(String position) {
        positions.addLast(position);
        if (size.incrementAndGet() > capacity && positions.pollFirst() != null) {
            size.decrementAndGet();
        }
    }

    public Optional<String> poll() {
        String position = positions.pollFirst();
        if (position == null) {
            return Optional.empty();
        }
        size.decrementAndGet();
        return Optional.of(position);
    }

    public int size() {
        return size.get();
    }

    public void clear() {
        positions.clear();
        size.set(0);
    }
}
