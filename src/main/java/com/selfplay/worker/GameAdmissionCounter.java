package com.selfplay.worker;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out unique, gap-free game indices. Indices at or beyond {@code maxGamesTotal} are still consumed
 * but admit no game, which caps total work without any coordination between workers.
 */
public class GameAdmissionCounter {
    private final AtomicLong next = new AtomicLong();
    private final long maxGamesTotal;

    public GameAdmissionCounter(long maxGamesTotal) {
        if (maxGamesTotal < 1) {
            throw new IllegalArgumentException("maxGamesTotal must be >= 1");
        }
        this.maxGamesTotal = maxGamesTotal;
    }

    public long claimNext() {
        return next.getAndIncrement();
    }

    public boolean isAdmitted(long gameIndex) {
        return gameIndex < maxGamesTotal;
    }

    public long claimed() {
        return next.get();
    }
}
