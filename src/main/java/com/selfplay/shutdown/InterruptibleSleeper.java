package com.selfplay.shutdown;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Timed wait that ends early when {@link #wakeAll()} is called or the stop condition becomes true.
 * One instance can be shared by any number of background loops.
 */
public class InterruptibleSleeper {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeup = lock.newCondition();
    private long wakeGeneration;

    /**
     * @return {@code true} if the wait ended early, {@code false} if the full interval elapsed
     */
    public boolean sleep(Duration interval, BooleanSupplier stopCondition) throws InterruptedException {
        long remainingNanos = interval.toNanos();
        lock.lock();
        try {
            long generation = wakeGeneration;
            while (!stopCondition.getAsBoolean() && generation == wakeGeneration) {
                if (remainingNanos <= 0L) {
                    return false;
                }
                remainingNanos = wakeup.awaitNanos(remainingNanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean sleep(long intervalMs, BooleanSupplier stopCondition) throws InterruptedException {
        return sleep(Duration.ofMillis(intervalMs), stopCondition);
    }

    public void wakeAll() {
        lock.lock();
        try {
            wakeGeneration++;
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
