package com.selfplay.worker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.selfplay.manager.SelfplayManager;
import com.selfplay.shutdown.StopSignal;

public class GameWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(GameWorkerPool.class);

    private final int numWorkers;
    private final SelfplayManager manager;
    private final GameRunner gameRunner;
    private final GameAdmissionCounter admissionCounter;
    private final ForkData forkData;
    private final StopSignal stopSignal;
    private final boolean switchNetsMidGame;
    private final List<GameWorker> workers = new ArrayList<>();
    private final List<Future<?>> futures = new ArrayList<>();

    private ExecutorService executor;

    public GameWorkerPool(
            int numWorkers,
            SelfplayManager manager,
            GameRunner gameRunner,
            GameAdmissionCounter admissionCounter,
            ForkData forkData,
            StopSignal stopSignal,
            boolean switchNetsMidGame) {
        if (numWorkers < 1) {
            throw new IllegalArgumentException("numWorkers must be >= 1");
        }
        this.numWorkers = numWorkers;
        this.manager = manager;
        this.gameRunner = gameRunner;
        this.admissionCounter = admissionCounter;
        this.forkData = forkData;
        this.stopSignal = stopSignal;
        this.switchNetsMidGame = switchNetsMidGame;
    }

    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Worker pool already started");
        }
        AtomicInteger threadCounter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(numWorkers,
                runnable -> new Thread(runnable, "game-worker-" + threadCounter.getAndIncrement()));
        for (int i = 0; i < numWorkers; i++) {
            GameWorker worker = new GameWorker(i, manager, gameRunner, admissionCounter, forkData, stopSignal, switchNetsMidGame);
            workers.add(worker);
            futures.add(executor.submit(() -> {
                try {
                    worker.run();
                } catch (RuntimeException | Error e) {
                    stopSignal.requestStop();
                    throw e;
                }
            }));
        }
        log.info("Started {} game workers, switchNetsMidGame={}", numWorkers, switchNetsMidGame);
    }

    /**
     * Waits for every worker to exit. A worker that dies with an exception has already requested a
     * pool-wide stop so the others wind down too.
     *
     * @return number of workers that failed
     */
    public int awaitWorkers() throws InterruptedException {
        List<Future<?>> pending;
        synchronized (this) {
            if (executor == null) {
                throw new IllegalStateException("Worker pool not started");
            }
            pending = new ArrayList<>(futures);
        }
        int failed = 0;
        for (int i = 0; i < pending.size(); i++) {
            try {
                pending.get(i).get();
            } catch (ExecutionException e) {
                failed++;
                log.error("Game worker {} failed, stopping selfplay", i, e.getCause());
            }
        }
        executor.shutdown();
        return failed;
    }

    public long gamesCompleted() {
        long total = 0;
        synchronized (this) {
            for (GameWorker worker : workers) {
                total += worker.gamesCompleted();
            }
        }
        return total;
    }
}
