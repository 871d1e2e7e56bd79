package com.selfplay.worker;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.selfplay.manager.ModelHandle;
import com.selfplay.manager.SelfplayManager;
import com.selfplay.pipeline.FinishedGameData;
import com.selfplay.shutdown.StopSignal;

/**
 * One game loop: acquire the latest model, play a game, hand the result to the pipeline, release.
 * Exits when the stop signal is set, the game budget is used up, or a game comes back interrupted.
 */
public class GameWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(GameWorker.class);

    private final int workerIdx;
    private final SelfplayManager manager;
    private final GameRunner gameRunner;
    private final GameAdmissionCounter admissionCounter;
    private final ForkData forkData;
    private final StopSignal stopSignal;
    private final boolean switchNetsMidGame;

    private String prevModelName;
    private volatile long gamesCompleted;

    public GameWorker(
            int workerIdx,
            SelfplayManager manager,
            GameRunner gameRunner,
            GameAdmissionCounter admissionCounter,
            ForkData forkData,
            StopSignal stopSignal,
            boolean switchNetsMidGame) {
        this.workerIdx = workerIdx;
        this.manager = manager;
        this.gameRunner = gameRunner;
        this.admissionCounter = admissionCounter;
        this.forkData = forkData;
        this.stopSignal = stopSignal;
        this.switchNetsMidGame = switchNetsMidGame;
    }

    @Override
    public void run() {
        try {
            loop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Game worker {} interrupted while queueing data", workerIdx);
        } finally {
            log.info("Game worker {} terminating after {} games", workerIdx, gamesCompleted);
        }
    }

    private void loop() throws InterruptedException {
        while (!stopSignal.isStopRequested()) {
            Optional<ModelHandle> acquired = manager.tryAcquireLatest();
            if (acquired.isEmpty()) {
                if (stopSignal.isStopRequested()) {
                    return;
                }
                throw new IllegalStateException("No latest model available while selfplay is running");
            }

            LatestModelSwitcher held = new LatestModelSwitcher(manager, acquired.get(), workerIdx);
            try {
                if (!playOneGame(held)) {
                    return;
                }
            } finally {
                manager.release(held.current());
            }
        }
    }

    private boolean playOneGame(LatestModelSwitcher held) throws InterruptedException {
        ModelHandle handle = held.current();
        if (!handle.name().equals(prevModelName)) {
            prevModelName = handle.name();
            log.info("Game worker {} starting game on new model: {}", workerIdx, prevModelName);
        }

        long gameIndex = admissionCounter.claimNext();
        if (!admissionCounter.isAdmitted(gameIndex)) {
            return false;
        }
        manager.countOneGameStarted(handle);

        BotSpec black = new BotSpec(0, handle.name(), handle.evaluator());
        BotSpec white = new BotSpec(1, handle.name(), handle.evaluator());
        Optional<FinishedGameData> gameData = gameRunner.runGame(
                gameIndex,
                black,
                white,
                forkData,
                stopSignal,
                switchNetsMidGame ? held : null);

        if (gameData.isEmpty()) {
            return false;
        }
        // after a mid-game switch the data belongs to the newer model
        ModelHandle owner = held.current();
        prevModelName = owner.name();
        manager.enqueueDataToWrite(owner, gameData.get().attributedTo(owner.name()));
        gamesCompleted++;
        return true;
    }

    public long gamesCompleted() {
        return gamesCompleted;
    }
}
