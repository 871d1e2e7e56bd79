package com.selfplay.models;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.selfplay.manager.SelfplayManager;
import com.selfplay.shutdown.InterruptibleSleeper;
import com.selfplay.shutdown.StopSignal;

/**
 * Background loop that installs newly published models and schedules every superseded model for
 * draining. On exit it drains whatever is left so no new games can start.
 */
public class ModelPollLoop implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ModelPollLoop.class);

    private final SelfplayManager manager;
    private final ModelInstaller installer;
    private final StopSignal stopSignal;
    private final InterruptibleSleeper sleeper;
    private final long pollIntervalMs;

    public ModelPollLoop(
            SelfplayManager manager,
            ModelInstaller installer,
            StopSignal stopSignal,
            InterruptibleSleeper sleeper,
            long pollIntervalMs) {
        this.manager = manager;
        this.installer = installer;
        this.stopSignal = stopSignal;
        this.sleeper = sleeper;
        this.pollIntervalMs = pollIntervalMs;
    }

    @Override
    public void run() {
        log.info("Model polling loop starting, interval={}ms", pollIntervalMs);
        try {
            while (!stopSignal.isStopRequested()) {
                pollOnce();
                if (stopSignal.isStopRequested()) {
                    break;
                }
                sleeper.sleep(pollIntervalMs, stopSignal);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Model polling loop interrupted");
        } finally {
            drainAll();
            log.info("Model polling loop terminating");
        }
    }

    /**
     * @return {@code true} if a new model was installed
     */
    public boolean pollOnce() throws InterruptedException {
        Optional<String> installed;
        try {
            installed = installer.installIfNewer(manager.getLatestModelName());
        } catch (RuntimeException e) {
            log.error("selfplay.poll.failed reason={}, will retry next cycle", e.getMessage(), e);
            return false;
        }
        if (installed.isEmpty()) {
            return false;
        }
        drainAllExcept(installed.get());
        return true;
    }

    void drainAllExcept(String latestName) {
        List<String> names = manager.modelNames();
        if (names.isEmpty()) {
            throw new IllegalStateException("No models installed right after installing " + latestName);
        }
        for (String name : names) {
            if (!name.equals(latestName)) {
                manager.scheduleCleanupModelWhenFree(name);
            }
        }
    }

    private void drainAll() {
        for (String name : manager.modelNames()) {
            manager.scheduleCleanupModelWhenFree(name);
        }
    }
}
