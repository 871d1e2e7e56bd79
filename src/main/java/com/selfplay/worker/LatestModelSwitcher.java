package com.selfplay.worker;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.selfplay.inference.Evaluator;
import com.selfplay.manager.ModelHandle;
import com.selfplay.manager.SelfplayManager;

/**
 * Tracks the handle a worker currently holds. When a newer model is latest it trades the held reference
 * for one on the newer handle, so the rest of the game and its data belong to the newer model.
 *
 * <p>Not thread-safe: owned by one worker and called only from that worker's game.
 */
public class LatestModelSwitcher implements ModelSwitcher {
    private static final Logger log = LoggerFactory.getLogger(LatestModelSwitcher.class);

    private final SelfplayManager manager;
    private final int workerIdx;
    private ModelHandle current;

    public LatestModelSwitcher(SelfplayManager manager, ModelHandle acquired, int workerIdx) {
        this.manager = manager;
        this.current = acquired;
        this.workerIdx = workerIdx;
    }

    @Override
    public Optional<Evaluator> fetchIfNewer() {
        Optional<ModelHandle> latest = manager.tryAcquireLatest();
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        ModelHandle candidate = latest.get();
        if (candidate == current) {
            manager.release(candidate);
            return Optional.empty();
        }
        manager.release(current);
        current = candidate;
        log.info("Game worker {} changing mid-game to new model: {}", workerIdx, candidate.name());
        return Optional.of(candidate.evaluator());
    }

    public ModelHandle current() {
        return current;
    }
}
