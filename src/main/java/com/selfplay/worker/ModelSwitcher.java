package com.selfplay.worker;

import java.util.Optional;

import com.selfplay.inference.Evaluator;

/**
 * Lets a running game ask, between moves, whether a newer model has been installed.
 */
@FunctionalInterface
public interface ModelSwitcher {
    /**
     * @return the newer model's evaluator, which the game must use for the rest of its moves, or empty
     *         when the game's current model is still the latest
     */
    Optional<Evaluator> fetchIfNewer();
}
