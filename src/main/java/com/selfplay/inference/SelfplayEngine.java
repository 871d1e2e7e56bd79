package com.selfplay.inference;

import java.io.IOException;

import com.selfplay.runtime.LoadedConfig;
import com.selfplay.worker.GameRunner;

/**
 * Service-provider seam for the game and inference implementation. Implementations are discovered with
 * {@link java.util.ServiceLoader} and selected by {@code engine.name}.
 */
public interface SelfplayEngine {
    String name();

    void initialize(LoadedConfig config) throws IOException;

    EvaluatorFactory evaluatorFactory();

    GameRunner gameRunner();

    /**
     * Releases process-wide resources. Called exactly once, after every evaluator has been closed.
     */
    void globalCleanup();
}
