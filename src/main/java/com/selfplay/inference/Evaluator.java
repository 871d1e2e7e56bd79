package com.selfplay.inference;

/**
 * Opaque inference capability for one model. Shared read-only by every worker holding the model's
 * handle; closed once the handle is finalized.
 */
public interface Evaluator extends AutoCloseable {
    String modelName();

    int maxConcurrentEvals();

    @Override
    void close();
}
