package com.selfplay.inference;

import java.io.IOException;

import com.selfplay.models.ModelCandidate;

public interface EvaluatorFactory {
    Evaluator create(ModelCandidate candidate, int maxConcurrentEvals) throws IOException;

    /**
     * Evaluation budget: every search thread of every game may have two requests in flight, plus slack.
     */
    static int concurrencyBudget(int numSearchThreads, int numGameThreads) {
        return numSearchThreads * numGameThreads * 2 + 16;
    }
}
