package com.selfplay.pipeline;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result of one completed self-play game. Ownership passes from the worker to the data pipeline on
 * enqueue and the game is consumed exactly once by a shard writer.
 *
 * @param modelName model the game (or its final mid-game segment) was recorded against
 * @param gameRecord raw game record text for the audit sink, one line
 */
public record FinishedGameData(
        long gameIndex,
        String modelName,
        List<PositionRecord> positions,
        GameOutcome outcome,
        String gameRecord,
        Instant finishedAt) {

    public FinishedGameData {
        Objects.requireNonNull(modelName, "modelName");
        positions = positions == null ? List.of() : List.copyOf(positions);
    }

    public int rowCount() {
        return positions.size();
    }

    public FinishedGameData attributedTo(String otherModelName) {
        if (modelName.equals(otherModelName)) {
            return this;
        }
        return new FinishedGameData(gameIndex, otherModelName, positions, outcome, gameRecord, finishedAt);
    }
}
