package com.selfplay.pipeline;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One line of a training shard. {@code winner} is omitted for games that ended without a result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrainingRow(
        String modelName,
        long gameIndex,
        int turn,
        String move,
        int boardXLen,
        int boardYLen,
        int inputsVersion,
        float[] policyTarget,
        float[] valueTarget,
        String winner,
        double finalScore,
        Instant finishedAt) {
}
