package com.selfplay.pipeline;

import java.nio.file.Path;

/**
 * @param firstShardRandMinProp lower bound, as a fraction of {@code maxRowsPerShard}, of the randomly
 *        truncated first shard
 */
public record WriterSettings(
        Path outputDir,
        int maxRowsPerShard,
        double firstShardRandMinProp,
        int boardXLen,
        int boardYLen,
        int inputsVersion) {

    public WriterSettings {
        if (maxRowsPerShard < 1) {
            throw new IllegalArgumentException("maxRowsPerShard must be >= 1");
        }
        if (firstShardRandMinProp < 0.0 || firstShardRandMinProp > 1.0) {
            throw new IllegalArgumentException("firstShardRandMinProp must be within [0, 1]");
        }
    }
}
