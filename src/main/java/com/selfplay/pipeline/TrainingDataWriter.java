package com.selfplay.pipeline;

import java.io.Closeable;
import java.io.IOException;

public interface TrainingDataWriter extends Closeable {
    void writeGame(FinishedGameData game) throws IOException;

    void flushIfNonempty() throws IOException;

    long rowsWritten();

    /**
     * Flushes any buffered rows as a final shard.
     */
    @Override
    void close() throws IOException;
}
