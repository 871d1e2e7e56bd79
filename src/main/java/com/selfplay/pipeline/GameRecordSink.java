package com.selfplay.pipeline;

import java.io.Closeable;
import java.io.IOException;

/**
 * Receives every finished game of a model regardless of its train/validation split.
 */
public interface GameRecordSink extends Closeable {
    void write(FinishedGameData game) throws IOException;
}
