package com.selfplay.pipeline;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Buffers training rows and publishes them as JSON-lines shards of at most {@code maxRowsPerShard} rows.
 * Each shard is written to a temp file and moved into place, so readers never see a partial shard.
 *
 * <p>The first shard is truncated to a random size in {@code [ceil(minProp * R), R]} so that many
 * processes restarted together do not all emit shards of identical length.
 */
public class ShardedTrainingDataWriter implements TrainingDataWriter {
    private static final Logger log = LoggerFactory.getLogger(ShardedTrainingDataWriter.class);
    static final String SHARD_SUFFIX = ".jsonl";

    private final WriterSettings settings;
    private final Random random;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final List<TrainingRow> buffer = new ArrayList<>();

    private int currentShardCapacity;
    private long rowsWritten;
    private int shardsWritten;
    private boolean closed;

    public ShardedTrainingDataWriter(WriterSettings settings) {
        this(settings, new Random());
    }

    public ShardedTrainingDataWriter(WriterSettings settings, Random random) {
        this.settings = settings;
        this.random = random;
        this.currentShardCapacity = firstShardCapacity(settings.maxRowsPerShard(), settings.firstShardRandMinProp(), random);
    }

    static int firstShardCapacity(int maxRows, double minProp, Random random) {
        int minRows = (int) Math.ceil(minProp * maxRows);
        minRows = Math.max(1, Math.min(maxRows, minRows));
        if (minRows >= maxRows) {
            return maxRows;
        }
        return minRows + random.nextInt(maxRows - minRows + 1);
    }

    @Override
    public synchronized void writeGame(FinishedGameData game) throws IOException {
        if (closed) {
            throw new IllegalStateException("Writer for " + settings.outputDir() + " is closed");
        }
        String winner = game.outcome() == null ? null : game.outcome().winner();
        double finalScore = game.outcome() == null ? 0.0 : game.outcome().finalScore();
        for (PositionRecord position : game.positions()) {
            buffer.add(new TrainingRow(
                    game.modelName(),
                    game.gameIndex(),
                    position.turn(),
                    position.move(),
                    settings.boardXLen(),
                    settings.boardYLen(),
                    settings.inputsVersion(),
                    position.policyTarget(),
                    position.valueTarget(),
                    winner,
                    finalScore,
                    game.finishedAt()));
            if (buffer.size() >= currentShardCapacity) {
                writeShard();
                currentShardCapacity = settings.maxRowsPerShard();
            }
        }
    }

    @Override
    public synchronized void flushIfNonempty() throws IOException {
        if (!buffer.isEmpty()) {
            writeShard();
        }
    }

    @Override
    public synchronized long rowsWritten() {
        return rowsWritten;
    }

    public synchronized int shardsWritten() {
        return shardsWritten;
    }

    public synchronized int bufferedRows() {
        return buffer.size();
    }

    int currentShardCapacity() {
        return currentShardCapacity;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        flushIfNonempty();
        closed = true;
    }

    private void writeShard() throws IOException {
        Files.createDirectories(settings.outputDir());
        String shardName = HexFormat.of().toHexDigits(random.nextLong()).toUpperCase() + SHARD_SUFFIX;
        Path target = settings.outputDir().resolve(shardName);
        Path temp = settings.outputDir().resolve(shardName + ".tmp");
        try (BufferedWriter out = Files.newBufferedWriter(temp)) {
            for (TrainingRow row : buffer) {
                out.write(objectMapper.writeValueAsString(row));
                out.newLine();
            }
        }
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        rowsWritten += buffer.size();
        shardsWritten++;
        log.debug("Wrote shard {} rows={}", target, buffer.size());
        buffer.clear();
    }
}
