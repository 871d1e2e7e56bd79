package com.selfplay.pipeline;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one raw game record per line to a single file.
 */
public class FileGameRecordSink implements GameRecordSink {
    private final Path file;
    private final BufferedWriter out;
    private boolean closed;

    public FileGameRecordSink(Path file) throws IOException {
        this.file = file;
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        this.out = Files.newBufferedWriter(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized void write(FinishedGameData game) throws IOException {
        if (closed) {
            throw new IllegalStateException("Record sink " + file + " is closed");
        }
        String record = game.gameRecord();
        if (record == null || record.isBlank()) {
            return;
        }
        out.write(record.replace("\r", "").replace('\n', ' '));
        out.newLine();
        out.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        out.close();
    }
}
