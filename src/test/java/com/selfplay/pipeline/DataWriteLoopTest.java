package com.selfplay.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.selfplay.testing.RecordingTrainingDataWriter;
import com.selfplay.testing.TestGames;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class DataWriteLoopTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteEveryQueuedGameBeforeFinishing() throws Exception {
        RecordingTrainingDataWriter writer = new RecordingTrainingDataWriter();
        FileGameRecordSink sink = new FileGameRecordSink(tempDir.resolve("sgfs").resolve("games.sgfs"));
        DataWriteLoop loop = new DataWriteLoop("a", "train", new GameDataQueue(2), writer, sink);
        loop.start();

        for (int i = 0; i < 10; i++) {
            loop.enqueue(TestGames.game(i, "a", 2));
        }
        loop.finish();
        loop.finish();
        sink.close();

        assertEquals(10, writer.games().size());
        assertEquals(10, loop.gamesWritten());
        assertEquals(20, writer.rowsWritten());
        List<String> records = Files.readAllLines(sink.file());
        assertEquals(10, records.size());
        assertEquals("(;GM[1]GN[game-0])", records.get(0));
    }

    @Test
    void shouldKeepDrainingAfterWriteFailure() throws Exception {
        RecordingTrainingDataWriter writer = new RecordingTrainingDataWriter();
        writer.failNextWrites(1);
        DataWriteLoop loop = new DataWriteLoop("a", "val", new GameDataQueue(4), writer, null);
        loop.start();

        loop.enqueue(TestGames.game(0, "a", 1));
        loop.enqueue(TestGames.game(1, "a", 1));
        loop.finish();

        assertEquals(1, loop.writeFailures());
        assertEquals(1, loop.gamesWritten());
        assertEquals(1, writer.games().get(0).gameIndex());
    }

    @Test
    void shouldSurviveUncheckedWriterFailure() {
        RecordingTrainingDataWriter writer = new RecordingTrainingDataWriter() {
            @Override
            public synchronized void writeGame(FinishedGameData game) throws IOException {
                if (game.gameIndex() == 0) {
                    throw new IllegalArgumentException("row has wrong shape");
                }
                super.writeGame(game);
            }
        };
        DataWriteLoop loop = new DataWriteLoop("a", "train", new GameDataQueue(1), writer, null);
        loop.start();

        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            for (int i = 0; i < 4; i++) {
                loop.enqueue(TestGames.game(i, "a", 1));
            }
            loop.finish();
        });

        assertEquals(1, loop.writeFailures());
        assertEquals(3, loop.gamesWritten());
        assertEquals(3, writer.games().size());
    }

    @Test
    void shouldSurviveUncheckedRecordSinkFailure() {
        RecordingTrainingDataWriter writer = new RecordingTrainingDataWriter();
        GameRecordSink sink = new GameRecordSink() {
            @Override
            public void write(FinishedGameData game) {
                throw new IllegalStateException("record sink closed underneath");
            }

            @Override
            public void close() {
            }
        };
        DataWriteLoop loop = new DataWriteLoop("a", "train", new GameDataQueue(1), writer, sink);
        loop.start();

        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            for (int i = 0; i < 3; i++) {
                loop.enqueue(TestGames.game(i, "a", 1));
            }
            loop.finish();
        });

        assertEquals(3, loop.writeFailures());
        assertEquals(3, loop.gamesWritten());
    }

    @Test
    void shouldRejectGameEnqueuedAfterFinish() throws Exception {
        RecordingTrainingDataWriter writer = new RecordingTrainingDataWriter();
        DataWriteLoop loop = new DataWriteLoop("a", "train", new GameDataQueue(2), writer, null);
        loop.start();
        loop.enqueue(TestGames.game(0, "a", 1));
        loop.finish();

        assertThrows(IllegalStateException.class, () -> loop.enqueue(TestGames.game(1, "a", 1)));
        assertEquals(1, writer.games().size());
    }

    @Test
    void shouldRefuseSecondStart() throws Exception {
        DataWriteLoop loop = new DataWriteLoop("a", "train", new GameDataQueue(1), new RecordingTrainingDataWriter(), null);
        loop.start();
        assertThrows(IllegalStateException.class, loop::start);
        loop.finish();
    }
}
