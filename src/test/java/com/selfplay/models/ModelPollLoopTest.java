package com.selfplay.models;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.selfplay.manager.ModelHandle;
import com.selfplay.manager.SelfplayManager;
import com.selfplay.runtime.AppConfig;
import com.selfplay.shutdown.InterruptibleSleeper;
import com.selfplay.shutdown.StopSignal;
import com.selfplay.testing.FakeEvaluator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelPollLoopTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldInstallNewModelAndDrainPreviousOne() throws Exception {
        Path modelsDir = tempDir.resolve("models");
        publish(modelsDir, "net-1", "2024-01-01T00:00:00Z");
        try (SelfplayManager manager = new SelfplayManager(0.0, 4, 10)) {
            ModelPollLoop loop = pollLoop(manager, modelsDir, new StopSignal(), new InterruptibleSleeper(), 60_000);
            assertTrue(loop.pollOnce());
            ModelHandle held = manager.acquireLatest();
            assertFalse(loop.pollOnce());

            publish(modelsDir, "net-2", "2024-01-02T00:00:00Z");
            assertTrue(loop.pollOnce());

            assertEquals(Optional.of("net-2"), manager.getLatestModelName());
            assertTrue(held.isDraining());
            assertFalse(held.isFinalized());
            manager.release(held);
            assertTrue(held.isFinalized());
            assertEquals(List.of("net-2"), manager.modelNames());
        }
    }

    @Test
    void shouldSurviveInstallerFailure() throws Exception {
        Path modelsDir = tempDir.resolve("models");
        publish(modelsDir, "net-1", "2024-01-01T00:00:00Z");
        try (SelfplayManager manager = new SelfplayManager(0.0, 4, 10)) {
            ModelInstaller installer = ModelInstallerTest.installer(
                    manager, modelsDir, tempDir.resolve("output"),
                    (candidate, max) -> {
                        throw new IllegalStateException("engine refused model");
                    },
                    new AppConfig());
            ModelPollLoop loop = new ModelPollLoop(manager, installer, new StopSignal(), new InterruptibleSleeper(), 60_000);

            assertFalse(loop.pollOnce());
            assertTrue(manager.modelNames().isEmpty());
        }
    }

    @Test
    void shouldWakeFromLongSleepAndDrainEverythingOnStop() throws Exception {
        Path modelsDir = tempDir.resolve("models");
        publish(modelsDir, "net-1", "2024-01-01T00:00:00Z");
        StopSignal stopSignal = new StopSignal();
        InterruptibleSleeper sleeper = new InterruptibleSleeper();
        try (SelfplayManager manager = new SelfplayManager(0.0, 4, 10)) {
            ModelPollLoop loop = pollLoop(manager, modelsDir, stopSignal, sleeper, 600_000);
            Thread thread = new Thread(loop, "model-poll-loop-test");
            thread.start();

            assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
                while (manager.getLatestModelName().isEmpty()) {
                    Thread.sleep(10);
                }
                stopSignal.requestStop();
                sleeper.wakeAll();
                thread.join();
            });

            assertTrue(manager.modelNames().isEmpty());
        }
    }

    @Test
    void shouldRejectDrainWhenNothingIsInstalled() {
        try (SelfplayManager manager = new SelfplayManager(0.0, 4, 10)) {
            ModelPollLoop loop = pollLoop(manager, tempDir, new StopSignal(), new InterruptibleSleeper(), 1);
            assertThrows(IllegalStateException.class, () -> loop.drainAllExcept("net-1"));
        }
    }

    private ModelPollLoop pollLoop(
            SelfplayManager manager, Path modelsDir, StopSignal stopSignal, InterruptibleSleeper sleeper, long intervalMs) {
        ModelInstaller installer = ModelInstallerTest.installer(
                manager, modelsDir, tempDir.resolve("output"),
                (candidate, max) -> new FakeEvaluator(candidate.name()), new AppConfig());
        return new ModelPollLoop(manager, installer, stopSignal, sleeper, intervalMs);
    }

    private static void publish(Path modelsDir, String name, String modifiedAt) throws Exception {
        Path dir = Files.createDirectories(modelsDir.resolve(name));
        Path file = Files.writeString(dir.resolve("model.bin.gz"), "weights");
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse(modifiedAt)));
    }
}
