package com.selfplay.models;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HexFormat;
import java.util.Optional;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.selfplay.shutdown.InterruptibleSleeper;
import com.selfplay.shutdown.StopSignal;

/**
 * Creates a model's output directories. Sibling processes sharing the output root may race on the same
 * directories, so failures are retried a fixed number of times with a randomized pause in between.
 */
public class OutputProvisioner {
    private static final Logger log = LoggerFactory.getLogger(OutputProvisioner.class);

    private final Path outputRoot;
    private final int maxTries;
    private final long retryMinMs;
    private final long retryJitterMs;
    private final InterruptibleSleeper sleeper;
    private final StopSignal stopSignal;
    private final DirectoryCreator directoryCreator;
    private final Random random;

    public OutputProvisioner(
            Path outputRoot,
            int maxTries,
            long retryMinMs,
            long retryJitterMs,
            InterruptibleSleeper sleeper,
            StopSignal stopSignal) {
        this(outputRoot, maxTries, retryMinMs, retryJitterMs, sleeper, stopSignal, dir -> Files.createDirectories(dir), new Random());
    }

    OutputProvisioner(
            Path outputRoot,
            int maxTries,
            long retryMinMs,
            long retryJitterMs,
            InterruptibleSleeper sleeper,
            StopSignal stopSignal,
            DirectoryCreator directoryCreator,
            Random random) {
        if (maxTries < 1) {
            throw new IllegalArgumentException("maxTries must be >= 1");
        }
        this.outputRoot = outputRoot;
        this.maxTries = maxTries;
        this.retryMinMs = retryMinMs;
        this.retryJitterMs = retryJitterMs;
        this.sleeper = sleeper;
        this.stopSignal = stopSignal;
        this.directoryCreator = directoryCreator;
        this.random = random;
    }

    /**
     * @return the created directories, or empty if every attempt failed or stop was requested while
     *         waiting to retry
     */
    public Optional<ModelOutputDirs> provision(String modelName) throws InterruptedException {
        ModelOutputDirs dirs = ModelOutputDirs.under(outputRoot, modelName);
        for (int attempt = 1; attempt <= maxTries; attempt++) {
            try {
                directoryCreator.create(dirs.modelDir());
                directoryCreator.create(dirs.sgfDir());
                directoryCreator.create(dirs.trainDir());
                directoryCreator.create(dirs.validationDir());
                return Optional.of(dirs);
            } catch (IOException e) {
                if (attempt == maxTries) {
                    log.error("Could not make selfplay model directories for {} after {} attempts, is something wrong with the filesystem?",
                            modelName, maxTries, e);
                    return Optional.empty();
                }
                long backoffMs = retryMinMs + (retryJitterMs > 0 ? (long) (random.nextDouble() * retryJitterMs) : 0L);
                log.warn("selfplay.provision.retry model={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        modelName, attempt, maxTries, backoffMs, e.getMessage());
                if (sleeper.sleep(backoffMs, stopSignal) && stopSignal.isStopRequested()) {
                    log.info("Stop requested while provisioning {}, giving up", modelName);
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Copies the active configuration next to the model's outputs for reproducibility.
     */
    public Path writeConfigSnapshot(ModelOutputDirs dirs, String rawConfig) throws IOException {
        Path snapshot = dirs.modelDir().resolve("selfplay-" + HexFormat.of().toHexDigits(random.nextLong()).toUpperCase() + ".cfg");
        Files.writeString(snapshot, rawConfig == null ? "" : rawConfig);
        return snapshot;
    }

    @FunctionalInterface
    interface DirectoryCreator {
        void create(Path dir) throws IOException;
    }
}
