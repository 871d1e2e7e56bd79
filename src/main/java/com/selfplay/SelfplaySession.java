package com.selfplay;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.selfplay.inference.SelfplayEngine;
import com.selfplay.inference.SelfplayEngines;
import com.selfplay.manager.SelfplayManager;
import com.selfplay.models.DirectoryModelDiscovery;
import com.selfplay.models.ModelInstaller;
import com.selfplay.models.ModelPollLoop;
import com.selfplay.models.OutputProvisioner;
import com.selfplay.runtime.AppConfig;
import com.selfplay.runtime.ConfigLoader;
import com.selfplay.runtime.LoadedConfig;
import com.selfplay.runtime.SetupResult;
import com.selfplay.shutdown.InterruptibleSleeper;
import com.selfplay.shutdown.ShutdownCoordinator;
import com.selfplay.shutdown.StopSignal;
import com.selfplay.worker.ForkData;
import com.selfplay.worker.GameAdmissionCounter;
import com.selfplay.worker.GameWorkerPool;

/**
 * One self-play run from config load to final teardown. Everything the run creates is released in one
 * place, on every exit path.
 */
public class SelfplaySession {
    private static final Logger log = LoggerFactory.getLogger(SelfplaySession.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_SETUP_FAILURE = 2;
    public static final int EXIT_UNRECOVERABLE = 3;

    private final Path configFile;
    private final Path modelsDir;
    private final Path outputDir;
    private final Function<String, SetupResult<SelfplayEngine>> engineLookup;
    private final StopSignal stopSignal = new StopSignal();

    public SelfplaySession(Path configFile, Path modelsDir, Path outputDir) {
        this(configFile, modelsDir, outputDir, SelfplayEngines::fromClasspath);
    }

    SelfplaySession(
            Path configFile,
            Path modelsDir,
            Path outputDir,
            Function<String, SetupResult<SelfplayEngine>> engineLookup) {
        this.configFile = configFile;
        this.modelsDir = modelsDir;
        this.outputDir = outputDir;
        this.engineLookup = engineLookup;
    }

    public StopSignal stopSignal() {
        return stopSignal;
    }

    public int run() throws InterruptedException {
        SetupResult<LoadedConfig> loaded = new ConfigLoader().load(configFile);
        if (!loaded.isOk()) {
            return setupFailure(loaded.error());
        }
        try {
            Files.createDirectories(outputDir);
            Files.createDirectories(modelsDir);
        } catch (IOException e) {
            return setupFailure("Could not create models or output directory: " + e.getMessage());
        }

        LoadedConfig config = loaded.value();
        log.info("Selfplay engine starting config={} modelsDir={} outputDir={}", configFile, modelsDir, outputDir);

        SetupResult<SelfplayEngine> selected = engineLookup.apply(config.config().getEngine().getName());
        if (!selected.isOk()) {
            return setupFailure(selected.error());
        }
        SelfplayEngine engine = selected.value();
        log.info("Using engine {}", engine.name());

        AppConfig.SelfplayConfig selfplay = config.config().getSelfplay();
        InterruptibleSleeper sleeper = new InterruptibleSleeper();
        ShutdownCoordinator coordinator = new ShutdownCoordinator(stopSignal, sleeper, selfplay.getShutdownGraceMs());
        Runnable releaseEngine = once(engine::globalCleanup);
        ForkData forkData = new ForkData();
        int exitCode = EXIT_UNRECOVERABLE;
        try {
            exitCode = runWithEngine(config, engine, coordinator, sleeper, forkData, releaseEngine);
            return exitCode;
        } finally {
            releaseEngine.run();
            forkData.clear();
            coordinator.markTeardownComplete(exitCode);
        }
    }

    private int runWithEngine(
            LoadedConfig config,
            SelfplayEngine engine,
            ShutdownCoordinator coordinator,
            InterruptibleSleeper sleeper,
            ForkData forkData,
            Runnable releaseEngine) throws InterruptedException {
        try {
            engine.initialize(config);
        } catch (IOException e) {
            return setupFailure("Could not initialize engine " + engine.name() + ": " + e.getMessage());
        }
        AppConfig.SelfplayConfig selfplay = config.config().getSelfplay();
        try (SelfplayManager manager = new SelfplayManager(
                selfplay.getValidationProp(), selfplay.getMaxDataQueueSize(), selfplay.getLogGamesEvery())) {
            return runWithManager(config, engine, manager, coordinator, sleeper, forkData, releaseEngine);
        }
    }

    private int runWithManager(
            LoadedConfig config,
            SelfplayEngine engine,
            SelfplayManager manager,
            ShutdownCoordinator coordinator,
            InterruptibleSleeper sleeper,
            ForkData forkData,
            Runnable releaseEngine) throws InterruptedException {
        AppConfig.SelfplayConfig selfplay = config.config().getSelfplay();
        OutputProvisioner provisioner = new OutputProvisioner(
                outputDir,
                selfplay.getProvisionMaxTries(),
                selfplay.getProvisionRetryMinMs(),
                selfplay.getProvisionRetryJitterMs(),
                sleeper,
                stopSignal);
        ModelInstaller installer = new ModelInstaller(
                manager, new DirectoryModelDiscovery(modelsDir), engine.evaluatorFactory(), provisioner, config);

        SetupResult<Thread> hook = coordinator.installSignalHandlers();
        if (!hook.isOk()) {
            return setupFailure(hook.error());
        }

        Optional<String> initial = installer.installIfNewer(Optional.empty());
        if (initial.isEmpty()) {
            return setupFailure("Either could not load latest model from " + modelsDir + " or access/write appropriate directories");
        }
        log.info("Loaded all config stuff, starting self play with model {}", initial.get());

        GameWorkerPool pool = new GameWorkerPool(
                selfplay.getNumGameThreads(),
                manager,
                engine.gameRunner(),
                new GameAdmissionCounter(selfplay.getNumGamesTotal()),
                forkData,
                stopSignal,
                selfplay.isSwitchNetsMidGame());
        Thread pollThread = new Thread(
                new ModelPollLoop(manager, installer, stopSignal, sleeper, selfplay.getModelPollIntervalMs()),
                "model-poll-loop");
        try {
            pool.start();
            pollThread.start();

            int failedWorkers = pool.awaitWorkers();
            coordinator.completeShutdown(pollThread, manager, releaseEngine);

            if (stopSignal.wasSignalReceived()) {
                log.info("Exited cleanly after signal");
            }
            log.info("All cleaned up, quitting. games={}", pool.gamesCompleted());
            if (failedWorkers > 0) {
                log.error("{} game workers failed", failedWorkers);
                return EXIT_UNRECOVERABLE;
            }
            return EXIT_OK;
        } finally {
            stopSignal.requestStop();
            sleeper.wakeAll();
        }
    }

    private static int setupFailure(String message) {
        log.error("Selfplay setup failed: {}", message);
        return EXIT_SETUP_FAILURE;
    }

    private static Runnable once(Runnable action) {
        AtomicBoolean done = new AtomicBoolean(false);
        return () -> {
            if (done.compareAndSet(false, true)) {
                action.run();
            }
        };
    }
}
