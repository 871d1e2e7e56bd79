package com.selfplay.models;

import java.io.Closeable;
import java.io.IOException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.selfplay.inference.Evaluator;
import com.selfplay.inference.EvaluatorFactory;
import com.selfplay.manager.SelfplayManager;
import com.selfplay.pipeline.FileGameRecordSink;
import com.selfplay.pipeline.GameRecordSink;
import com.selfplay.pipeline.ShardedTrainingDataWriter;
import com.selfplay.pipeline.TrainingDataWriter;
import com.selfplay.pipeline.WriterSettings;
import com.selfplay.runtime.AppConfig;
import com.selfplay.runtime.LoadedConfig;

/**
 * Finds the newest model, provisions its output directories, builds its evaluator and writers and
 * installs it into the {@link SelfplayManager}.
 */
public class ModelInstaller {
    private static final Logger log = LoggerFactory.getLogger(ModelInstaller.class);

    private final SelfplayManager manager;
    private final ModelDiscovery discovery;
    private final EvaluatorFactory evaluatorFactory;
    private final OutputProvisioner provisioner;
    private final LoadedConfig loadedConfig;
    private final Random random = new Random();

    public ModelInstaller(
            SelfplayManager manager,
            ModelDiscovery discovery,
            EvaluatorFactory evaluatorFactory,
            OutputProvisioner provisioner,
            LoadedConfig loadedConfig) {
        this.manager = manager;
        this.discovery = discovery;
        this.evaluatorFactory = evaluatorFactory;
        this.provisioner = provisioner;
        this.loadedConfig = loadedConfig;
    }

    /**
     * @param currentLatest name of the model currently latest, if any
     * @return the name of the model just installed, or empty if there was nothing new or it could not be
     *         set up this time
     */
    public Optional<String> installIfNewer(Optional<String> currentLatest) throws InterruptedException {
        Optional<ModelCandidate> found;
        try {
            found = discovery.findLatest();
        } catch (IOException e) {
            log.warn("selfplay.discovery.failed reason={}", e.getMessage(), e);
            return Optional.empty();
        }
        if (found.isEmpty() || found.get().name().equals(currentLatest.orElse(null))) {
            return Optional.empty();
        }
        ModelCandidate candidate = found.get();
        if (manager.modelNames().contains(candidate.name())) {
            log.debug("Model {} is already installed and draining, ignoring", candidate.name());
            return Optional.empty();
        }
        log.info("Found new model {} at {}", candidate.name(), candidate.modelFile());

        Optional<ModelOutputDirs> provisioned = provisioner.provision(candidate.name());
        if (provisioned.isEmpty()) {
            return Optional.empty();
        }
        ModelOutputDirs dirs = provisioned.get();
        try {
            provisioner.writeConfigSnapshot(dirs, loadedConfig.rawContents());
        } catch (IOException e) {
            log.warn("Could not write config snapshot for {}: {}", candidate.name(), e.getMessage());
        }

        AppConfig config = loadedConfig.config();
        int maxConcurrentEvals = EvaluatorFactory.concurrencyBudget(
                config.getEngine().getNumSearchThreads(),
                config.getSelfplay().getNumGameThreads());
        Evaluator evaluator;
        try {
            evaluator = evaluatorFactory.create(candidate, maxConcurrentEvals);
        } catch (IOException e) {
            log.error("selfplay.model.load.failed name={} file={} reason={}", candidate.name(), candidate.modelFile(), e.getMessage(), e);
            return Optional.empty();
        }
        log.info("Loaded model {} from {} maxConcurrentEvals={}", evaluator.modelName(), candidate.modelFile(), maxConcurrentEvals);

        GameRecordSink recordSink;
        try {
            recordSink = new FileGameRecordSink(dirs.sgfDir().resolve(randomHex() + ".sgfs"));
        } catch (IOException e) {
            evaluator.close();
            log.error("Could not open game record file for {}: {}", candidate.name(), e.getMessage(), e);
            return Optional.empty();
        }

        AppConfig.SelfplayConfig selfplay = config.getSelfplay();
        int boardLen = config.getEngine().getDataBoardLen();
        int inputsVersion = config.getEngine().getInputsVersion();
        TrainingDataWriter trainWriter = new ShardedTrainingDataWriter(new WriterSettings(
                dirs.trainDir(), selfplay.getMaxRowsPerTrainFile(), selfplay.getFirstFileRandMinProp(), boardLen, boardLen, inputsVersion));
        TrainingDataWriter validationWriter = new ShardedTrainingDataWriter(new WriterSettings(
                dirs.validationDir(), selfplay.getMaxRowsPerValFile(), selfplay.getFirstFileRandMinProp(), boardLen, boardLen, inputsVersion));

        // keyed by the discovered name so the already-installed check above matches on the next poll
        try {
            manager.loadModelAndStartDataWriting(candidate.name(), evaluator, trainWriter, validationWriter, recordSink);
        } catch (RuntimeException e) {
            closeQuietly(trainWriter, candidate.name(), "train writer");
            closeQuietly(validationWriter, candidate.name(), "validation writer");
            closeQuietly(recordSink, candidate.name(), "record sink");
            evaluator.close();
            throw e;
        }
        return Optional.of(candidate.name());
    }

    private static void closeQuietly(Closeable closeable, String modelName, String what) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.warn("selfplay.model.close.failed name={} resource={} reason={}", modelName, what, e.getMessage(), e);
        }
    }

    private String randomHex() {
        return HexFormat.of().toHexDigits(random.nextLong()).toUpperCase();
    }
}
