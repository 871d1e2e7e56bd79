package com.selfplay.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.DeserializationProblemHandler;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public SetupResult<LoadedConfig> load(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            return SetupResult.failed("Config file not found: " + configPath.toAbsolutePath().normalize());
        }

        String raw;
        AppConfig config;
        List<String> unknownKeys = new ArrayList<>();
        try {
            raw = Files.readString(configPath);
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
                    .addHandler(new UnknownKeyCollector(unknownKeys));
            config = raw.isBlank() ? new AppConfig() : mapper.readValue(raw, AppConfig.class);
        } catch (IOException e) {
            return SetupResult.failed("Could not parse config file " + configPath + ": " + e.getMessage());
        }
        if (config == null) {
            config = new AppConfig();
        }

        String violation = validate(config);
        if (violation != null) {
            return SetupResult.failed("Invalid config " + configPath + ": " + violation);
        }
        for (String key : unknownKeys) {
            log.warn("Unused config key: {}", key);
        }
        return SetupResult.ok(new LoadedConfig(configPath, config, raw, List.copyOf(unknownKeys)));
    }

    static String validate(AppConfig config) {
        AppConfig.SelfplayConfig selfplay = config.getSelfplay();
        AppConfig.EngineConfig engine = config.getEngine();
        if (selfplay.getNumGameThreads() < 1 || selfplay.getNumGameThreads() > 16384) {
            return "selfplay.numGameThreads must be within [1, 16384]";
        }
        if (selfplay.getNumGamesTotal() < 1 || selfplay.getNumGamesTotal() > (1L << 62)) {
            return "selfplay.numGamesTotal must be within [1, 2^62]";
        }
        if (selfplay.getMaxDataQueueSize() < 1 || selfplay.getMaxDataQueueSize() > 1_000_000) {
            return "selfplay.maxDataQueueSize must be within [1, 1000000]";
        }
        if (selfplay.getMaxRowsPerTrainFile() < 1 || selfplay.getMaxRowsPerTrainFile() > 100_000_000) {
            return "selfplay.maxRowsPerTrainFile must be within [1, 100000000]";
        }
        if (selfplay.getMaxRowsPerValFile() < 1 || selfplay.getMaxRowsPerValFile() > 100_000_000) {
            return "selfplay.maxRowsPerValFile must be within [1, 100000000]";
        }
        if (selfplay.getFirstFileRandMinProp() < 0.0 || selfplay.getFirstFileRandMinProp() > 1.0) {
            return "selfplay.firstFileRandMinProp must be within [0, 1]";
        }
        if (selfplay.getValidationProp() < 0.0 || selfplay.getValidationProp() > 0.5) {
            return "selfplay.validationProp must be within [0, 0.5]";
        }
        if (selfplay.getLogGamesEvery() < 1 || selfplay.getLogGamesEvery() > 1_000_000) {
            return "selfplay.logGamesEvery must be within [1, 1000000]";
        }
        if (selfplay.getModelPollIntervalMs() < 0 || selfplay.getShutdownGraceMs() < 0) {
            return "selfplay intervals must be >= 0";
        }
        if (selfplay.getProvisionMaxTries() < 1) {
            return "selfplay.provisionMaxTries must be >= 1";
        }
        if (selfplay.getProvisionRetryMinMs() < 0 || selfplay.getProvisionRetryJitterMs() < 0) {
            return "selfplay provisioning backoff must be >= 0";
        }
        if (engine.getNumSearchThreads() < 1) {
            return "engine.numSearchThreads must be >= 1";
        }
        if (engine.getDataBoardLen() < 9 || engine.getDataBoardLen() > 37) {
            return "engine.dataBoardLen must be within [9, 37]";
        }
        if (engine.getInputsVersion() < 0 || engine.getInputsVersion() > 10000) {
            return "engine.inputsVersion must be within [0, 10000]";
        }
        return null;
    }

    private static final class UnknownKeyCollector extends DeserializationProblemHandler {
        private final List<String> unknownKeys;

        private UnknownKeyCollector(List<String> unknownKeys) {
            this.unknownKeys = unknownKeys;
        }

        @Override
        public boolean handleUnknownProperty(
                DeserializationContext ctxt,
                JsonParser p,
                JsonDeserializer<?> deserializer,
                Object beanOrClass,
                String propertyName) throws IOException {
            String owner = beanOrClass instanceof Class<?> type ? type.getSimpleName() : beanOrClass.getClass().getSimpleName();
            unknownKeys.add(owner + "." + propertyName);
            p.skipChildren();
            return true;
        }
    }
}
