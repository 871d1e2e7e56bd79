package com.selfplay.runtime;

import java.util.HashMap;
import java.util.Map;

public class AppConfig {
    private SelfplayConfig selfplay = new SelfplayConfig();
    private EngineConfig engine = new EngineConfig();

    public SelfplayConfig getSelfplay() {
        return selfplay;
    }

    public void setSelfplay(SelfplayConfig selfplay) {
        this.selfplay = selfplay == null ? new SelfplayConfig() : selfplay;
    }

    public EngineConfig getEngine() {
        return engine;
    }

    public void setEngine(EngineConfig engine) {
        this.engine = engine == null ? new EngineConfig() : engine;
    }

    public static class SelfplayConfig {
        private int numGameThreads = 1;
        private long numGamesTotal = 1L << 62;
        private int maxDataQueueSize = 2000;
        private int maxRowsPerTrainFile = 25000;
        private int maxRowsPerValFile = 25000;
        private double firstFileRandMinProp = 0.15;
        private double validationProp = 0.0;
        private boolean switchNetsMidGame = true;
        private long logGamesEvery = 100;
        private long modelPollIntervalMs = 20000;
        private int provisionMaxTries = 5;
        private long provisionRetryMinMs = 10000;
        private long provisionRetryJitterMs = 30000;
        private long shutdownGraceMs = 60000;

        public int getNumGameThreads() {
            return numGameThreads;
        }

        public void setNumGameThreads(int numGameThreads) {
            this.numGameThreads = numGameThreads;
        }

        public long getNumGamesTotal() {
            return numGamesTotal;
        }

        public void setNumGamesTotal(long numGamesTotal) {
            this.numGamesTotal = numGamesTotal;
        }

        public int getMaxDataQueueSize() {
            return maxDataQueueSize;
        }

        public void setMaxDataQueueSize(int maxDataQueueSize) {
            this.maxDataQueueSize = maxDataQueueSize;
        }

        public int getMaxRowsPerTrainFile() {
            return maxRowsPerTrainFile;
        }

        public void setMaxRowsPerTrainFile(int maxRowsPerTrainFile) {
            this.maxRowsPerTrainFile = maxRowsPerTrainFile;
        }

        public int getMaxRowsPerValFile() {
            return maxRowsPerValFile;
        }

        public void setMaxRowsPerValFile(int maxRowsPerValFile) {
            this.maxRowsPerValFile = maxRowsPerValFile;
        }

        public double getFirstFileRandMinProp() {
            return firstFileRandMinProp;
        }

        public void setFirstFileRandMinProp(double firstFileRandMinProp) {
            this.firstFileRandMinProp = firstFileRandMinProp;
        }

        public double getValidationProp() {
            return validationProp;
        }

        public void setValidationProp(double validationProp) {
            this.validationProp = validationProp;
        }

        public boolean isSwitchNetsMidGame() {
            return switchNetsMidGame;
        }

        public void setSwitchNetsMidGame(boolean switchNetsMidGame) {
            this.switchNetsMidGame = switchNetsMidGame;
        }

        public long getLogGamesEvery() {
            return logGamesEvery;
        }

        public void setLogGamesEvery(long logGamesEvery) {
            this.logGamesEvery = logGamesEvery;
        }

        public long getModelPollIntervalMs() {
            return modelPollIntervalMs;
        }

        public void setModelPollIntervalMs(long modelPollIntervalMs) {
            this.modelPollIntervalMs = modelPollIntervalMs;
        }

        public int getProvisionMaxTries() {
            return provisionMaxTries;
        }

        public void setProvisionMaxTries(int provisionMaxTries) {
            this.provisionMaxTries = provisionMaxTries;
        }

        public long getProvisionRetryMinMs() {
            return provisionRetryMinMs;
        }

        public void setProvisionRetryMinMs(long provisionRetryMinMs) {
            this.provisionRetryMinMs = provisionRetryMinMs;
        }

        public long getProvisionRetryJitterMs() {
            return provisionRetryJitterMs;
        }

        public void setProvisionRetryJitterMs(long provisionRetryJitterMs) {
            this.provisionRetryJitterMs = provisionRetryJitterMs;
        }

        public long getShutdownGraceMs() {
            return shutdownGraceMs;
        }

        public void setShutdownGraceMs(long shutdownGraceMs) {
            this.shutdownGraceMs = shutdownGraceMs;
        }
    }

    public static class EngineConfig {
        private String name;
        private int numSearchThreads = 1;
        private int dataBoardLen = 19;
        private int inputsVersion = 7;
        private Map<String, Object> settings = new HashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getNumSearchThreads() {
            return numSearchThreads;
        }

        public void setNumSearchThreads(int numSearchThreads) {
            this.numSearchThreads = numSearchThreads;
        }

        public int getDataBoardLen() {
            return dataBoardLen;
        }

        public void setDataBoardLen(int dataBoardLen) {
            this.dataBoardLen = dataBoardLen;
        }

        public int getInputsVersion() {
            return inputsVersion;
        }

        public void setInputsVersion(int inputsVersion) {
            this.inputsVersion = inputsVersion;
        }

        public Map<String, Object> getSettings() {
            return settings;
        }

        public void setSettings(Map<String, Object> settings) {
            this.settings = settings == null ? new HashMap<>() : settings;
        }
    }
}
