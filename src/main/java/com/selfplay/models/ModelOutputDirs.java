package com.selfplay.models;

import java.nio.file.Path;

/**
 * Output layout of one model: {@code <output-dir>/<model>/{sgfs,tdata,vdata}}.
 */
public record ModelOutputDirs(Path modelDir, Path sgfDir, Path trainDir, Path validationDir) {

    public static ModelOutputDirs under(Path outputRoot, String modelName) {
        Path modelDir = outputRoot.resolve(modelName);
        return new ModelOutputDirs(modelDir, modelDir.resolve("sgfs"), modelDir.resolve("tdata"), modelDir.resolve("vdata"));
    }
}
