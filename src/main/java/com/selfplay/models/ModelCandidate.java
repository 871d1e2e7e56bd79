package com.selfplay.models;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A model found on disk that may be installed.
 */
public record ModelCandidate(String name, Path modelFile, Path modelDir, Instant modifiedAt) {
}
