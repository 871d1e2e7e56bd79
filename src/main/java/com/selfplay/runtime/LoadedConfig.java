package com.selfplay.runtime;

import java.nio.file.Path;
import java.util.List;

/**
 * Parsed configuration plus the exact file text, which is snapshotted next to every model's output.
 */
public record LoadedConfig(Path source, AppConfig config, String rawContents, List<String> unknownKeys) {
}
