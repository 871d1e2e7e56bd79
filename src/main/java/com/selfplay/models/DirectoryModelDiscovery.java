package com.selfplay.models;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Treats every sub-directory of the models directory holding a {@code model*} file, and every loose
 * model file, as a candidate. The most recently modified candidate wins. Hidden and {@code .tmp}
 * entries are ignored so half-copied models are never picked up.
 */
public class DirectoryModelDiscovery implements ModelDiscovery {
    private final Path modelsDir;

    public DirectoryModelDiscovery(Path modelsDir) {
        this.modelsDir = modelsDir;
    }

    @Override
    public Optional<ModelCandidate> findLatest() throws IOException {
        if (!Files.isDirectory(modelsDir)) {
            return Optional.empty();
        }
        List<ModelCandidate> candidates = new ArrayList<>();
        try (Stream<Path> entries = Files.list(modelsDir)) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                String fileName = entry.getFileName().toString();
                if (fileName.startsWith(".") || fileName.endsWith(".tmp")) {
                    continue;
                }
                toCandidate(entry, fileName).ifPresent(candidates::add);
            }
        }
        return candidates.stream()
                .max(Comparator.comparing(ModelCandidate::modifiedAt).thenComparing(ModelCandidate::name));
    }

    private Optional<ModelCandidate> toCandidate(Path entry, String fileName) throws IOException {
        if (Files.isDirectory(entry)) {
            Optional<Path> modelFile = findModelFile(entry);
            if (modelFile.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new ModelCandidate(
                    fileName,
                    modelFile.get(),
                    entry,
                    Files.getLastModifiedTime(modelFile.get()).toInstant()));
        }
        if (Files.isRegularFile(entry)) {
            int dot = fileName.indexOf('.');
            String name = dot > 0 ? fileName.substring(0, dot) : fileName;
            return Optional.of(new ModelCandidate(name, entry, modelsDir, Files.getLastModifiedTime(entry).toInstant()));
        }
        return Optional.empty();
    }

    private static Optional<Path> findModelFile(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        return name.startsWith("model") && !name.endsWith(".tmp");
                    })
                    .sorted()
                    .findFirst();
        }
    }
}
