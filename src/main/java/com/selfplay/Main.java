package com.selfplay;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "selfplay",
        mixinStandardHelpOptions = true,
        version = "selfplay 0.1.0",
        description = "Generate training data via self play, picking up newly trained models as they appear.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_ARGUMENT_ERROR = 1;

    @Spec
    CommandSpec spec;

    @Option(names = "--config-file", required = true, paramLabel = "FILE", description = "Config file to use")
    Path configFile;

    @Option(names = "--models-dir", required = true, paramLabel = "DIR", description = "Dir to poll and load models from")
    String modelsDir;

    @Option(names = "--output-dir", required = true, paramLabel = "DIR", description = "Dir to output files")
    String outputDir;

    public static void main(String[] args) {
        int exitCode = newCommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine(Main main) {
        CommandLine commandLine = new CommandLine(main);
        commandLine.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println("Error: " + ex.getMessage());
            failed.usage(failed.getErr());
            return EXIT_ARGUMENT_ERROR;
        });
        commandLine.setExecutionExceptionHandler((ex, failed, parseResult) -> {
            log.error("Selfplay terminated with an unrecoverable error", ex);
            return SelfplaySession.EXIT_UNRECOVERABLE;
        });
        return commandLine;
    }

    @Override
    public Integer call() throws Exception {
        if (modelsDir == null || modelsDir.isBlank()) {
            return argumentError("Empty directory specified for --models-dir");
        }
        if (outputDir == null || outputDir.isBlank()) {
            return argumentError("Empty directory specified for --output-dir");
        }
        return createSession(configFile, Path.of(modelsDir), Path.of(outputDir)).run();
    }

    SelfplaySession createSession(Path config, Path models, Path output) {
        return new SelfplaySession(config, models, output);
    }

    private int argumentError(String message) {
        spec.commandLine().getErr().println("Error: " + message);
        return EXIT_ARGUMENT_ERROR;
    }
}
