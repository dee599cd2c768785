package com.example.slidetranslate.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed {@code translate <input.pptx> [--config path] [--output path] [--mock] [--debug-llm]}
 * command line. The leading {@code translate} word is optional.
 */
public final class CommandLineOptions {

    public static final String USAGE =
        "Usage: translate <input.pptx> [--config path] [--output path] [--mock] [--debug-llm]";
    public static final String DEFAULT_CONFIG = "config.yaml";

    private final Path inputFile;
    private final Path configFile;
    private final Path outputFile;
    private final boolean mock;
    private final boolean debugLlm;

    private CommandLineOptions(Path inputFile, Path configFile, Path outputFile, boolean mock, boolean debugLlm) {
        this.inputFile = inputFile;
        this.configFile = configFile;
        this.outputFile = outputFile;
        this.mock = mock;
        this.debugLlm = debugLlm;
    }

    public static CommandLineOptions parse(String[] args) {
        String input = null;
        String config = DEFAULT_CONFIG;
        String output = null;
        boolean mock = false;
        boolean debugLlm = false;

        int start = args.length > 0 && "translate".equals(args[0]) ? 1 : 0;
        for (int i = start; i < args.length; i++) {
            String arg = args[i];
            if ("--mock".equals(arg)) {
                mock = true;
            } else if ("--debug-llm".equals(arg)) {
                debugLlm = true;
            } else if ("--config".equals(arg) || "-c".equals(arg)) {
                config = requireValue(args, ++i, arg);
            } else if (arg.startsWith("--config=")) {
                config = nonEmpty(arg.substring("--config=".length()), "--config");
            } else if ("--output".equals(arg) || "-o".equals(arg)) {
                output = requireValue(args, ++i, arg);
            } else if (arg.startsWith("--output=")) {
                output = nonEmpty(arg.substring("--output=".length()), "--output");
            } else if (arg.startsWith("-")) {
                throw new CommandLineException("Unknown option: " + arg);
            } else if (input == null) {
                input = arg;
            } else {
                throw new CommandLineException("Unexpected argument: " + arg);
            }
        }

        if (input == null) {
            throw new CommandLineException("Missing input file. " + USAGE);
        }
        return new CommandLineOptions(Paths.get(input), Paths.get(config),
            output == null ? null : Paths.get(output), mock, debugLlm);
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new CommandLineException("Option " + option + " requires a value");
        }
        return nonEmpty(args[index], option);
    }

    private static String nonEmpty(String value, String option) {
        if (value.trim().isEmpty()) {
            throw new CommandLineException("Option " + option + " requires a value");
        }
        return value;
    }

    /**
     * Output path: the one given with {@code --output}, else
     * {@code <input name>_translated.<ext>} next to the input.
     */
    public Path resolveOutputFile() {
        if (outputFile != null) {
            return outputFile;
        }
        return siblingWithSuffix(inputFile, "_translated");
    }

    /**
     * {@code deck.pptx} with suffix {@code _raw} becomes {@code deck_raw.pptx}.
     */
    public static Path siblingWithSuffix(Path file, String suffix) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : "";
        return file.resolveSibling(base + suffix + extension);
    }

    /**
     * Arguments handed to Spring Boot: the configuration file is layered over the
     * packaged defaults and the switches become properties.
     */
    public String[] toSpringArguments() {
        List<String> arguments = new ArrayList<>();
        arguments.add("--spring.config.additional-location=file:" + configFile.toAbsolutePath());
        arguments.add("--ai.mock=" + mock);
        arguments.add("--ai.debug-log.enabled=" + debugLlm);
        return arguments.toArray(new String[0]);
    }

    public Path getInputFile() {
        return inputFile;
    }

    public Path getConfigFile() {
        return configFile;
    }

    public Path getOutputFile() {
        return outputFile;
    }

    public boolean isMock() {
        return mock;
    }

    public boolean isDebugLlm() {
        return debugLlm;
    }
}
