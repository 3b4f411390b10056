package com.gdformatter.cli;

import com.gdformatter.api.FormatterResult;
import com.gdformatter.api.error.FormatterError;
import com.gdformatter.api.error.Severity;
import com.gdformatter.config.ConfigurationLoader;
import com.gdformatter.config.FormatterConfig;
import com.gdformatter.core.AdvancedCodeFormatter;
import com.gdformatter.plugins.FileType;
import com.gdformatter.plugins.gdscript.GDScriptFormatter;
import com.gdformatter.util.DiffPrinter;
import com.gdformatter.util.ErrorFormatter;
import com.gdformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line interface of the GDScript formatter.
 * <p>
 * Exit codes: 0 when nothing needs to change, 1 when {@code check}, {@code --diff}
 * or {@code --stdout} found files that would be reformatted, 2 on usage errors,
 * I/O errors and failures while formatting standard input.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    private static final String STDIN_NAME = "<stdin>";

    static final int EXIT_OK = 0;
    static final int EXIT_CHANGES = 1;
    static final int EXIT_ERROR = 2;

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private ErrorFormatter errorFormatter = new ErrorFormatter(false);

    FormatterCli(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new FormatterCli(System.in, System.out, System.err).run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    int run(String[] args) {
        boolean useColors = !_hasOption(args, "--no-color") && System.console() != null;
        errorFormatter = new ErrorFormatter(useColors);

        if (_hasOption(args, "--verbose")) {
            LoggerUtil.setConsoleLevel(Level.FINE);
        } else {
            LoggerUtil.setConsoleLevel(Level.WARNING);
        }

        if (args.length < 1) {
            _printUsage();
            return EXIT_ERROR;
        }

        try {
            String logFile = _getOptionValue(args, "--log-file");
            if (logFile != null) {
                LoggerUtil.addLogFile(Paths.get(logFile));
            }

            String command = args[0];
            switch (command) {
                case "format":
                    return _format(args, _hasOption(args, "--check"));
                case "check":
                    return _format(args, true);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    out.println("gdformat " + VERSION);
                    return EXIT_OK;
                case "--help":
                case "-h":
                    _printUsage();
                    return EXIT_OK;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return EXIT_ERROR;
            }
        } catch (UsageException e) {
            _printError("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.FINE, "I/O failure", e);
            return EXIT_ERROR;
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!_hasOption(args, "--verbose")) {
                _printInfo("Use --verbose for stack trace");
            }
            return EXIT_ERROR;
        }
    }

    private void _printUsage() {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "GDScript formatter v" + VERSION));
        out.println("Usage:");
        out.println("  gdformat format <path>...          - Format files in place");
        out.println("  gdformat check <path>...           - Report files that would be reformatted");
        out.println("  gdformat format --stdin            - Format standard input to standard output");
        out.println("  gdformat init [dir] [--force]      - Write a default .gdformatter.yml");
        out.println("  gdformat --help|-h                 - Show this help");
        out.println("  gdformat --version|-v              - Show version information");
        out.println();
        out.println("Options:");
        out.println("  --check                            - Same as the check command");
        out.println("  --diff                             - Print a unified diff instead of writing");
        out.println("  --stdout                           - Print formatted text instead of writing");
        out.println("  --stdin                            - Read the source from standard input");
        out.println("  --reorder                          - Reorder declarations into canonical order");
        out.println("  --use-spaces=<n>                   - Indent with n spaces instead of tabs");
        out.println("  --line-length=<n>                  - Maximum line length (default: 100)");
        out.println("  --unsafe-skip-checks               - Skip the safety checks (not recommended)");
        out.println("  --config=<file>                    - Use a specific config file (default: nearest .gdformatter.yml)");
        out.println("  --verbose                          - Show detailed output");
        out.println("  --log-file=<file>                  - Also append log records to a file");
        out.println("  --no-color                         - Disable colored output");
    }

    private int _format(String[] args, boolean check) throws Exception {
        boolean diff = _hasOption(args, "--diff");
        boolean toStdout = _hasOption(args, "--stdout");
        boolean verbose = _hasOption(args, "--verbose");
        List<Path> paths = _positionalPaths(args);

        FormatterConfig config = _loadConfig(args, paths);

        try (AdvancedCodeFormatter formatter = _createFormatter(config)) {
            if (_hasOption(args, "--stdin")) {
                return _formatStdin(formatter, check, diff);
            }

            if (paths.isEmpty()) {
                throw new UsageException("Missing path argument");
            }
            for (Path path : paths) {
                if (!Files.exists(path)) {
                    throw new UsageException("Path does not exist: " + path);
                }
            }

            List<Path> files = new ArrayList<>();
            for (Path path : paths) {
                files.addAll(formatter.findFiles(path));
            }
            logger.fine("Found " + files.size() + " files");

            Instant start = Instant.now();
            Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();
            int changedCount = 0;
            int skippedCount = 0;

            for (Path file : files) {
                String source = Files.readString(file, StandardCharsets.UTF_8);
                FormatterResult result = formatter.formatFile(file, source);

                if (!result.isSuccessful()) {
                    errorsByFile.put(file, result.getErrors());
                    _reportFailure(file, result);
                    skippedCount++;
                    if (toStdout) {
                        out.print(source);
                    }
                    continue;
                }

                if (verbose) {
                    result.getErrors(Severity.INFO).forEach(e ->
                            _printInfo(file + ": " + errorFormatter.formatError(e)));
                    result.getAppliedRefactorings().forEach(r ->
                            _printInfo(file + ": " + r.getDescription()));
                }

                boolean changed = result.isChanged();
                if (changed) {
                    changedCount++;
                }

                if (check) {
                    if (changed) {
                        out.println("Would reformat: " + file);
                    }
                } else if (diff) {
                    if (changed) {
                        out.print(new DiffPrinter(errorFormatter)
                                .render(file.toString(), source, result.getFormattedCode()));
                    }
                } else if (toStdout) {
                    out.print(result.getFormattedCode());
                } else if (changed) {
                    Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                    _printSuccess("Formatted: " + file);
                }
            }

            if (verbose) {
                Duration duration = Duration.between(start, Instant.now());
                err.println();
                err.println((check ? "Check" : "Formatting") + " complete in " + _formatDuration(duration) + ":");
                err.println("  Processed files: " + files.size());
                err.println("  " + (check || diff || toStdout ? "Would reformat: " : "Reformatted: ") + changedCount);
                err.println("  Skipped files: " + skippedCount);
                if (!errorsByFile.isEmpty()) {
                    err.println(errorFormatter.formatErrorSummary(errorsByFile));
                }
            }

            boolean reportOnly = check || diff || toStdout;
            return reportOnly && changedCount > 0 ? EXIT_CHANGES : EXIT_OK;
        }
    }

    /**
     * Standard input has no file to leave untouched, so any failure is fatal here.
     */
    private int _formatStdin(AdvancedCodeFormatter formatter, boolean check, boolean diff) throws IOException {
        String source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        FormatterResult result = formatter.formatFile(null, source);

        if (!result.isSuccessful()) {
            for (FormatterError error : result.getErrors()) {
                if (error.getSeverity().isBlocking()) {
                    _printError(STDIN_NAME + ": " + errorFormatter.formatError(error));
                }
            }
            return EXIT_ERROR;
        }

        boolean changed = result.isChanged();
        if (check) {
            return changed ? EXIT_CHANGES : EXIT_OK;
        }
        if (diff) {
            out.print(new DiffPrinter(errorFormatter).render(STDIN_NAME, source, result.getFormattedCode()));
            return changed ? EXIT_CHANGES : EXIT_OK;
        }
        out.print(result.getFormattedCode());
        return EXIT_OK;
    }

    private void _reportFailure(Path file, FormatterResult result) {
        for (FormatterError error : result.getErrors()) {
            if (error.getSeverity() == Severity.FATAL) {
                _printError("Error formatting " + file + ": " + errorFormatter.formatError(error));
            } else if (error.getSeverity() == Severity.ERROR) {
                _printWarning("Warning: skipping " + file + " - " + error.getMessage());
            }
        }
    }

    private int _initializeConfig(String[] args) throws IOException {
        List<Path> paths = _positionalPaths(args);
        Path directory = paths.isEmpty() ? Paths.get("") : paths.get(0);
        Path configPath = directory.resolve(ConfigurationLoader.CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            err.println("Use --force to overwrite it");
            return EXIT_OK;
        }

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    /**
     * Explicit {@code --config}, else the nearest {@code .gdformatter.yml} above the
     * first path, else the bundled defaults. Command line flags are applied on top.
     */
    private FormatterConfig _loadConfig(String[] args, List<Path> paths) {
        String configFile = _getOptionValue(args, "--config");
        FormatterConfig config;
        if (configFile != null) {
            Path configPath = Paths.get(configFile);
            if (!Files.isRegularFile(configPath)) {
                throw new UsageException("Config file does not exist: " + configFile);
            }
            config = ConfigurationLoader.loadConfig(configPath);
        } else {
            Path start = paths.isEmpty() ? Paths.get("") : paths.get(0);
            config = ConfigurationLoader.loadConfig(ConfigurationLoader.findConfigFile(start));
        }

        String spaces = _getOptionValue(args, "--use-spaces");
        if (spaces != null) {
            config = config.withGeneral("useTabs", false)
                    .withGeneral("indentSize", _parsePositiveInt("--use-spaces", spaces));
        }
        String lineLength = _getOptionValue(args, "--line-length");
        if (lineLength != null) {
            config = config.withGeneral("lineLength", _parsePositiveInt("--line-length", lineLength));
        }
        if (_hasOption(args, "--reorder")) {
            config = config.withPluginConfig(ConfigurationLoader.GDSCRIPT_PLUGIN, "reorder", true);
        }
        if (_hasOption(args, "--unsafe-skip-checks")) {
            config = config.withPluginConfig(ConfigurationLoader.GDSCRIPT_PLUGIN, "safetyChecks", false);
        }
        return config;
    }

    private static AdvancedCodeFormatter _createFormatter(FormatterConfig config) {
        AdvancedCodeFormatter formatter = new AdvancedCodeFormatter(config);
        formatter.registerPlugin(FileType.GDSCRIPT, new GDScriptFormatter());
        return formatter;
    }

    private static int _parsePositiveInt(String option, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 1) {
                throw new UsageException(option + " must be at least 1: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new UsageException("Invalid value for " + option + ": " + value);
        }
    }

    private static List<Path> _positionalPaths(String[] args) {
        List<Path> paths = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            if (!args[i].startsWith("-")) {
                paths.add(Paths.get(args[i]));
            }
        }
        return paths;
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        return String.format("%d min %d sec", seconds / 60, seconds % 60);
    }

    private void _printSuccess(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private void _printError(String message) {
        err.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private void _printWarning(String message) {
        err.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private void _printInfo(String message) {
        err.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }

    /**
     * Bad command line input; reported without a stack trace.
     */
    static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
