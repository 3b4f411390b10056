package com.gdformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.gdformatter.api.CodeFormatter;
import com.gdformatter.api.FormatterPlugin;
import com.gdformatter.api.FormatterResult;
import com.gdformatter.api.error.FormatterError;
import com.gdformatter.api.error.Severity;
import com.gdformatter.config.FormatterConfig;
import com.gdformatter.plugins.FileType;
import com.gdformatter.util.LoggerUtil;

/**
 * Thread-safe driver that routes sources to the plugin registered for their file type.
 * <p>
 * Plugins are stateless after {@link FormatterPlugin#initialize}, so directories are
 * formatted on a fixed thread pool without any locking. A failure in one file is
 * recorded in its result and never stops the batch.
 */
public class AdvancedCodeFormatter implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(AdvancedCodeFormatter.class);

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;
    private final List<PathMatcher> ignoreMatchers;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public AdvancedCodeFormatter(FormatterConfig config) {
        this.config = config;
        this.ignoreMatchers = _compileIgnorePatterns(config.getIgnorePatterns());
        logger.fine("Formatter initialized with " + ignoreMatchers.size() + " ignore patterns");
    }

    /**
     * Registers and initializes a plugin for a file type.
     */
    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugin.initialize(config);
        plugins.put(fileType, plugin);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    /**
     * Formats a single source with the plugin registered for its path. A null path
     * (standard input) is treated as GDScript.
     */
    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = filePath == null ? FileType.GDSCRIPT : FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FormatterResult.builder()
                    .successful(false)
                    .originalCode(sourceCode)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.ERROR,
                            "No plugin registered for file type: " + fileType,
                            1, 0))
                    .build();
        }

        processedFileCount.incrementAndGet();
        try {
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Formatted: " + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.fine("Not formatted: " + filePath + " - " +
                        result.getErrors().stream()
                                .filter(e -> e.getSeverity().isBlocking())
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }
            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);

            return FormatterResult.builder()
                    .successful(false)
                    .originalCode(sourceCode)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.FATAL,
                            "Unexpected error: " + e.getMessage(),
                            1, 0))
                    .build();
        }
    }

    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Formats every supported file below {@code directory} on {@code threadCount} threads.
     *
     * @return results keyed by path, in path order
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        List<Path> filesToProcess;
        try {
            filesToProcess = findFiles(directory);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return new TreeMap<>();
        }

        logger.fine("Found " + filesToProcess.size() + " files to process in " + directory);
        if (filesToProcess.isEmpty()) {
            return new TreeMap<>();
        }

        Map<Path, Future<FormatterResult>> futures = new LinkedHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : filesToProcess) {
                futures.put(file, executor.submit(() -> _formatPath(file)));
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                    logger.warning("Timeout waiting for file processing to complete");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Processing interrupted", e);
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }

        Map<Path, FormatterResult> results = new TreeMap<>();
        for (Map.Entry<Path, Future<FormatterResult>> entry : futures.entrySet()) {
            results.put(entry.getKey(), _collect(entry.getKey(), entry.getValue()));
        }
        logger.fine("Processed " + results.size() + " files");
        return results;
    }

    // Errors thrown past formatFile (StackOverflowError on deep nesting) still yield a result.
    private FormatterResult _collect(Path file, Future<FormatterResult> future) {
        if (!future.isDone()) {
            future.cancel(true);
            errorCount.incrementAndGet();
            return _fatal("Formatting did not finish");
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + file, e.getCause());
            return _fatal("Unexpected error: " + e.getCause());
        } catch (CancellationException | InterruptedException e) {
            errorCount.incrementAndGet();
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return _fatal("Formatting did not finish");
        }
    }

    private static FormatterResult _fatal(String message) {
        return FormatterResult.builder()
                .successful(false)
                .addError(new FormatterError(Severity.FATAL, message, 1, 0))
                .build();
    }

    /**
     * Supported files at or below {@code path}, in path order, minus those matching an
     * ignore pattern. A regular file is returned as-is when it is supported.
     */
    public List<Path> findFiles(Path path) throws IOException {
        if (Files.isRegularFile(path)) {
            return _isSupported(path) ? List.of(path) : List.of();
        }
        if (!Files.isDirectory(path)) {
            logger.warning("Path does not exist: " + path);
            return List.of();
        }

        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile)
                    .filter(this::_isSupported)
                    .filter(p -> !isIgnored(path.relativize(p)))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Whether a path relative to the formatted root matches one of the configured
     * {@code ignoreFiles} globs. A leading {@code **}{@code /} also matches at the root.
     */
    public boolean isIgnored(Path relativePath) {
        Path normalized = relativePath.normalize();
        for (PathMatcher matcher : ignoreMatchers) {
            if (matcher.matches(normalized)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> _compileIgnorePatterns(List<String> patterns) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : patterns) {
            String glob = pattern.replace('\\', '/');
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            if (glob.startsWith("**/")) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)));
            }
        }
        return matchers;
    }

    private boolean _isSupported(Path file) {
        FileType type = FileType.detect(file);
        return type != FileType.UNKNOWN && plugins.containsKey(type);
    }

    private FormatterResult _formatPath(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return formatFile(file, content);
        } catch (IOException e) {
            errorCount.incrementAndGet();
            logger.log(Level.WARNING, "Failed to read file: " + file, e);
            return _fatal("Failed to read file: " + e.getMessage());
        }
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    /**
     * Closes every plugin that holds resources, reporting the first failure.
     */
    @Override
    public void close() throws Exception {
        logger.fine("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;
        for (Map.Entry<FileType, FormatterPlugin> entry : plugins.entrySet()) {
            FormatterPlugin plugin = entry.getValue();
            if (plugin instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }
        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }
}
