package com.gdformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.*;

/**
 * Configures {@code java.util.logging} for the formatter and hands out loggers.
 * <p>
 * All handlers write to standard error so that formatted output on standard
 * output stays clean.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final Logger projectLogger = Logger.getLogger("com.gdformatter");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.INFO;

    /**
     * Reads {@code /logging.properties} from the classpath, or installs a plain
     * console handler when the resource is missing.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }
        initialized = true;

        try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
                return;
            }
        } catch (IOException e) {
            System.err.println("Failed to read logging configuration: " + e.getMessage());
        }
        configureBasicLogging();
    }

    private static void configureBasicLogging() {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(consoleLevel);
    }

    /**
     * Sets the level of console output; {@code FINE} is used for {@code --verbose}.
     */
    public static synchronized void setConsoleLevel(Level level) {
        if (!initialized) {
            initialize();
        }
        consoleLevel = level;
        projectLogger.setLevel(level);
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
    }

    /**
     * Additionally appends every record of the project's loggers to {@code path}.
     */
    public static synchronized void addLogFile(Path path) throws IOException {
        if (!initialized) {
            initialize();
        }
        FileHandler fileHandler = new FileHandler(path.toString(), true);
        fileHandler.setLevel(Level.ALL);
        fileHandler.setFormatter(new SimpleFormatter());
        projectLogger.addHandler(fileHandler);
    }

    /**
     * Gets a logger for a specific class.
     */
    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Flushes and closes every handler.
     */
    public static void shutdown() {
        for (Handler handler : projectLogger.getHandlers()) {
            handler.close();
        }
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
        }
    }
}
