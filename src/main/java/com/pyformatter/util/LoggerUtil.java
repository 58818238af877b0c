package com.pyformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Configures java.util.logging for the formatter and hands out class loggers.
 * Console output is on by default; a log file is only attached on request.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static final String BASE_PACKAGE = "com.pyformatter";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.WARNING;

    /**
     * Reads {@code /logging.properties} from the classpath, or falls back to a plain console handler.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try {
            try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
                if (is != null) {
                    LogManager.getLogManager().readConfiguration(is);
                    initialized = true;
                    return;
                }
            }

            _configureBasicLogging();
            initialized = true;
        } catch (IOException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            e.printStackTrace();
        }
    }

    private static void _configureBasicLogging() {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());

        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.ALL);
    }

    /**
     * Sets the console logging level.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;
        initialize();
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        if (rootLogger.getLevel() == null || rootLogger.getLevel().intValue() > level.intValue()) {
            rootLogger.setLevel(level);
        }
        Logger packageLogger = Logger.getLogger(BASE_PACKAGE);
        if (packageLogger.getLevel() != null && packageLogger.getLevel().intValue() > level.intValue()) {
            packageLogger.setLevel(level);
        }
    }

    /**
     * Writes all log records to {@code path} in addition to the console, replacing any
     * previously attached log file.
     */
    public static synchronized void setLogFilePath(Path path) {
        initialize();
        try {
            for (Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof FileHandler) {
                    rootLogger.removeHandler(handler);
                    handler.close();
                }
            }

            FileHandler fileHandler = new FileHandler(path.toString(), true);
            fileHandler.setLevel(Level.ALL);
            fileHandler.setFormatter(new SimpleFormatter());
            rootLogger.addHandler(fileHandler);
            rootLogger.setLevel(Level.ALL);
        } catch (IOException e) {
            Logger.getLogger(LoggerUtil.class.getName()).log(
                    Level.SEVERE, "Failed to attach log file " + path, e);
        }
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
        for (Handler handler : rootLogger.getHandlers()) {
            handler.close();
        }
    }
}
