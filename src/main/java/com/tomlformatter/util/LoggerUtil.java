package com.tomlformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.*;

/**
 * Configures java.util.logging from the bundled {@code logging.properties} and applies the
 * command line's console level and optional log file.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;

    private static synchronized void _initialize() {
        if (initialized) {
            return;
        }
        initialized = true;

        try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
            if (is == null) {
                System.err.println("Logging configuration not found: " + DEFAULT_LOG_CONFIG);
                return;
            }
            LogManager.getLogManager().readConfiguration(is);
        } catch (IOException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
        }
    }

    /**
     * Sets the level of the console handler, lowering the root level when it would filter
     * the requested records out.
     */
    public static synchronized void setConsoleLevel(Level level) {
        _initialize();

        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        if (rootLogger.getLevel() != null && rootLogger.getLevel().intValue() > level.intValue()) {
            rootLogger.setLevel(level);
        }
    }

    /**
     * Writes all records that pass the root level to {@code path} (appending), replacing
     * any log file set before.
     */
    public static synchronized void setLogFilePath(Path path) {
        _initialize();

        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof FileHandler) {
                rootLogger.removeHandler(handler);
                handler.close();
            }
        }

        try {
            FileHandler fileHandler = new FileHandler(path.toString(), true);
            fileHandler.setLevel(Level.ALL);
            fileHandler.setFormatter(new SimpleFormatter());
            rootLogger.addHandler(fileHandler);
        } catch (IOException e) {
            Logger.getLogger(LoggerUtil.class.getName()).log(
                    Level.SEVERE, "Failed to open log file: " + path, e);
        }
    }

    /**
     * Maps a configured log level name to a JUL level.
     * DEBUG becomes FINE; ERROR and CRITICAL both become SEVERE.
     */
    public static Level toLevel(String logLevel) {
        switch (logLevel.toUpperCase(Locale.ROOT)) {
            case "DEBUG":
                return Level.FINE;
            case "WARNING":
                return Level.WARNING;
            case "ERROR":
            case "CRITICAL":
                return Level.SEVERE;
            case "INFO":
                return Level.INFO;
            default:
                throw new IllegalArgumentException("Unknown log level: " + logLevel);
        }
    }

    /**
     * Gets a logger for a specific class.
     */
    public static Logger getLogger(Class<?> clazz) {
        _initialize();
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Flushes and closes every root handler.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.close();
        }
    }
}
