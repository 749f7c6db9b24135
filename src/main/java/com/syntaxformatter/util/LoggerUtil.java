package com.syntaxformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.*;

/**
 * Sets up java.util.logging for the formatter and hands out loggers.
 * A {@code /logging.properties} resource on the classpath wins over the
 * built-in console setup.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.INFO;
    private static Path logFilePath = null;

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

            _configureConsoleLogging();
            initialized = true;
        } catch (IOException e) {
            // Logging is not up yet, so stderr is the only channel left
            System.err.println("Failed to initialize logging: " + e.getMessage());
            _configureConsoleLogging();
            initialized = true;
        }
    }

    private static void _configureConsoleLogging() {
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
     * Sets the console logging level. Takes effect immediately when logging
     * is already initialized.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;

        if (initialized) {
            for (Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    handler.setLevel(level);
                }
            }
            if (rootLogger.getLevel() == null || rootLogger.getLevel().intValue() > level.intValue()) {
                rootLogger.setLevel(level);
            }
        }
    }

    public static synchronized Level getConsoleLevel() {
        return consoleLevel;
    }

    /**
     * Additionally writes all log records to the given file, replacing any
     * file handler installed before.
     */
    public static synchronized void setLogFilePath(Path path) throws IOException {
        if (!initialized) {
            initialize();
        }

        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof FileHandler) {
                rootLogger.removeHandler(handler);
                handler.close();
            }
        }

        logFilePath = path;
        if (path == null) {
            return;
        }

        FileHandler fileHandler = new FileHandler(path.toString(), true);
        fileHandler.setLevel(Level.ALL);
        fileHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(fileHandler);
    }

    public static synchronized Path getLogFilePath() {
        return logFilePath;
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    public static Logger getLogger(String name) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(name);
    }
}
