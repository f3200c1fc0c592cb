package com.exprsolve.util;

import java.io.IOException;
import java.util.logging.*;

/**
 * Utility class for centralized logging in the expression solver.
 * Provides a wrapper around Java's logging framework with simpler interface.
 */
public class LoggingUtil {
    public enum ConsoleOutputMode {
        ALL_TO_OUT,
        ALL_TO_ERR,
        SPLIT_SEVERE_TO_ERR
    }

    private static final Logger logger = Logger.getLogger("com.exprsolve");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static boolean consoleLogging = false;
    private static boolean fileLogging = false;
    private static String logFileName = "expression-solver.log";
    // stdout carries results, so logs default to stderr
    private static ConsoleOutputMode consoleOutputMode = ConsoleOutputMode.ALL_TO_ERR;

    // Console Handlers
    private static class StdOutHandler extends StreamHandler {
        public StdOutHandler(Level level) {
            super(System.out, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    private static class StdErrHandler extends StreamHandler {
        public StdErrHandler(Level level) {
            super(System.err, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    /**
     * Apply the logging section of a solver configuration. Unlike the
     * default initialization this always reconfigures the handlers.
     */
    public static synchronized void initialize(SolverConfig config) {
        consoleOutputMode = config.getConsoleOutputMode();
        configure(config.getLoggingLevel(), config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(), config.getLogFileName());
    }

    /**
     * Initialize with explicit settings unless logging is already set up.
     */
    public static synchronized void initialize(String levelStr, boolean consoleEnabled, boolean fileEnabled, String fileName) {
        if (initialized) {
            return;
        }
        configure(levelStr, consoleEnabled, fileEnabled, fileName);
    }

    private static void configure(String levelStr, boolean consoleEnabled, boolean fileEnabled, String fileName) {
        setLoggingLevel(levelStr);

        clearHandlers();
        consoleLogging = false;
        fileLogging = false;

        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                fileLogging = true;
                logFileName = fileName;
            } catch (IOException e) {
                // console handlers are already attached, so this still gets reported
                logger.log(Level.SEVERE, "Failed to create log file: " + e.getMessage(), e);
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        debug("Logging initialized: level=" + currentLevel +
                ", console=" + consoleLogging +
                ", file=" + (fileLogging ? logFileName : "disabled"));
    }

    private static void setLoggingLevel(String levelStr) {
        switch (levelStr.toUpperCase()) {
            case "SEVERE": currentLevel = Level.SEVERE; break;
            case "WARNING": currentLevel = Level.WARNING; break;
            case "DEBUG": currentLevel = Level.FINE; break;
            case "TRACE": currentLevel = Level.FINEST; break;
            default: currentLevel = Level.INFO;
        }
    }

    private static void clearHandlers() {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
    }

    private static void setupConsoleHandlers() {
        switch (consoleOutputMode) {
            case ALL_TO_OUT:
                logger.addHandler(new StdOutHandler(currentLevel));
                break;
            case ALL_TO_ERR:
                logger.addHandler(new StdErrHandler(currentLevel));
                break;
            case SPLIT_SEVERE_TO_ERR:
                logger.addHandler(new StdOutHandler(currentLevel));
                logger.addHandler(new StdErrHandler(Level.SEVERE));
                break;
        }
        consoleLogging = true;
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
    }

    public static void info(String message) {
        ensureInitialized();
        logger.info(message);
    }

    public static void warn(String message) {
        ensureInitialized();
        logger.warning(message);
    }

    public static void error(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.SEVERE, message, t);
    }

    public static boolean isDebugEnabled() {
        return currentLevel.intValue() <= Level.FINE.intValue();
    }

    public static Level getCurrentLevel() {
        return currentLevel;
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize("INFO", true, false, null);
        }
    }
}
