package com.redcapxls.util;

import java.io.IOException;
import java.util.logging.*;

/**
 * Central logging for the converter.
 * A thin static wrapper around java.util.logging with a simpler interface.
 */
public class LoggingUtil {
    private static final String DEFAULT_LOG_FILE = "redcap2xlsform.log";

    private static final Logger logger = Logger.getLogger("com.redcapxls");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static boolean consoleLogging = false;
    private static boolean fileLogging = false;
    private static String logFileName = DEFAULT_LOG_FILE;

    // Console handlers flush on every record so progress shows up immediately
    private static class StdOutHandler extends StreamHandler {
        public StdOutHandler(Level level) {
            super(System.out, new SimpleFormatter());
            setLevel(level);
            // SEVERE goes to stderr only
            setFilter(record -> record.getLevel().intValue() < Level.SEVERE.intValue());
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
     * Initialize logging from the converter configuration
     */
    public static void initialize(ConverterConfig config) {
        initialize(config.getLoggingLevel(), config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(), config.getLogFileName());
    }

    /**
     * Initialize logging from explicit settings. Later calls are ignored.
     */
    public static synchronized void initialize(String levelStr, boolean consoleEnabled, boolean fileEnabled, String fileName) {
        if (initialized) {
            return;
        }

        setLoggingLevel(levelStr);

        clearHandlers();

        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName, true);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                fileLogging = true;
                logFileName = fileName;
            } catch (IOException e) {
                fileLogging = false;
                initialized = true;
                error("Failed to create log file: " + e.getMessage());
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
        String level = levelStr == null ? "INFO" : levelStr.trim().toUpperCase();
        switch (level) {
            case "OFF": currentLevel = Level.OFF; break;
            case "SEVERE":
            case "ERROR": currentLevel = Level.SEVERE; break;
            case "WARNING":
            case "WARN": currentLevel = Level.WARNING; break;
            case "DEBUG": currentLevel = Level.FINE; break;
            case "TRACE": currentLevel = Level.FINEST; break;
            default: currentLevel = Level.INFO;
        }
    }

    private static void clearHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
        }
    }

    private static void setupConsoleHandlers() {
        logger.addHandler(new StdOutHandler(currentLevel));
        logger.addHandler(new StdErrHandler(Level.SEVERE));
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

    public static void error(String message) {
        ensureInitialized();
        logger.severe(message);
    }

    public static void error(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.SEVERE, message, t);
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize("INFO", true, false, DEFAULT_LOG_FILE);
        }
    }
}
