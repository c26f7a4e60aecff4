package com.layoutformatter.util;

import java.io.InputStream;
import java.util.logging.*;

/**
 * Configures {@code java.util.logging} for the formatter and hands out loggers.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String LOG_CONFIG_RESOURCE = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.INFO;

    /**
     * Reads the bundled logging configuration, or installs a console handler if there is none.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try (InputStream is = LoggerUtil.class.getResourceAsStream(LOG_CONFIG_RESOURCE)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            } else {
                configureConsoleLogging();
            }
        } catch (Exception e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            configureConsoleLogging();
        }
        initialized = true;
    }

    private static void configureConsoleLogging() {
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
     * Sets the level of the console handlers and of the formatter's loggers.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;
        initialize();

        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        Logger.getLogger("com.layoutformatter").setLevel(level);
    }

    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
    }

    public static Logger getLogger(String name) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(name);
    }
}
