package org.kmerweaver.utils;

import com.google.common.collect.BiMap;
import com.google.common.collect.EnumHashBiMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Logger;

/**
 * Logging utilities.
 *
 * KmerWeaver tools use the htsjdk Log.LogLevel enum as the type for VERBOSITY command line arguments (each
 * log4j level is represented by a static object, so there is no built-in enum that is compatible with the
 * command line argument framework). We use the htsjdk enum as the toolkit currency and convert back and forth
 * between that and the log4j and java.util.logging namespaces as necessary.
 */
public class LoggingUtils {

    // Map between the logging level used throughout KmerWeaver code (the htsjdk Log.LogLevel enum),
    // and the log4j log Level values.
    private static BiMap<Log.LogLevel, Level> loggingLevelNamespaceMap;
    static {
        loggingLevelNamespaceMap = EnumHashBiMap.create(Log.LogLevel.class);
        loggingLevelNamespaceMap.put(Log.LogLevel.ERROR, Level.ERROR);
        loggingLevelNamespaceMap.put(Log.LogLevel.WARNING, Level.WARN);
        loggingLevelNamespaceMap.put(Log.LogLevel.INFO, Level.INFO);
        loggingLevelNamespaceMap.put(Log.LogLevel.DEBUG, Level.DEBUG);
    }

    private static BiMap<Log.LogLevel, java.util.logging.Level> javaUtilLevelNamespaceMap;
    static {
        javaUtilLevelNamespaceMap = EnumHashBiMap.create(Log.LogLevel.class);
        javaUtilLevelNamespaceMap.put(Log.LogLevel.ERROR, java.util.logging.Level.SEVERE);
        javaUtilLevelNamespaceMap.put(Log.LogLevel.WARNING, java.util.logging.Level.WARNING);
        javaUtilLevelNamespaceMap.put(Log.LogLevel.INFO, java.util.logging.Level.INFO);
        javaUtilLevelNamespaceMap.put(Log.LogLevel.DEBUG, java.util.logging.Level.FINEST);
    }

    // Package-private for unit test access
    static Log.LogLevel levelFromLog4jLevel(Level log4jLevel) {
        return loggingLevelNamespaceMap.inverse().get(log4jLevel);
    }

    /**
     * Converts an htsjdk log level to a log4j log level.
     * @param htsjdkLevel htsjdk {@link Log.LogLevel} to convert to a Log4J {@link Level}.
     * @return The {@link Level} that corresponds to the given {@code htsjdkLevel}.
     */
    public static Level levelToLog4jLevel(Log.LogLevel htsjdkLevel) {
        return loggingLevelNamespaceMap.get(htsjdkLevel);
    }

    /**
     * Set the java.util.logging level since some of our dependencies write messages using it.
     */
    private static void setJavaUtilLoggingLevel(final Log.LogLevel verbosity) {
        Logger topLogger = java.util.logging.Logger.getLogger("");

        Handler consoleHandler = null;
        for (Handler handler : topLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                consoleHandler = handler;
                break;
            }
        }

        if (consoleHandler == null) {
            consoleHandler = new ConsoleHandler();
            topLogger.addHandler(consoleHandler);
        }
        consoleHandler.setLevel(javaUtilLevelNamespaceMap.get(verbosity));
    }

    /**
     * Propagate the verbosity level to htsjdk, log4j and the java built in logger
     */
    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Utils.nonNull(verbosity, "verbosity");

        // Call the htsjdk API to establish the logging level used by htsjdk
        Log.setGlobalLogLevel(verbosity);

        setLog4JLoggingLevel(verbosity);

        setJavaUtilLoggingLevel(verbosity);
    }

    private static void setLog4JLoggingLevel(Log.LogLevel verbosity) {
        // Now establish the logging level used by log4j by propagating the requested
        // logging level to all loggers associated with our logging configuration.
        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        final Configuration loggerContextConfig = loggerContext.getConfiguration();
        final String contextClassName = LoggingUtils.class.getName();
        final LoggerConfig loggerConfig = loggerContextConfig.getLoggerConfig(contextClassName);

        loggerConfig.setLevel(levelToLog4jLevel(verbosity));
        loggerContext.updateLoggers();
    }
}
