package com.hindsight.runner.log;

import com.hindsight.core.config.BacktestConfig;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.FileAppender;
import org.apache.logging.log4j.core.config.AbstractConfiguration;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the logging options of a {@link BacktestConfig} to the running Log4j2 context.
 * Appender names match {@code log4j2.xml}.
 */
public final class LoggingConfigurator {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    public static final String CONSOLE_APPENDER = "Console";
    public static final String STORE_APPENDER = "LogStore";
    public static final String FILE_APPENDER = "BacktestFile";
    public static final String LIBRARY_LOGGER = "com.hindsight";
    public static final String FILE_PATTERN = "%d{ISO8601} [%X{simTime}] %-5level %logger{36} - %msg%n";

    private LoggingConfigurator() {
    }

    public static void apply(BacktestConfig config) {
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        Configuration configuration = context.getConfiguration();
        LoggerConfig root = configuration.getRootLogger();

        Level console = toLevel(config.consoleLevel());
        Level store = toLevel(config.storeLevel());
        rebind(root, configuration.getAppender(CONSOLE_APPENDER), console);
        rebind(root, configuration.getAppender(STORE_APPENDER), store);
        LogStore.getInstance().setLevel(store);
        Level threshold = moreVerbose(console, store);

        if (configuration instanceof AbstractConfiguration abstractConfiguration) {
            // Also stops it; a fresh one is built below when still wanted
            abstractConfiguration.removeAppender(FILE_APPENDER);
        }
        if (config.logToFile()) {
            PatternLayout layout = PatternLayout.newBuilder()
                .withPattern(FILE_PATTERN)
                .withConfiguration(configuration)
                .build();
            FileAppender file = FileAppender.newBuilder()
                .setConfiguration(configuration)
                .setName(FILE_APPENDER)
                .withFileName(config.logFilePath())
                .withAppend(true)
                .setLayout(layout)
                .build();
            file.start();
            configuration.addAppender(file);
            root.addAppender(file, console, null);
        }

        root.setLevel(threshold);
        context.updateLoggers();
        Configurator.setLevel(LIBRARY_LOGGER, config.bypassLogging() ? Level.OFF : threshold);

        log.debug("Logging applied: console={}, store={}, file={}, bypass={}",
            console, store, config.logToFile() ? config.logFilePath() : "none", config.bypassLogging());
    }

    static Level toLevel(BacktestConfig.LogLevel level) {
        return Level.toLevel(level.name(), Level.INFO);
    }

    static Level moreVerbose(Level a, Level b) {
        return a.intLevel() >= b.intLevel() ? a : b;
    }

    private static void rebind(LoggerConfig root, Appender appender, Level level) {
        if (appender == null) {
            return;
        }
        root.removeAppender(appender.getName());
        root.addAppender(appender, level, null);
    }
}
