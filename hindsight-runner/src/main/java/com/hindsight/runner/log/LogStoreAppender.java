package com.hindsight.runner.log;

import com.hindsight.engine.BacktestEngine;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.Core;
import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginElement;
import org.apache.logging.log4j.core.config.plugins.PluginFactory;

/**
 * Log4j2 appender recording events into the {@link LogStore} as structured entries.
 * The simulated time is read from the engine's MDC key.
 */
@Plugin(name = "LogStore", category = Core.CATEGORY_NAME, elementType = Appender.ELEMENT_TYPE)
public class LogStoreAppender extends AbstractAppender {

    private final LogStore store;

    LogStoreAppender(String name, Filter filter, LogStore store) {
        super(name, filter, null, true, Property.EMPTY_ARRAY);
        this.store = store;
    }

    @Override
    public void append(LogEvent event) {
        String message = event.getMessage().getFormattedMessage();
        if (event.getThrown() != null) {
            message += " (" + event.getThrown() + ")";
        }
        store.add(new LogStore.Entry(
            event.getLevel(),
            event.getContextData().getValue(BacktestEngine.SIM_TIME_KEY),
            event.getLoggerName(),
            message));
    }

    @PluginFactory
    public static LogStoreAppender createAppender(
            @PluginAttribute("name") String name,
            @PluginElement("Filter") Filter filter) {
        if (name == null) {
            LOGGER.error("No name provided for LogStoreAppender");
            return null;
        }
        return new LogStoreAppender(name, filter, LogStore.getInstance());
    }
}
