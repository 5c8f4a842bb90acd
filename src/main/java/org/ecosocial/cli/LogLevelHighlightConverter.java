package org.ecosocial.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colours the wrapped pattern by level for the {@code COLOR} console format:
 * ERROR red, WARN yellow, INFO cyan, DEBUG dim. TRACE is left unstyled.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String RESET = "\u001B[0m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String style = styleFor(event.getLevel());
        return style == null ? in : style + in + RESET;
    }

    static String styleFor(Level level) {
        if (level.isGreaterOrEqual(Level.ERROR)) {
            return "\u001B[31m";
        }
        if (level.isGreaterOrEqual(Level.WARN)) {
            return "\u001B[33m";
        }
        if (level.isGreaterOrEqual(Level.INFO)) {
            return "\u001B[36m";
        }
        return level.isGreaterOrEqual(Level.DEBUG) ? "\u001B[2m" : null;
    }
}
