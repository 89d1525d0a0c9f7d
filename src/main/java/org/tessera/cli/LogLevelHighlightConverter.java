package org.tessera.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colours the level field of console log lines.
 * <p>
 * ERROR red, WARN yellow, INFO green, DEBUG/TRACE dimmed.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";
    static final String ANSI_RED = "\u001B[31m";
    static final String ANSI_YELLOW = "\u001B[33m";
    static final String ANSI_GREEN = "\u001B[32m";
    static final String ANSI_DIM = "\u001B[2m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return colorFor(event.getLevel()) + in + ANSI_RESET;
    }

    static String colorFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_GREEN;
            default -> ANSI_DIM;
        };
    }
}
