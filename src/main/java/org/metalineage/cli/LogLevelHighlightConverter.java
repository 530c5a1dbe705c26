package org.metalineage.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the level field of console log lines: ERROR red, WARN yellow (degraded modes
 * show up here), INFO blue, DEBUG and TRACE dimmed.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String BLUE = "\u001B[34m";
    private static final String DIM = "\u001B[2m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return switch (event.getLevel().toInt()) {
            case Level.ERROR_INT -> RED + in + RESET;
            case Level.WARN_INT -> YELLOW + in + RESET;
            case Level.INFO_INT -> BLUE + in + RESET;
            case Level.DEBUG_INT, Level.TRACE_INT -> DIM + in + RESET;
            default -> in;
        };
    }
}
