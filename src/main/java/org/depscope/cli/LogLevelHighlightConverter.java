package org.depscope.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter behind {@code %levelColor(...)} in the console pattern.
 *
 * <p>Warnings about unknown registry packages and fatal source errors are the lines a user needs
 * to spot between tree output, so:</p>
 * <ul>
 *   <li>ERROR - Red</li>
 *   <li>WARN - Yellow</li>
 *   <li>INFO - Blue</li>
 *   <li>DEBUG/TRACE - Dim</li>
 * </ul>
 * Colouring is off when {@code NO_COLOR} is set or no console is attached (output piped to a file).
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";
    static final String ANSI_RED = "\u001B[31m";
    static final String ANSI_YELLOW = "\u001B[33m";
    static final String ANSI_BLUE = "\u001B[34m";
    static final String ANSI_DIM = "\u001B[2m";

    private final boolean colorEnabled;

    public LogLevelHighlightConverter() {
        this(System.getenv("NO_COLOR") == null && System.console() != null);
    }

    LogLevelHighlightConverter(boolean colorEnabled) {
        this.colorEnabled = colorEnabled;
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        if (!colorEnabled) {
            return in;
        }
        return colorFor(event.getLevel()) + in + ANSI_RESET;
    }

    static String colorFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_BLUE;
            default -> ANSI_DIM;
        };
    }
}
