package com.questrail.axisticks.format;

/**
 * Indicates that a format string matched none of the rules of the active
 * {@link FormatGrammar}.
 */
public final class TickFormatException extends RuntimeException
{
    private final String format;

    public TickFormatException(String format) {
        super("Invalid format: " + format);
        this.format = format;
    }

    /**
     * The rejected format string.
     */
    public String format() {
        return format;
    }
}
