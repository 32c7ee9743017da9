package com.questrail.plc.lang;

/**
 * Raised when Structured Text source cannot be turned into a {@code Program}.
 *
 * <p>Carries the 1-based source position of the offending token. A parse
 * failure never yields a partial program.</p>
 */
public final class StParseException extends Exception
{
    private final int line;
    private final int column;

    public StParseException(String message, int line, int column) {
        super(message + " at " + line + ":" + column);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
