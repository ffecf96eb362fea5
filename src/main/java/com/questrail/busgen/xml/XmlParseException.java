package com.questrail.busgen.xml;

import java.util.OptionalInt;

/**
 * Indicates that an introspection document is malformed or lacks a required
 * attribute. The failure is fatal to the whole document.
 */
public final class XmlParseException extends RuntimeException
{
    private final int line;
    private final int column;

    public XmlParseException(String message, int line, int column) {
        super(line > 0 ? message + " (line " + line + ", column " + column + ")" : message);
        this.line = line;
        this.column = column;
    }

    public XmlParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = -1;
        this.column = -1;
    }

    public OptionalInt line() {
        return line > 0 ? OptionalInt.of(line) : OptionalInt.empty();
    }

    public OptionalInt column() {
        return column > 0 ? OptionalInt.of(column) : OptionalInt.empty();
    }
}
