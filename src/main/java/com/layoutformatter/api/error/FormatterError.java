package com.layoutformatter.api.error;

/**
 * A problem reported while formatting a document. Lines and columns refer to the
 * rendered output and are zero based; -1 means the problem has no position.
 */
public class FormatterError {
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;

    public FormatterError(Severity severity, String message) {
        this(severity, message, -1, -1);
    }

    public FormatterError(Severity severity, String message, int line, int column) {
        this.severity = severity;
        this.message = message;
        this.line = line;
        this.column = column;
    }

    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    @Override
    public String toString() {
        String position = line >= 0 ? " (line " + line + ")" : "";
        return severity + ": " + message + position;
    }
}
