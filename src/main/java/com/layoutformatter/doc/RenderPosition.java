package com.layoutformatter.doc;

/**
 * A position in rendered output. Lines and columns are zero based; {@code indent}
 * is the indentation that would be used if the renderer broke a line at this point.
 */
public final class RenderPosition {
    private final int line;
    private final int column;
    private final int indent;

    public RenderPosition(int line, int column, int indent) {
        this.line = line;
        this.column = column;
        this.indent = indent;
    }

    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getIndent() { return indent; }

    @Override
    public String toString() {
        return line + ":" + column + " (indent " + indent + ")";
    }
}
