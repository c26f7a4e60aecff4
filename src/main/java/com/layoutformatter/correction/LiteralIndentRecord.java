package com.layoutformatter.correction;

/**
 * A literal whose closing bracket was written in the column of its opening token. Lines
 * after the first keep {@code extraIndent} more columns than canonical reflow gives them.
 */
public class LiteralIndentRecord {
    private final int firstLine;
    private final int lastLine;
    private final int extraIndent;

    public LiteralIndentRecord(int firstLine, int lastLine, int extraIndent) {
        if (lastLine < firstLine) {
            throw new IllegalArgumentException("Literal ends at line " + lastLine + " before line " + firstLine);
        }
        this.firstLine = firstLine;
        this.lastLine = lastLine;
        this.extraIndent = extraIndent;
    }

    public int getFirstLine() { return firstLine; }
    public int getLastLine() { return lastLine; }
    public int getExtraIndent() { return extraIndent; }

    @Override
    public String toString() {
        return "LiteralIndentRecord{firstLine=" + firstLine + ", lastLine=" + lastLine
                + ", extraIndent=" + extraIndent + "}";
    }
}
