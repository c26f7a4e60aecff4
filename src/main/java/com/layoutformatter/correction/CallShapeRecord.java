package com.layoutformatter.correction;

/**
 * Shape of a call whose arguments start on its first line, for example
 * <pre>
 * foo bar(
 *           2,
 *         )
 * </pre>
 * The record fills in as rendering goes on and is only used once finalized.
 */
public class CallShapeRecord {
    private final int firstLine;
    private final int indent;
    private final int firstParamColumn;
    private Boolean needsDedent;
    private Integer closingLine;
    private Integer lastLine;

    public CallShapeRecord(int firstLine, int indent, int firstParamColumn) {
        this.firstLine = firstLine;
        this.indent = indent;
        this.firstParamColumn = firstParamColumn;
    }

    /**
     * A complete record, as written by callers that know the whole shape up front.
     */
    public static CallShapeRecord of(int firstLine, int indent, int firstParamColumn,
                                     boolean needsDedent, int closingLine, int lastLine) {
        CallShapeRecord record = new CallShapeRecord(firstLine, indent, firstParamColumn);
        record.setNeedsDedent(needsDedent);
        record.setClosingLine(closingLine);
        record.setLastLine(lastLine);
        return record;
    }

    public int getFirstLine() { return firstLine; }
    public int getIndent() { return indent; }
    /**
     * Column the broken arguments hang at: one indent step past the first parameter.
     */
    public int getFirstParamColumn() { return firstParamColumn; }

    public boolean isNeedsDedent() {
        return needsDedent != null && needsDedent;
    }

    public Integer getClosingLine() { return closingLine; }
    public Integer getLastLine() { return lastLine; }

    public void setNeedsDedent(boolean needsDedent) {
        this.needsDedent = needsDedent;
    }

    public void setClosingLine(int closingLine) {
        this.closingLine = closingLine;
    }

    public void setLastLine(int lastLine) {
        this.lastLine = lastLine;
    }

    public boolean isFinalized() {
        return needsDedent != null && closingLine != null && lastLine != null;
    }

    /**
     * Whether the closing delimiter sits on the line right after the last argument, so the
     * arguments should hang one indent step past the call instead of under its first parameter.
     */
    public boolean qualifiesForDedent() {
        return isFinalized() && needsDedent && closingLine.equals(lastLine);
    }

    @Override
    public String toString() {
        return "CallShapeRecord{firstLine=" + firstLine + ", indent=" + indent
                + ", firstParamColumn=" + firstParamColumn + ", needsDedent=" + needsDedent
                + ", closingLine=" + closingLine + ", lastLine=" + lastLine + "}";
    }
}
