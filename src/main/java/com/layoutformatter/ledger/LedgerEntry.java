package com.layoutformatter.ledger;

/**
 * A rendered position of an alignable construct. The column is updated while the
 * alignment pass inserts filler in front of it.
 */
public class LedgerEntry {
    private final AlignmentCategory category;
    private final int line;
    private final Object identityId;
    private final int offset;
    private int column;
    private int endLine;
    private AlignmentRun owningRun;
    private int indexInRun = -1;

    LedgerEntry(AlignmentCategory category, int line, int column, Object identityId, int offset) {
        this.category = category;
        this.line = line;
        this.column = column;
        this.identityId = identityId;
        this.offset = offset;
        this.endLine = line;
    }

    public AlignmentCategory getCategory() { return category; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public Object getIdentityId() { return identityId; }
    public int getOffset() { return offset; }

    /**
     * Last line of the construct; only assignments span more than one line.
     */
    public int getEndLine() { return endLine; }

    public AlignmentRun getOwningRun() { return owningRun; }
    public int getIndexInRun() { return indexInRun; }

    /**
     * Index in the line where filler goes when this entry has to move right.
     */
    public int getSplitIndex() {
        return column - offset;
    }

    void shift(int width) {
        column += width;
    }

    void setEndLine(int endLine) {
        this.endLine = endLine;
    }

    void joinRun(AlignmentRun run, int index) {
        this.owningRun = run;
        this.indexInRun = index;
    }

    @Override
    public String toString() {
        return category + "@" + line + ":" + column
                + (offset != 0 ? " offset " + offset : "")
                + (identityId != null ? " id " + identityId : "")
                + (endLine != line ? " to line " + endLine : "");
    }
}
