package com.layoutformatter.api;

/**
 * A rewrite a correction pass applied to the rendered text.
 */
public class AppliedCorrection {
    private final String type;
    private final int startLine;
    private final int endLine;
    private final String description;

    public AppliedCorrection(String type, int startLine, int endLine, String description) {
        this.type = type;
        this.startLine = startLine;
        this.endLine = endLine;
        this.description = description;
    }

    public String getType() { return type; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public String getDescription() { return description; }

    @Override
    public String toString() {
        return type + "[" + startLine + ".." + endLine + "]: " + description;
    }
}
