package com.layoutformatter.correction;

/**
 * A definition rendered on a single line, with the source line it came from.
 */
public class InlineDeclaration {
    private final int renderedLine;
    private final int originalSourceLine;

    public InlineDeclaration(int renderedLine, int originalSourceLine) {
        this.renderedLine = renderedLine;
        this.originalSourceLine = originalSourceLine;
    }

    public int getRenderedLine() { return renderedLine; }
    public int getOriginalSourceLine() { return originalSourceLine; }

    @Override
    public String toString() {
        return "InlineDeclaration{renderedLine=" + renderedLine + ", originalSourceLine=" + originalSourceLine + "}";
    }
}
