package com.layoutformatter.core;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Mutable state of a single render call: where the next character lands and which
 * line suffixes are waiting for the current line to close.
 */
final class RenderCursor {
    private final IntPredicate verbatimLine;
    private final StringBuilder out = new StringBuilder();
    private final List<DocRenderer.Frame> pendingSuffixQueue = new ArrayList<>();
    private int currentLine;
    private int currentColumn;

    /**
     * @param verbatimLine lines whose trailing blanks are content and must survive
     */
    RenderCursor(IntPredicate verbatimLine) {
        this.verbatimLine = verbatimLine;
    }

    int getCurrentLine() { return currentLine; }
    int getCurrentColumn() { return currentColumn; }
    List<DocRenderer.Frame> getPendingSuffixQueue() { return pendingSuffixQueue; }

    void write(String text) {
        out.append(text);
        currentColumn += text.codePointCount(0, text.length());
    }

    /**
     * Whether the last written character separates words (blank, line start or nothing).
     */
    boolean atWordBoundary() {
        if (out.length() == 0) {
            return true;
        }
        char last = out.charAt(out.length() - 1);
        return last == ' ' || last == '\t' || last == '\n';
    }

    /**
     * Closes the current line and starts the next one at {@code indent}. With
     * {@code blankSeparator} the new line is preceded by exactly one blank line, reusing
     * blank lines that are already there. Trailing blanks are trimmed unless the closing
     * line is verbatim.
     */
    void newLine(int indent, boolean blankSeparator) {
        if (!verbatimLine.test(currentLine)) {
            trimTrailingBlanks();
        }
        if (blankSeparator) {
            if (out.length() > 0) {
                int trailing = trailingNewLines();
                for (int i = trailing; i < 2; i++) {
                    out.append('\n');
                    currentLine++;
                }
            }
        } else {
            out.append('\n');
            currentLine++;
        }
        currentColumn = 0;
        write(" ".repeat(indent));
    }

    String text() {
        return out.toString();
    }

    private void trimTrailingBlanks() {
        int end = out.length();
        while (end > 0 && (out.charAt(end - 1) == ' ' || out.charAt(end - 1) == '\t')) {
            end--;
        }
        currentColumn -= out.length() - end;
        out.setLength(end);
    }

    private int trailingNewLines() {
        int count = 0;
        for (int i = out.length() - 1; i >= 0 && out.charAt(i) == '\n'; i--) {
            count++;
        }
        return count;
    }
}
