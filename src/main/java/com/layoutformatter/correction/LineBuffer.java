package com.layoutformatter.correction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import com.layoutformatter.api.error.FormatterBugException;

/**
 * Rendered text as a mutable list of lines, shared by the correction passes.
 *
 * <p>Lines listed as unmodifiable belong to verbatim multi-line string bodies; passes
 * must leave them untouched.
 */
public class LineBuffer {
    private final List<String> lines;
    private final boolean trailingNewline;
    private final TreeSet<Integer> unmodifiableLines;

    private LineBuffer(List<String> lines, boolean trailingNewline, Collection<Integer> unmodifiableLines) {
        this.lines = lines;
        this.trailingNewline = trailingNewline;
        this.unmodifiableLines = new TreeSet<>(unmodifiableLines);
    }

    public static LineBuffer of(String text) {
        return of(text, Set.of());
    }

    public static LineBuffer of(String text, Collection<Integer> unmodifiableLines) {
        boolean trailingNewline = text.endsWith("\n");
        String body = trailingNewline ? text.substring(0, text.length() - 1) : text;
        List<String> lines = new ArrayList<>(Arrays.asList(body.split("\n", -1)));
        return new LineBuffer(lines, trailingNewline, unmodifiableLines);
    }

    public static LineBuffer ofLines(List<String> lines) {
        return new LineBuffer(new ArrayList<>(lines), false, Set.of());
    }

    public int size() {
        return lines.size();
    }

    public String getLine(int line) {
        return lines.get(line);
    }

    public List<String> getLines() {
        return List.copyOf(lines);
    }

    public boolean contains(int line) {
        return line >= 0 && line < lines.size();
    }

    /**
     * Fails with a {@link FormatterBugException} naming {@code record} unless
     * {@code line} exists.
     */
    public void requireLine(int line, Object record) {
        if (!contains(line)) {
            throw new FormatterBugException("Line " + line + " is outside the rendered text of "
                    + lines.size() + " lines", record);
        }
    }

    public boolean isUnmodifiable(int line) {
        return unmodifiableLines.contains(line);
    }

    public void markUnmodifiable(int line) {
        unmodifiableLines.add(line);
    }

    public boolean isBlank(int line) {
        return lines.get(line).isBlank();
    }

    /**
     * Inserts {@code text} at character {@code index} of {@code line}.
     */
    public void insert(int line, int index, String text) {
        String current = lines.get(line);
        lines.set(line, current.substring(0, index) + text + current.substring(index));
    }

    public void prefix(int line, String text) {
        lines.set(line, text + lines.get(line));
    }

    /**
     * Removes up to {@code width} leading blanks from {@code line}; other characters are
     * never removed.
     */
    public void removeLeadingBlanks(int line, int width) {
        String current = lines.get(line);
        int index = 0;
        while (index < width && index < current.length() && current.charAt(index) == ' ') {
            index++;
        }
        lines.set(line, current.substring(index));
    }

    /**
     * Deletes a whole line. Unmodifiable line indices below it move up by one.
     */
    public void deleteLine(int line) {
        lines.remove(line);
        Set<Integer> shifted = new TreeSet<>();
        for (int unmodifiable : unmodifiableLines) {
            if (unmodifiable < line) {
                shifted.add(unmodifiable);
            } else if (unmodifiable > line) {
                shifted.add(unmodifiable - 1);
            }
        }
        unmodifiableLines.clear();
        unmodifiableLines.addAll(shifted);
    }

    public String toText() {
        String text = String.join("\n", lines);
        return trailingNewline ? text + "\n" : text;
    }

    @Override
    public String toString() {
        return toText();
    }
}
