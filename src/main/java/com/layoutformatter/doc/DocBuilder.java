package com.layoutformatter.doc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Construction API for layout documents. Pure, no I/O.
 */
public final class DocBuilder {

    public static final Doc LINE = new Doc.Break(Doc.Kind.LINE);
    public static final Doc SOFT_LINE = new Doc.Break(Doc.Kind.SOFT_LINE);
    public static final Doc DOUBLE_SOFT_LINE = new Doc.Break(Doc.Kind.DOUBLE_SOFT_LINE);
    public static final Doc LINE_SUFFIX_BOUNDARY = new Doc.LineSuffixBoundary();

    private static final Doc EMPTY = new Doc.Text("");

    private DocBuilder() {
    }

    /**
     * Literal content. Line breaks must be expressed with break nodes.
     *
     * @throws IllegalArgumentException if the value contains a line break
     */
    public static Doc text(String value) {
        Objects.requireNonNull(value, "value");
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Text must not contain line breaks: " + value);
        }
        return value.isEmpty() ? EMPTY : new Doc.Text(value);
    }

    public static Doc empty() {
        return EMPTY;
    }

    public static Doc concat(Doc... parts) {
        return concat(Arrays.asList(parts));
    }

    public static Doc concat(List<Doc> parts) {
        return new Doc.Concat(copyOf(parts));
    }

    /**
     * Places {@code separator} between consecutive parts.
     */
    public static Doc join(Doc separator, List<Doc> parts) {
        return new Doc.Join(Objects.requireNonNull(separator, "separator"), copyOf(parts));
    }

    public static Doc indent(Doc contents) {
        return new Doc.Indent(Objects.requireNonNull(contents, "contents"));
    }

    /**
     * Uses {@code column} as the indentation of every line broken inside {@code contents}.
     */
    public static Doc align(int column, Doc contents) {
        if (column < 0) {
            throw new IllegalArgumentException("Align column must not be negative: " + column);
        }
        return new Doc.Align(column, Objects.requireNonNull(contents, "contents"));
    }

    public static Doc group(Doc contents) {
        return group(contents, false);
    }

    public static Doc group(Doc contents, boolean forceBreak) {
        return new Doc.Group(Objects.requireNonNull(contents, "contents"), forceBreak);
    }

    public static Doc forcedGroup(Doc contents) {
        return group(contents, true);
    }

    public static Doc ifBreak(Doc whenBroken, Doc whenFlat) {
        return new Doc.IfBreak(Objects.requireNonNull(whenBroken, "whenBroken"),
                Objects.requireNonNull(whenFlat, "whenFlat"));
    }

    public static Doc ifBreak(String whenBroken, String whenFlat) {
        return ifBreak(text(whenBroken), text(whenFlat));
    }

    public static Doc lineSuffix(Doc contents) {
        return new Doc.LineSuffix(Objects.requireNonNull(contents, "contents"));
    }

    public static Doc lineSuffix(String contents) {
        return lineSuffix(text(contents));
    }

    public static Doc mark(PositionHook hook) {
        return new Doc.Mark(hook);
    }

    private static List<Doc> copyOf(List<Doc> parts) {
        Objects.requireNonNull(parts, "parts");
        List<Doc> copy = new ArrayList<>(parts.size());
        for (Doc part : parts) {
            copy.add(Objects.requireNonNull(part, "part"));
        }
        return copy;
    }
}
