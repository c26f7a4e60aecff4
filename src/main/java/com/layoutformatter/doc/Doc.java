package com.layoutformatter.doc;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of the layout document: a layout-agnostic description of content,
 * potential line breaks and grouping. Nodes are immutable and only built through
 * {@link DocBuilder}.
 */
public abstract class Doc {

    /**
     * The closed set of node variants. The renderer dispatches on this value.
     */
    public enum Kind {
        TEXT,
        CONCAT,
        JOIN,
        LINE,
        SOFT_LINE,
        DOUBLE_SOFT_LINE,
        INDENT,
        ALIGN,
        GROUP,
        IF_BREAK,
        LINE_SUFFIX,
        LINE_SUFFIX_BOUNDARY,
        MARK
    }

    private Doc() {
    }

    public abstract Kind kind();

    /**
     * Literal content without line breaks.
     */
    public static final class Text extends Doc {
        private final String value;

        Text(String value) {
            this.value = value;
        }

        public String getValue() { return value; }

        /**
         * Columns the text occupies, one per code point.
         */
        public int width() { return value.codePointCount(0, value.length()); }

        @Override
        public Kind kind() { return Kind.TEXT; }

        @Override
        public String toString() {
            return "Text(" + value + ")";
        }
    }

    public static final class Concat extends Doc {
        private final List<Doc> parts;

        Concat(List<Doc> parts) {
            this.parts = Collections.unmodifiableList(parts);
        }

        public List<Doc> getParts() { return parts; }

        @Override
        public Kind kind() { return Kind.CONCAT; }

        @Override
        public String toString() {
            return "Concat" + parts;
        }
    }

    public static final class Join extends Doc {
        private final Doc separator;
        private final List<Doc> parts;

        Join(Doc separator, List<Doc> parts) {
            this.separator = separator;
            this.parts = Collections.unmodifiableList(parts);
        }

        public Doc getSeparator() { return separator; }
        public List<Doc> getParts() { return parts; }

        @Override
        public Kind kind() { return Kind.JOIN; }

        @Override
        public String toString() {
            return "Join(" + separator + ", " + parts + ")";
        }
    }

    /**
     * One of the three break points. They only differ in what they print when the
     * enclosing group is flat and in how consecutive breaks collapse.
     */
    public static final class Break extends Doc {
        private final Kind kind;

        Break(Kind kind) {
            this.kind = kind;
        }

        /**
         * Text printed in flat mode.
         */
        public String flatText() {
            return kind == Kind.LINE ? " " : "";
        }

        @Override
        public Kind kind() { return kind; }

        @Override
        public String toString() {
            return kind.name();
        }
    }

    public static final class Indent extends Doc {
        private final Doc contents;

        Indent(Doc contents) {
            this.contents = contents;
        }

        public Doc getContents() { return contents; }

        @Override
        public Kind kind() { return Kind.INDENT; }

        @Override
        public String toString() {
            return "Indent(" + contents + ")";
        }
    }

    /**
     * Indentation pinned to an absolute column instead of a step multiple.
     */
    public static final class Align extends Doc {
        private final int column;
        private final Doc contents;

        Align(int column, Doc contents) {
            this.column = column;
            this.contents = contents;
        }

        public int getColumn() { return column; }
        public Doc getContents() { return contents; }

        @Override
        public Kind kind() { return Kind.ALIGN; }

        @Override
        public String toString() {
            return "Align(" + column + ", " + contents + ")";
        }
    }

    public static final class Group extends Doc {
        private final Doc contents;
        private final boolean forceBreak;

        Group(Doc contents, boolean forceBreak) {
            this.contents = contents;
            this.forceBreak = forceBreak;
        }

        public Doc getContents() { return contents; }
        public boolean isForceBreak() { return forceBreak; }

        @Override
        public Kind kind() { return Kind.GROUP; }

        @Override
        public String toString() {
            return (forceBreak ? "Group!(" : "Group(") + contents + ")";
        }
    }

    /**
     * Content chosen by the mode the enclosing group resolved to.
     */
    public static final class IfBreak extends Doc {
        private final Doc whenBroken;
        private final Doc whenFlat;

        IfBreak(Doc whenBroken, Doc whenFlat) {
            this.whenBroken = whenBroken;
            this.whenFlat = whenFlat;
        }

        public Doc getWhenBroken() { return whenBroken; }
        public Doc getWhenFlat() { return whenFlat; }

        @Override
        public Kind kind() { return Kind.IF_BREAK; }

        @Override
        public String toString() {
            return "IfBreak(" + whenBroken + ", " + whenFlat + ")";
        }
    }

    /**
     * Content deferred to the end of the line being written, typically a trailing comment.
     */
    public static final class LineSuffix extends Doc {
        private final Doc contents;

        LineSuffix(Doc contents) {
            this.contents = contents;
        }

        public Doc getContents() { return contents; }

        @Override
        public Kind kind() { return Kind.LINE_SUFFIX; }

        @Override
        public String toString() {
            return "LineSuffix(" + contents + ")";
        }
    }

    public static final class LineSuffixBoundary extends Doc {
        LineSuffixBoundary() {
        }

        @Override
        public Kind kind() { return Kind.LINE_SUFFIX_BOUNDARY; }

        @Override
        public String toString() {
            return "LINE_SUFFIX_BOUNDARY";
        }
    }

    /**
     * Zero-width marker reporting the rendered position it is reached at.
     */
    public static final class Mark extends Doc {
        private final PositionHook hook;

        Mark(PositionHook hook) {
            this.hook = Objects.requireNonNull(hook, "hook");
        }

        public PositionHook getHook() { return hook; }

        @Override
        public Kind kind() { return Kind.MARK; }

        @Override
        public String toString() {
            return "Mark";
        }
    }
}
