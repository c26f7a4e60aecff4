package com.layoutformatter.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.IntPredicate;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.layoutformatter.doc.Doc;
import com.layoutformatter.doc.RenderPosition;
import com.layoutformatter.util.LoggerUtil;

/**
 * Renders a layout document into text within a width budget.
 *
 * <p>Works off an explicit stack of {@code (indent, mode, node)} frames. Every group is
 * resolved exactly once, outer to inner: forced groups break, the others break only if
 * their flat form plus the rest of the current line does not fit. Line suffixes are
 * queued and written at the end of the line that is open when the next real line break
 * (or a {@link Doc.LineSuffixBoundary}) is reached.
 */
public class DocRenderer {
    private static final Logger logger = LoggerUtil.getLogger(DocRenderer.class);

    public static final int DEFAULT_INDENT_SIZE = 2;

    enum Mode {
        FLAT,
        BREAK
    }

    static final class Frame {
        final int indent;
        final Mode mode;
        final Doc doc;
        // first frame of a flushed line suffix
        final boolean suffixHead;

        Frame(int indent, Mode mode, Doc doc) {
            this(indent, mode, doc, false);
        }

        Frame(int indent, Mode mode, Doc doc, boolean suffixHead) {
            this.indent = indent;
            this.mode = mode;
            this.doc = doc;
            this.suffixHead = suffixHead;
        }
    }

    private final int indentSize;

    public DocRenderer() {
        this(DEFAULT_INDENT_SIZE);
    }

    public DocRenderer(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("Indent size must not be negative: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public int getIndentSize() {
        return indentSize;
    }

    /**
     * Renders {@code doc} trying to keep every line within {@code maxWidth} columns.
     * Atomic text wider than the budget is written as is.
     */
    public String render(Doc doc, int maxWidth) {
        return render(doc, maxWidth, line -> false);
    }

    /**
     * Renders {@code doc}, keeping the trailing blanks of every line {@code verbatimLine}
     * accepts when the line is closed.
     */
    public String render(Doc doc, int maxWidth, IntPredicate verbatimLine) {
        RenderCursor cursor = new RenderCursor(verbatimLine);
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(0, Mode.BREAK, doc));
        boolean remeasure = false;

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Doc node = frame.doc;

            if (frame.suffixHead && !cursor.atWordBoundary() && !startsWithBlank(node, frame.mode)) {
                cursor.write(" ");
            }

            switch (node.kind()) {
                case TEXT -> cursor.write(((Doc.Text) node).getValue());
                case CONCAT -> pushAll(stack, frame, ((Doc.Concat) node).getParts());
                case JOIN -> pushJoined(stack, frame, (Doc.Join) node);
                case INDENT -> stack.push(new Frame(frame.indent + indentSize, frame.mode,
                        ((Doc.Indent) node).getContents()));
                case ALIGN -> {
                    Doc.Align align = (Doc.Align) node;
                    stack.push(new Frame(align.getColumn(), frame.mode, align.getContents()));
                }
                case GROUP -> {
                    Doc.Group group = (Doc.Group) node;
                    if (group.isForceBreak()) {
                        stack.push(new Frame(frame.indent, Mode.BREAK, group.getContents()));
                    } else if (frame.mode == Mode.FLAT && !remeasure) {
                        stack.push(new Frame(frame.indent, Mode.FLAT, group.getContents()));
                    } else {
                        remeasure = false;
                        Frame flat = new Frame(frame.indent, Mode.FLAT, group.getContents());
                        int budget = maxWidth - cursor.getCurrentColumn();
                        if (fits(flat, stack, budget, cursor.getPendingSuffixQueue())) {
                            stack.push(flat);
                        } else {
                            stack.push(new Frame(frame.indent, Mode.BREAK, group.getContents()));
                        }
                        if (logger.isLoggable(Level.FINEST)) {
                            logger.finest("Group at " + cursor.getCurrentLine() + ":" + cursor.getCurrentColumn()
                                    + " resolved to " + stack.peek().mode);
                        }
                    }
                }
                case IF_BREAK -> {
                    Doc.IfBreak ifBreak = (Doc.IfBreak) node;
                    Doc chosen = frame.mode == Mode.BREAK ? ifBreak.getWhenBroken() : ifBreak.getWhenFlat();
                    stack.push(new Frame(frame.indent, frame.mode, chosen));
                }
                case LINE_SUFFIX -> cursor.getPendingSuffixQueue()
                        .add(new Frame(frame.indent, frame.mode, ((Doc.LineSuffix) node).getContents()));
                case LINE_SUFFIX_BOUNDARY -> flushSuffixes(stack, cursor);
                case MARK -> ((Doc.Mark) node).getHook().reached(
                        new RenderPosition(cursor.getCurrentLine(), cursor.getCurrentColumn(), frame.indent));
                case LINE, SOFT_LINE, DOUBLE_SOFT_LINE -> {
                    if (frame.mode == Mode.FLAT) {
                        cursor.write(((Doc.Break) node).flatText());
                    } else if (!cursor.getPendingSuffixQueue().isEmpty()) {
                        // write the queued suffixes first, then come back to this break
                        stack.push(frame);
                        flushSuffixes(stack, cursor);
                    } else {
                        cursor.newLine(frame.indent, node.kind() == Doc.Kind.DOUBLE_SOFT_LINE);
                        remeasure = true;
                    }
                }
            }

            if (stack.isEmpty() && !cursor.getPendingSuffixQueue().isEmpty()) {
                flushSuffixes(stack, cursor);
            }
        }

        return cursor.text();
    }

    /**
     * Probes whether {@code next} in flat mode, followed by the frames still on the stack,
     * fits into {@code width} columns before the next line break.
     */
    private boolean fits(Frame next, Deque<Frame> rest, int width, List<Frame> pendingSuffixes) {
        Iterator<Frame> restFrames = rest.iterator();
        Deque<Frame> probe = new ArrayDeque<>();
        List<Frame> suffixes = new ArrayList<>(pendingSuffixes);
        probe.push(next);
        int remaining = width;

        while (remaining >= 0) {
            if (probe.isEmpty()) {
                if (!restFrames.hasNext()) {
                    return true;
                }
                probe.push(restFrames.next());
                continue;
            }

            Frame frame = probe.pop();
            Doc node = frame.doc;
            switch (node.kind()) {
                case TEXT -> remaining -= ((Doc.Text) node).width();
                case CONCAT -> pushAll(probe, frame, ((Doc.Concat) node).getParts());
                case JOIN -> pushJoined(probe, frame, (Doc.Join) node);
                case INDENT -> probe.push(new Frame(frame.indent, frame.mode, ((Doc.Indent) node).getContents()));
                case ALIGN -> probe.push(new Frame(frame.indent, frame.mode, ((Doc.Align) node).getContents()));
                case GROUP -> {
                    Doc.Group group = (Doc.Group) node;
                    Mode mode = group.isForceBreak() ? Mode.BREAK : frame.mode;
                    probe.push(new Frame(frame.indent, mode, group.getContents()));
                }
                case IF_BREAK -> {
                    Doc.IfBreak ifBreak = (Doc.IfBreak) node;
                    probe.push(new Frame(frame.indent, frame.mode,
                            frame.mode == Mode.BREAK ? ifBreak.getWhenBroken() : ifBreak.getWhenFlat()));
                }
                case LINE_SUFFIX -> suffixes.add(new Frame(frame.indent, frame.mode,
                        ((Doc.LineSuffix) node).getContents()));
                case LINE_SUFFIX_BOUNDARY -> {
                    for (int i = suffixes.size() - 1; i >= 0; i--) {
                        Frame suffix = suffixes.get(i);
                        if (!startsWithBlank(suffix.doc, suffix.mode)) {
                            remaining--;
                        }
                        probe.push(suffix);
                    }
                    suffixes.clear();
                }
                case MARK -> {
                }
                case LINE, SOFT_LINE, DOUBLE_SOFT_LINE -> {
                    if (frame.mode == Mode.BREAK) {
                        return true;
                    }
                    remaining -= ((Doc.Break) node).flatText().length();
                }
            }
        }
        return false;
    }

    private static void pushAll(Deque<Frame> stack, Frame parent, List<Doc> parts) {
        for (int i = parts.size() - 1; i >= 0; i--) {
            stack.push(new Frame(parent.indent, parent.mode, parts.get(i)));
        }
    }

    private static void pushJoined(Deque<Frame> stack, Frame parent, Doc.Join join) {
        List<Doc> parts = join.getParts();
        for (int i = parts.size() - 1; i >= 0; i--) {
            stack.push(new Frame(parent.indent, parent.mode, parts.get(i)));
            if (i > 0) {
                stack.push(new Frame(parent.indent, parent.mode, join.getSeparator()));
            }
        }
    }

    /**
     * Moves the whole suffix queue onto the stack so it is written next, in queue order.
     */
    private static void flushSuffixes(Deque<Frame> stack, RenderCursor cursor) {
        List<Frame> queue = cursor.getPendingSuffixQueue();
        for (int i = queue.size() - 1; i >= 0; i--) {
            Frame suffix = queue.get(i);
            stack.push(new Frame(suffix.indent, suffix.mode, suffix.doc, true));
        }
        queue.clear();
    }

    /**
     * Whether the first character {@code doc} would print is blank or a line break.
     * Empty content counts as not blank.
     */
    static boolean startsWithBlank(Doc doc, Mode mode) {
        Boolean result = leadingBlank(doc, mode);
        return result != null && result;
    }

    private static Boolean leadingBlank(Doc doc, Mode mode) {
        switch (doc.kind()) {
            case TEXT: {
                String value = ((Doc.Text) doc).getValue();
                return value.isEmpty() ? null : Character.isWhitespace(value.charAt(0));
            }
            case CONCAT:
                return firstLeadingBlank(((Doc.Concat) doc).getParts(), mode);
            case JOIN: {
                Doc.Join join = (Doc.Join) doc;
                for (int i = 0; i < join.getParts().size(); i++) {
                    if (i > 0) {
                        Boolean separator = leadingBlank(join.getSeparator(), mode);
                        if (separator != null) {
                            return separator;
                        }
                    }
                    Boolean part = leadingBlank(join.getParts().get(i), mode);
                    if (part != null) {
                        return part;
                    }
                }
                return null;
            }
            case INDENT:
                return leadingBlank(((Doc.Indent) doc).getContents(), mode);
            case ALIGN:
                return leadingBlank(((Doc.Align) doc).getContents(), mode);
            case GROUP: {
                Doc.Group group = (Doc.Group) doc;
                return leadingBlank(group.getContents(), group.isForceBreak() ? Mode.BREAK : mode);
            }
            case IF_BREAK: {
                Doc.IfBreak ifBreak = (Doc.IfBreak) doc;
                return leadingBlank(mode == Mode.BREAK ? ifBreak.getWhenBroken() : ifBreak.getWhenFlat(), mode);
            }
            case LINE:
                return true;
            case SOFT_LINE:
            case DOUBLE_SOFT_LINE:
                return mode == Mode.BREAK ? Boolean.TRUE : null;
            default:
                return null;
        }
    }

    private static Boolean firstLeadingBlank(List<Doc> parts, Mode mode) {
        for (Doc part : parts) {
            Boolean result = leadingBlank(part, mode);
            if (result != null) {
                return result;
            }
        }
        return null;
    }
}
