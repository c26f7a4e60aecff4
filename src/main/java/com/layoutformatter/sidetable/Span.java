package com.layoutformatter.sidetable;

import com.layoutformatter.api.error.FormatterBugException;
import com.layoutformatter.doc.Doc;
import com.layoutformatter.doc.DocBuilder;
import com.layoutformatter.doc.PositionHook;
import com.layoutformatter.doc.RenderPosition;

/**
 * A pair of markers delimiting a stretch of the document. Once the renderer has passed
 * both, the span reports its rendered start and end.
 */
public final class Span {

    @FunctionalInterface
    public interface Completion {
        void completed(RenderPosition start, RenderPosition end);
    }

    private final String description;
    private final PositionHook onStart;
    private final Completion completion;
    private RenderPosition start;
    private RenderPosition end;

    public Span(String description, Completion completion) {
        this(description, position -> {
        }, completion);
    }

    public Span(String description, PositionHook onStart, Completion completion) {
        this.description = description;
        this.onStart = onStart;
        this.completion = completion;
    }

    public Doc start() {
        return DocBuilder.mark(this::started);
    }

    public Doc end() {
        return DocBuilder.mark(this::ended);
    }

    /**
     * Brackets {@code contents} with this span's markers.
     */
    public Doc around(Doc contents) {
        return DocBuilder.concat(start(), contents, end());
    }

    public boolean isComplete() {
        return end != null;
    }

    public RenderPosition getStart() {
        return start;
    }

    public RenderPosition getEnd() {
        return end;
    }

    private void started(RenderPosition position) {
        if (start != null) {
            throw new FormatterBugException("Span start rendered twice", this);
        }
        start = position;
        onStart.reached(position);
    }

    private void ended(RenderPosition position) {
        if (start == null) {
            throw new FormatterBugException("Span end rendered before its start", this);
        }
        if (end != null) {
            throw new FormatterBugException("Span end rendered twice", this);
        }
        end = position;
        completion.completed(start, end);
    }

    @Override
    public String toString() {
        return "Span(" + description + ", start=" + start + ", end=" + end + ")";
    }
}
