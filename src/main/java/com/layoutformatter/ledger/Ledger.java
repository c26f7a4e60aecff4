package com.layoutformatter.ledger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.layoutformatter.doc.Doc;
import com.layoutformatter.doc.DocBuilder;
import com.layoutformatter.sidetable.Span;

/**
 * Rendered positions of alignable constructs, per category, in the order they were
 * written.
 *
 * <p>Positions either come from markers placed in the document ({@code track*}), which
 * record where the renderer actually wrote the construct, or are recorded directly by
 * callers that already know rendered coordinates.
 */
public class Ledger {
    private final Map<AlignmentCategory, List<LedgerEntry>> entries = new EnumMap<>(AlignmentCategory.class);

    public Ledger() {
        for (AlignmentCategory category : AlignmentCategory.values()) {
            entries.put(category, new ArrayList<>());
        }
    }

    /**
     * Appends an entry. Apart from comments only the first entry of a category per line
     * is kept; later ones on the same line are ignored and {@code null} is returned.
     */
    public LedgerEntry record(AlignmentCategory category, int line, int column, Object identityId, int offset) {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Negative position " + line + ":" + column + " for " + category);
        }
        List<LedgerEntry> target = entries.get(category);
        if (category != AlignmentCategory.COMMENT && !target.isEmpty()
                && target.get(target.size() - 1).getLine() == line) {
            return null;
        }
        LedgerEntry entry = new LedgerEntry(category, line, column, identityId, offset);
        target.add(entry);
        return entry;
    }

    public LedgerEntry record(AlignmentCategory category, int line, int column) {
        return record(category, line, column, null, 0);
    }

    /**
     * Records an assignment whose value continues down to {@code endLine}.
     */
    public LedgerEntry recordAssignment(int line, int column, Object identityId, int offset, int endLine) {
        if (endLine < line) {
            throw new IllegalArgumentException("Assignment ends at line " + endLine + " before it starts at " + line);
        }
        LedgerEntry entry = record(AlignmentCategory.ASSIGNMENT, line, column, identityId, offset);
        if (entry != null) {
            entry.setEndLine(endLine);
        }
        return entry;
    }

    /**
     * A marker recording an entry at the position it is rendered at.
     */
    public Doc track(AlignmentCategory category, Object identityId, int offset) {
        return DocBuilder.mark(position ->
                record(category, position.getLine(), position.getColumn(), identityId, offset));
    }

    public Doc track(AlignmentCategory category) {
        return track(category, null, 0);
    }

    public Doc trackComment(Object identityId) {
        return track(AlignmentCategory.COMMENT, identityId, 0);
    }

    /**
     * A comment marker that takes the identity of the comment recorded just before it.
     */
    public Doc trackCommentMatchingPrevious() {
        return DocBuilder.mark(position -> {
            List<LedgerEntry> comments = entries.get(AlignmentCategory.COMMENT);
            Object identityId = comments.isEmpty() ? null : comments.get(comments.size() - 1).getIdentityId();
            record(AlignmentCategory.COMMENT, position.getLine(), position.getColumn(), identityId, 0);
        });
    }

    /**
     * Markers for an assignment: the start is where the aligned token is written, the end
     * follows the assigned value.
     */
    public Span trackAssignment(Object identityId, int offset) {
        LedgerEntry[] recorded = new LedgerEntry[1];
        return new Span("assignment",
                start -> recorded[0] = record(AlignmentCategory.ASSIGNMENT,
                        start.getLine(), start.getColumn(), identityId, offset),
                (start, end) -> {
                    if (recorded[0] != null) {
                        recorded[0].setEndLine(end.getLine());
                    }
                });
    }

    public List<LedgerEntry> getEntries(AlignmentCategory category) {
        return Collections.unmodifiableList(entries.get(category));
    }

    public List<LedgerEntry> getAllEntries() {
        List<LedgerEntry> all = new ArrayList<>();
        for (List<LedgerEntry> categoryEntries : entries.values()) {
            all.addAll(categoryEntries);
        }
        return all;
    }

    public boolean isEmpty() {
        return entries.values().stream().allMatch(List::isEmpty);
    }

    public void clear() {
        entries.values().forEach(List::clear);
    }
}
