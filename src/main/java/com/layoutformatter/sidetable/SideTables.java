package com.layoutformatter.sidetable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import com.layoutformatter.correction.CallShapeTable;
import com.layoutformatter.correction.InlineDeclaration;
import com.layoutformatter.correction.LiteralIndentRecord;
import com.layoutformatter.ledger.Ledger;

/**
 * Everything translation records for the correction passes, bundled for one document.
 * Not shared between documents and not thread safe.
 */
public class SideTables {
    private final Ledger ledger = new Ledger();
    private final CallShapeTable callShapes = new CallShapeTable();
    private final List<LiteralIndentRecord> literalIndents = new ArrayList<>();
    private final List<InlineDeclaration> inlineDeclarations = new ArrayList<>();
    private final Set<Integer> unmodifiableLines = new TreeSet<>();
    // first lines of verbatim spans the renderer has entered but not left
    private final List<Integer> openVerbatimStarts = new ArrayList<>();

    public Ledger getLedger() {
        return ledger;
    }

    public CallShapeTable getCallShapes() {
        return callShapes;
    }

    public List<LiteralIndentRecord> getLiteralIndents() {
        return Collections.unmodifiableList(literalIndents);
    }

    public List<InlineDeclaration> getInlineDeclarations() {
        return Collections.unmodifiableList(inlineDeclarations);
    }

    public Set<Integer> getUnmodifiableLines() {
        return Collections.unmodifiableSet(unmodifiableLines);
    }

    public void addLiteralIndent(LiteralIndentRecord record) {
        literalIndents.add(record);
    }

    /**
     * Markers around a literal whose closing bracket hugs its opening token.
     */
    public Span trackLiteralIndent(int extraIndent) {
        return new Span("literal indent " + extraIndent, (start, end) ->
                literalIndents.add(new LiteralIndentRecord(start.getLine(), end.getLine(), extraIndent)));
    }

    public void addInlineDeclaration(InlineDeclaration declaration) {
        inlineDeclarations.add(declaration);
    }

    /**
     * Markers around a definition; it is recorded only if it rendered on one line.
     */
    public Span trackInlineDeclaration(int originalSourceLine) {
        return new Span("declaration from source line " + originalSourceLine, (start, end) -> {
            if (start.getLine() == end.getLine()) {
                inlineDeclarations.add(new InlineDeclaration(start.getLine(), originalSourceLine));
            }
        });
    }

    public void markUnmodifiable(int line) {
        unmodifiableLines.add(line);
    }

    /**
     * Markers around a verbatim string or heredoc body: every rendered line after the
     * first becomes unmodifiable.
     */
    public Span trackVerbatim() {
        return new Span("verbatim", start -> openVerbatimStarts.add(start.getLine()), (start, end) -> {
            openVerbatimStarts.remove(Integer.valueOf(start.getLine()));
            for (int line = start.getLine() + 1; line <= end.getLine(); line++) {
                unmodifiableLines.add(line);
            }
        });
    }

    /**
     * Whether {@code line} is part of a verbatim body, including bodies the renderer is
     * still writing.
     */
    public boolean isVerbatimLine(int line) {
        if (unmodifiableLines.contains(line)) {
            return true;
        }
        for (int start : openVerbatimStarts) {
            if (line > start) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops call-shape and literal-indent records once the call-shape pass consumed them.
     */
    public void clearCallShapeRecords() {
        callShapes.clear();
        literalIndents.clear();
    }

    public void clearInlineDeclarations() {
        inlineDeclarations.clear();
    }
}
