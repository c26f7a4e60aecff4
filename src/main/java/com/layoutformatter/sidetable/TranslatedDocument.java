package com.layoutformatter.sidetable;

import java.util.Objects;

import com.layoutformatter.doc.Doc;

/**
 * A document as produced by translation: the layout tree and the side tables its markers fill.
 */
public class TranslatedDocument {
    private final Doc doc;
    private final SideTables sideTables;

    public TranslatedDocument(Doc doc, SideTables sideTables) {
        this.doc = Objects.requireNonNull(doc, "doc");
        this.sideTables = Objects.requireNonNull(sideTables, "sideTables");
    }

    public TranslatedDocument(Doc doc) {
        this(doc, new SideTables());
    }

    public Doc getDoc() {
        return doc;
    }

    public SideTables getSideTables() {
        return sideTables;
    }
}
