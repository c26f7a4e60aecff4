package com.layoutformatter.api;

import java.util.Map;

import com.layoutformatter.doc.Doc;
import com.layoutformatter.sidetable.SideTables;
import com.layoutformatter.sidetable.TranslatedDocument;

/**
 * Turns a translated document into its final text.
 */
public interface DocumentFormatter {
    /**
     * Renders {@code doc} within {@code maxWidth} and applies the corrections recorded in
     * {@code sideTables}.
     *
     * @throws com.layoutformatter.api.error.FormatterBugException if a record violates an invariant
     */
    String format(Doc doc, int maxWidth, SideTables sideTables);

    FormatterResult formatDocument(TranslatedDocument document);

    Map<String, FormatterResult> formatAll(Map<String, TranslatedDocument> documents);
}
