package com.layoutformatter.correction;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

import com.layoutformatter.core.DocRenderer;
import com.layoutformatter.doc.Doc;
import com.layoutformatter.doc.DocBuilder;

/**
 * Call-shape records keyed by the rendered line the call starts on. A line holds at most
 * one record: the outermost call that started there.
 */
public class CallShapeTable {
    private final NavigableMap<Integer, CallShapeRecord> byFirstLine = new TreeMap<>();

    /**
     * Adds {@code record} unless a call already started on its first line.
     *
     * @return the added record, or {@code null} if it was ignored
     */
    public CallShapeRecord add(CallShapeRecord record) {
        if (byFirstLine.containsKey(record.getFirstLine())) {
            return null;
        }
        byFirstLine.put(record.getFirstLine(), record);
        return record;
    }

    /**
     * Adds {@code record}, replacing whatever was recorded for its first line.
     */
    public void put(CallShapeRecord record) {
        byFirstLine.put(record.getFirstLine(), record);
    }

    public CallShapeRecord get(int firstLine) {
        return byFirstLine.get(firstLine);
    }

    public NavigableMap<Integer, CallShapeRecord> asMap() {
        return Collections.unmodifiableNavigableMap(byFirstLine);
    }

    public boolean isEmpty() {
        return byFirstLine.isEmpty();
    }

    public void clear() {
        byFirstLine.clear();
    }

    public Tracker track() {
        return track(DocRenderer.DEFAULT_INDENT_SIZE);
    }

    /**
     * Markers for one call rendered with {@code indentSize} columns per indent step.
     */
    public Tracker track(int indentSize) {
        return new Tracker(indentSize);
    }

    /**
     * Markers that fill one call-shape record from rendered positions. Place
     * {@link #firstParam()} outside the arguments' indentation so that it sees the
     * call's own indent.
     */
    public final class Tracker {
        private final int indentSize;
        private CallShapeRecord record;

        private Tracker(int indentSize) {
            this.indentSize = indentSize;
        }

        /**
         * Starts the record at the first parameter's rendered position. Broken arguments
         * hang one indent step past that column.
         */
        public Doc firstParam() {
            return DocBuilder.mark(position -> record = add(new CallShapeRecord(
                    position.getLine(), position.getIndent(), position.getColumn() + indentSize)));
        }

        /**
         * Placed right after an opening bracket followed by a line break: the call needs a
         * dedent if the bracket was written on the call's first line.
         */
        public Doc opensBlock() {
            return DocBuilder.mark(position -> {
                if (record != null) {
                    record.setNeedsDedent(position.getLine() == record.getFirstLine());
                }
            });
        }

        /**
         * Placed before a closing delimiter written at the call's own indent.
         */
        public Doc closing() {
            return DocBuilder.mark(position -> {
                if (record != null) {
                    record.setClosingLine(position.getLine());
                }
            });
        }

        /**
         * Placed after the last argument or closing delimiter.
         */
        public Doc end() {
            return DocBuilder.mark(position -> {
                if (record != null) {
                    record.setLastLine(position.getLine());
                }
            });
        }

        public CallShapeRecord getRecord() {
            return record;
        }
    }
}
