package com.layoutformatter.correction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

import com.layoutformatter.api.AppliedCorrection;
import com.layoutformatter.api.CorrectionPass;
import com.layoutformatter.config.FormatterConfig;
import com.layoutformatter.core.DocRenderer;
import com.layoutformatter.sidetable.SideTables;
import com.layoutformatter.util.LoggerUtil;

/**
 * Reconciles call and literal layouts with the author's shape.
 *
 * <p>The dedent pass turns
 * <pre>
 * foo bar(
 *           2,
 *         )
 * </pre>
 * into
 * <pre>
 * foo bar(
 *   2,
 * )
 * </pre>
 * and the indent restoration pass puts back the deeper indentation of literals whose
 * closing bracket was written under their opening token.
 */
public class CallShapeCorrector implements CorrectionPass {
    private static final Logger logger = LoggerUtil.getLogger(CallShapeCorrector.class);

    private int indentSize = DocRenderer.DEFAULT_INDENT_SIZE;

    @Override
    public void initialize(FormatterConfig config) {
        this.indentSize = config.getIndentSize();
    }

    @Override
    public String getName() {
        return FormatterConfig.CALL_SHAPE;
    }

    @Override
    public List<AppliedCorrection> apply(LineBuffer buffer, SideTables sideTables) {
        List<AppliedCorrection> corrections = new ArrayList<>();
        dedentCalls(buffer, sideTables.getCallShapes(), corrections);
        restoreLiteralIndents(buffer, sideTables.getLiteralIndents(), corrections);
        sideTables.clearCallShapeRecords();
        return corrections;
    }

    /**
     * Moves the arguments of qualifying calls from their hanging column to one indent step
     * past the call's own indent, and the closing delimiter to the call's indent. Records starting on a line consumed by an enclosing
     * call are dropped.
     */
    void dedentCalls(LineBuffer buffer, CallShapeTable callShapes, List<AppliedCorrection> corrections) {
        TreeMap<Integer, CallShapeRecord> pending = new TreeMap<>(callShapes.asMap());

        while (!pending.isEmpty()) {
            Map.Entry<Integer, CallShapeRecord> first = pending.pollFirstEntry();
            CallShapeRecord record = first.getValue();
            if (!record.qualifiesForDedent()) {
                continue;
            }

            int lastLine = record.getLastLine();
            buffer.requireLine(record.getFirstLine(), record);
            buffer.requireLine(lastLine, record);

            int width = record.getFirstParamColumn() - record.getIndent() - indentSize;
            for (int line = record.getFirstLine() + 1; line <= lastLine; line++) {
                pending.remove(line);
                if (width <= 0 || buffer.isUnmodifiable(line)) {
                    continue;
                }
                buffer.removeLeadingBlanks(line, width);
            }

            if (width > 0) {
                logger.fine("Dedented call arguments on lines " + (record.getFirstLine() + 1) + "-" + lastLine
                        + " by " + width);
                corrections.add(new AppliedCorrection("dedent-call", record.getFirstLine(), lastLine,
                        "Dedented call arguments by " + width + " columns"));
            }
        }
    }

    /**
     * Re-inserts the extra indentation of literals whose closing bracket hugs the opening token.
     */
    void restoreLiteralIndents(LineBuffer buffer, List<LiteralIndentRecord> records,
                               List<AppliedCorrection> corrections) {
        for (LiteralIndentRecord record : records) {
            buffer.requireLine(record.getFirstLine(), record);
            buffer.requireLine(record.getLastLine(), record);
            if (record.getExtraIndent() <= 0) {
                continue;
            }

            String filler = " ".repeat(record.getExtraIndent());
            for (int line = record.getFirstLine() + 1; line <= record.getLastLine(); line++) {
                if (buffer.isUnmodifiable(line) || buffer.isBlank(line)) {
                    continue;
                }
                buffer.prefix(line, filler);
            }

            corrections.add(new AppliedCorrection("restore-literal-indent", record.getFirstLine(),
                    record.getLastLine(), "Restored " + record.getExtraIndent() + " columns of literal indentation"));
        }
    }
}
