package com.layoutformatter.ledger;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import com.layoutformatter.api.AppliedCorrection;
import com.layoutformatter.api.CorrectionPass;
import com.layoutformatter.api.error.FormatterBugException;
import com.layoutformatter.config.FormatterConfig;
import com.layoutformatter.correction.LineBuffer;
import com.layoutformatter.sidetable.SideTables;
import com.layoutformatter.util.LoggerUtil;

/**
 * Aligns runs of same-category ledger entries on consecutive lines to a common column by
 * inserting spaces in front of the entries that are further left.
 *
 * <p>Categories are processed so that constructs further right on a line are aligned
 * after the ones they follow: assignments, call arguments, case clauses, then comments.
 */
public class AlignmentCorrector implements CorrectionPass {
    private static final Logger logger = LoggerUtil.getLogger(AlignmentCorrector.class);

    private static final List<AlignmentCategory> ORDER = List.of(
            AlignmentCategory.ASSIGNMENT,
            AlignmentCategory.CALL_ALIGNMENT,
            AlignmentCategory.CASE_WHEN,
            AlignmentCategory.COMMENT);

    private final Set<AlignmentCategory> enabled = EnumSet.noneOf(AlignmentCategory.class);

    @Override
    public void initialize(FormatterConfig config) {
        enabled.clear();
        for (AlignmentCategory category : AlignmentCategory.values()) {
            boolean defaultValue = category != AlignmentCategory.CASE_WHEN;
            if (config.getPassConfig(FormatterConfig.ALIGNMENT, category.getConfigKey(), defaultValue)) {
                enabled.add(category);
            }
        }
    }

    /**
     * Enables exactly the given categories, bypassing configuration.
     */
    public void enableOnly(Set<AlignmentCategory> categories) {
        enabled.clear();
        enabled.addAll(categories);
    }

    @Override
    public String getName() {
        return FormatterConfig.ALIGNMENT;
    }

    @Override
    public List<AppliedCorrection> apply(LineBuffer buffer, SideTables sideTables) {
        Ledger ledger = sideTables.getLedger();
        List<AppliedCorrection> corrections = new ArrayList<>();
        if (ledger.isEmpty()) {
            return corrections;
        }

        Map<Integer, List<LedgerEntry>> entriesByLine = new HashMap<>();
        for (LedgerEntry entry : ledger.getAllEntries()) {
            buffer.requireLine(entry.getLine(), entry);
            entriesByLine.computeIfAbsent(entry.getLine(), k -> new ArrayList<>()).add(entry);
        }

        for (AlignmentCategory category : ORDER) {
            if (!enabled.contains(category)) {
                continue;
            }
            for (AlignmentRun run : partition(ledger.getEntries(category))) {
                if (run.size() > 1) {
                    alignRun(run, buffer, entriesByLine, corrections);
                }
            }
        }

        ledger.clear();
        return corrections;
    }

    /**
     * Splits entries, in recording order, into maximal runs of consecutive lines sharing
     * an identity.
     */
    static List<AlignmentRun> partition(List<LedgerEntry> entries) {
        List<AlignmentRun> runs = new ArrayList<>();
        AlignmentRun current = null;
        for (LedgerEntry entry : entries) {
            if (current == null || !current.accepts(entry)) {
                current = new AlignmentRun();
                runs.add(current);
            }
            current.add(entry);
        }
        return runs;
    }

    private void alignRun(AlignmentRun run, LineBuffer buffer, Map<Integer, List<LedgerEntry>> entriesByLine,
                          List<AppliedCorrection> corrections) {
        int target = run.targetColumn();
        int moved = 0;

        for (LedgerEntry entry : run.getEntries()) {
            int line = entry.getLine();
            if (entry.getColumn() >= target || buffer.isUnmodifiable(line)) {
                continue;
            }

            int fillerWidth = target - entry.getColumn();
            int splitIndex = entry.getSplitIndex();
            String text = buffer.getLine(line);
            int lineWidth = text.codePointCount(0, text.length());
            if (splitIndex < 0 || splitIndex > lineWidth) {
                throw new FormatterBugException("Alignment point outside line " + line
                        + " of width " + lineWidth, entry);
            }

            // columns count code points, the buffer splices chars
            String filler = " ".repeat(fillerWidth);
            buffer.insert(line, text.offsetByCodePoints(0, splitIndex), filler);
            shiftEntries(entriesByLine.get(line), entry, splitIndex, fillerWidth);
            entry.shift(fillerWidth);

            if (entry.getCategory() == AlignmentCategory.ASSIGNMENT) {
                for (int continuation = line + 1; continuation <= entry.getEndLine(); continuation++) {
                    buffer.requireLine(continuation, entry);
                    if (buffer.isUnmodifiable(continuation)) {
                        continue;
                    }
                    buffer.prefix(continuation, filler);
                    shiftEntries(entriesByLine.get(continuation), null, -1, fillerWidth);
                }
            }
            moved++;
        }

        if (moved > 0) {
            logger.fine("Aligned " + run.size() + " " + run.getEntries().get(0).getCategory()
                    + " entries at column " + target + " on lines " + run.getFirstLine() + "-" + run.getLastLine());
            corrections.add(new AppliedCorrection("align-" + run.getEntries().get(0).getCategory().name().toLowerCase(),
                    run.getFirstLine(), run.getLastLine(),
                    "Aligned " + run.size() + " entries to column " + target));
        }
    }

    /**
     * Moves every entry on a line right of {@code splitIndex} by {@code width}, except {@code moved}.
     */
    private static void shiftEntries(List<LedgerEntry> lineEntries, LedgerEntry moved, int splitIndex, int width) {
        if (lineEntries == null) {
            return;
        }
        for (LedgerEntry other : lineEntries) {
            if (other != moved && other.getColumn() > splitIndex) {
                other.shift(width);
            }
        }
    }
}
