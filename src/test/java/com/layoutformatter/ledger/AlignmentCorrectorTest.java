package com.layoutformatter.ledger;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.layoutformatter.api.AppliedCorrection;
import com.layoutformatter.api.error.FormatterBugException;
import com.layoutformatter.config.FormatterConfig;
import com.layoutformatter.correction.LineBuffer;
import com.layoutformatter.sidetable.SideTables;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlignmentCorrectorTest {

    private AlignmentCorrector corrector;
    private SideTables sideTables;
    private Ledger ledger;

    @BeforeEach
    void setUp() {
        corrector = new AlignmentCorrector();
        corrector.initialize(new FormatterConfig(Map.of(), Map.of()));
        sideTables = new SideTables();
        ledger = sideTables.getLedger();
    }

    @Test
    @DisplayName("trailing comments on consecutive lines are aligned")
    void commentScenario() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("a # c1", "bb # c2"));
        ledger.record(AlignmentCategory.COMMENT, 0, 2);
        ledger.record(AlignmentCategory.COMMENT, 1, 3);

        List<AppliedCorrection> corrections = corrector.apply(buffer, sideTables);

        assertThat(buffer.getLines()).containsExactly("a  # c1", "bb # c2");
        assertThat(corrections).singleElement()
                .satisfies(c -> assertThat(c.getType()).isEqualTo("align-comment"));
        assertThat(ledger.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("a run is moved to its rightmost column and other entries on a line follow")
    void runTargetAndShift() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("xxxA     B", "xxxxxxxA", "xxxxxA"));
        LedgerEntry first = ledger.record(AlignmentCategory.CALL_ALIGNMENT, 0, 3);
        LedgerEntry second = ledger.record(AlignmentCategory.CALL_ALIGNMENT, 1, 7);
        LedgerEntry third = ledger.record(AlignmentCategory.CALL_ALIGNMENT, 2, 5);
        LedgerEntry unrelated = ledger.record(AlignmentCategory.COMMENT, 0, 9);

        corrector.apply(buffer, sideTables);

        assertThat(buffer.getLines()).containsExactly("xxx    A     B", "xxxxxxxA", "xxxxx  A");
        assertThat(List.of(first.getColumn(), second.getColumn(), third.getColumn())).containsOnly(7);
        assertThat(unrelated.getColumn()).isEqualTo(13);
        assertThat(buffer.getLine(0).indexOf('B')).isEqualTo(13);
        assertThat(first.getOwningRun()).isSameAs(third.getOwningRun());
        assertThat(third.getIndexInRun()).isEqualTo(2);
    }

    @Test
    @DisplayName("columns after a character outside the basic plane are counted in code points")
    void supplementaryCharacters() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("\uD83D\uDE00 # c1", "ab # c2"));
        ledger.record(AlignmentCategory.COMMENT, 0, 2);
        ledger.record(AlignmentCategory.COMMENT, 1, 3);

        corrector.apply(buffer, sideTables);

        assertThat(buffer.getLines()).containsExactly("\uD83D\uDE00  # c1", "ab # c2");
    }

    @Test
    @DisplayName("runs break on a line gap or a different identity")
    void runBreaks() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("a # x", "", "bb # y", "ccc # z"));
        ledger.record(AlignmentCategory.COMMENT, 0, 2);
        ledger.record(AlignmentCategory.COMMENT, 2, 3, "first", 0);
        ledger.record(AlignmentCategory.COMMENT, 3, 4, "second", 0);

        List<AppliedCorrection> corrections = corrector.apply(buffer, sideTables);

        assertThat(corrections).isEmpty();
        assertThat(buffer.getLines()).containsExactly("a # x", "", "bb # y", "ccc # z");
    }

    @Test
    @DisplayName("partition groups consecutive lines with equal identities")
    void partition() {
        ledger.record(AlignmentCategory.COMMENT, 0, 1, "a", 0);
        ledger.record(AlignmentCategory.COMMENT, 1, 1, "a", 0);
        ledger.record(AlignmentCategory.COMMENT, 2, 1, "b", 0);
        ledger.record(AlignmentCategory.COMMENT, 4, 1, "b", 0);

        List<AlignmentRun> runs = AlignmentCorrector.partition(ledger.getEntries(AlignmentCategory.COMMENT));

        assertThat(runs).extracting(AlignmentRun::size).containsExactly(2, 1, 1);
    }

    @Test
    @DisplayName("filler goes to the split point in front of the tracked column")
    void offsetSplitsEarlier() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("x = 1", "yy = 2"));
        ledger.record(AlignmentCategory.ASSIGNMENT, 0, 4, null, 2);
        ledger.record(AlignmentCategory.ASSIGNMENT, 1, 5, null, 2);

        corrector.apply(buffer, sideTables);

        assertThat(buffer.getLines()).containsExactly("x  = 1", "yy = 2");
    }

    @Test
    @DisplayName("the continuation lines of a moved assignment move with it")
    void assignmentContinuation() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("yy = 1", "x = foo(", "  bar)"));
        ledger.record(AlignmentCategory.ASSIGNMENT, 0, 3);
        ledger.recordAssignment(1, 2, null, 0, 2);

        corrector.apply(buffer, sideTables);

        assertThat(buffer.getLines()).containsExactly("yy = 1", "x  = foo(", "   bar)");
    }

    @Test
    @DisplayName("assignments are aligned before the comments that follow them")
    void categoryOrder() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("x = 1 # a", "yy = 2 # b"));
        ledger.record(AlignmentCategory.COMMENT, 0, 6);
        ledger.record(AlignmentCategory.COMMENT, 1, 7);
        ledger.record(AlignmentCategory.ASSIGNMENT, 0, 2);
        ledger.record(AlignmentCategory.ASSIGNMENT, 1, 3);

        List<AppliedCorrection> corrections = corrector.apply(buffer, sideTables);

        assertThat(buffer.getLines()).containsExactly("x  = 1 # a", "yy = 2 # b");
        assertThat(corrections).extracting(AppliedCorrection::getType).containsExactly("align-assignment");
    }

    @Test
    @DisplayName("unmodifiable lines are never spliced")
    void unmodifiableLinesSkipped() {
        LineBuffer buffer = LineBuffer.of("a # c1\nbb # c2\n", List.of(0));
        ledger.record(AlignmentCategory.COMMENT, 0, 2);
        ledger.record(AlignmentCategory.COMMENT, 1, 3);

        corrector.apply(buffer, sideTables);

        assertThat(buffer.toText()).isEqualTo("a # c1\nbb # c2\n");
    }

    @Test
    @DisplayName("case clauses are only aligned when enabled")
    void caseWhenDisabledByDefault() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("when 1 then a", "when 22 then b"));
        ledger.record(AlignmentCategory.CASE_WHEN, 0, 7);
        ledger.record(AlignmentCategory.CASE_WHEN, 1, 8);

        assertThat(corrector.apply(buffer, sideTables)).isEmpty();

        ledger.record(AlignmentCategory.CASE_WHEN, 0, 7);
        ledger.record(AlignmentCategory.CASE_WHEN, 1, 8);
        corrector.enableOnly(Set.of(AlignmentCategory.CASE_WHEN));
        corrector.apply(buffer, sideTables);

        assertThat(buffer.getLines()).containsExactly("when 1  then a", "when 22 then b");
    }

    @Test
    @DisplayName("an entry outside the rendered text is a formatter bug")
    void entryOutOfRange() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("a", "b"));
        ledger.record(AlignmentCategory.COMMENT, 5, 0);

        assertThatThrownBy(() -> corrector.apply(buffer, sideTables))
                .isInstanceOf(FormatterBugException.class)
                .satisfies(e -> assertThat(((FormatterBugException) e).getRecord()).isInstanceOf(LedgerEntry.class));
    }

    @Test
    @DisplayName("a split point past the end of its line is a formatter bug")
    void splitPointOutOfRange() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("a", "b # c"));
        ledger.record(AlignmentCategory.COMMENT, 0, 10);
        ledger.record(AlignmentCategory.COMMENT, 1, 12);

        assertThatThrownBy(() -> corrector.apply(buffer, sideTables)).isInstanceOf(FormatterBugException.class);
    }

    @Test
    @DisplayName("re-aligning aligned output changes nothing")
    void idempotent() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("a # c1", "bb # c2"));
        ledger.record(AlignmentCategory.COMMENT, 0, 2);
        ledger.record(AlignmentCategory.COMMENT, 1, 3);
        corrector.apply(buffer, sideTables);
        List<String> aligned = buffer.getLines();

        ledger.record(AlignmentCategory.COMMENT, 0, 3);
        ledger.record(AlignmentCategory.COMMENT, 1, 3);

        assertThat(corrector.apply(buffer, sideTables)).isEmpty();
        assertThat(buffer.getLines()).isEqualTo(aligned);
    }
}
