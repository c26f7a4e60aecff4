package com.layoutformatter.sidetable;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.layoutformatter.api.error.FormatterBugException;
import com.layoutformatter.core.DocRenderer;
import com.layoutformatter.doc.Doc;
import com.layoutformatter.doc.RenderPosition;

import static com.layoutformatter.doc.DocBuilder.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SideTablesTest {

    private SideTables sideTables;
    private DocRenderer renderer;

    @BeforeEach
    void setUp() {
        sideTables = new SideTables();
        renderer = new DocRenderer();
    }

    @Test
    @DisplayName("verbatim bodies mark every line after the opening one")
    void verbatimLines() {
        Span verbatim = sideTables.trackVerbatim();
        Doc doc = concat(
                text("x = <<~EOS"),
                verbatim.around(align(0, concat(LINE, text("  raw  text"), LINE, text("EOS")))),
                LINE,
                text("y"));

        renderer.render(doc, 80);

        assertThat(sideTables.getUnmodifiableLines()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("only definitions rendered on one line are recorded")
    void inlineDeclarations() {
        Span oneLiner = sideTables.trackInlineDeclaration(4);
        Span multiLine = sideTables.trackInlineDeclaration(5);
        Doc doc = concat(
                oneLiner.around(text("def a; end")),
                LINE,
                multiLine.around(concat(text("def b"), indent(concat(LINE, text("1"))), LINE, text("end"))));

        renderer.render(doc, 80);

        assertThat(sideTables.getInlineDeclarations()).singleElement().satisfies(declaration -> {
            assertThat(declaration.getRenderedLine()).isZero();
            assertThat(declaration.getOriginalSourceLine()).isEqualTo(4);
        });
    }

    @Test
    @DisplayName("literal indent spans record their first and last line")
    void literalIndent() {
        Span literal = sideTables.trackLiteralIndent(3);
        Doc doc = concat(text("x = "), literal.around(concat(text("["), indent(concat(LINE, text("1"))), LINE, text("]"))));

        renderer.render(doc, 80);

        assertThat(sideTables.getLiteralIndents()).singleElement().satisfies(record -> {
            assertThat(record.getFirstLine()).isZero();
            assertThat(record.getLastLine()).isEqualTo(2);
            assertThat(record.getExtraIndent()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("span markers rendered out of order are formatter bugs")
    void spanMisuse() {
        Span endFirst = new Span("test", (start, end) -> {
        });
        assertThatThrownBy(() -> renderer.render(endFirst.end(), 80)).isInstanceOf(FormatterBugException.class);

        Span twice = new Span("test", (start, end) -> {
        });
        Doc start = twice.start();
        assertThatThrownBy(() -> renderer.render(concat(start, start), 80))
                .isInstanceOf(FormatterBugException.class)
                .hasMessageContaining("twice");
    }

    @Test
    @DisplayName("a span reports both rendered positions")
    void spanPositions() {
        RenderPosition[] reported = new RenderPosition[2];
        Span span = new Span("test", (start, end) -> {
            reported[0] = start;
            reported[1] = end;
        });

        renderer.render(concat(text("ab"), span.around(text("cd"))), 80);

        assertThat(span.isComplete()).isTrue();
        assertThat(reported[0].getColumn()).isEqualTo(2);
        assertThat(reported[1].getColumn()).isEqualTo(4);
    }
}
