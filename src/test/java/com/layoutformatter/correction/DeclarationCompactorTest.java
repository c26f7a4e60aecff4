package com.layoutformatter.correction;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.layoutformatter.api.AppliedCorrection;
import com.layoutformatter.api.error.FormatterBugException;
import com.layoutformatter.sidetable.SideTables;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeclarationCompactorTest {

    private DeclarationCompactor compactor;
    private SideTables sideTables;

    @BeforeEach
    void setUp() {
        compactor = new DeclarationCompactor();
        sideTables = new SideTables();
    }

    @Test
    @DisplayName("one-liners from adjacent source lines lose the blank line between them")
    void compactionScenario() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("def a; end", "", "def b; end"));
        sideTables.addInlineDeclaration(new InlineDeclaration(0, 0));
        sideTables.addInlineDeclaration(new InlineDeclaration(2, 1));

        List<AppliedCorrection> corrections = compactor.apply(buffer, sideTables);

        assertThat(buffer.getLines()).containsExactly("def a; end", "def b; end");
        assertThat(corrections).extracting(AppliedCorrection::getType).containsExactly("compact-declarations");
        assertThat(sideTables.getInlineDeclarations()).isEmpty();
    }

    @Test
    @DisplayName("a chain of one-liners is compacted from the bottom up")
    void chainCompacted() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("def a; end", "", "def b; end", "", "def c; end"));
        sideTables.addInlineDeclaration(new InlineDeclaration(0, 7));
        sideTables.addInlineDeclaration(new InlineDeclaration(2, 8));
        sideTables.addInlineDeclaration(new InlineDeclaration(4, 9));

        compactor.apply(buffer, sideTables);

        assertThat(buffer.getLines()).containsExactly("def a; end", "def b; end", "def c; end");
    }

    @Test
    @DisplayName("definitions apart in the source keep their blank line")
    void sourceGapKept() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("def a; end", "", "def b; end"));
        sideTables.addInlineDeclaration(new InlineDeclaration(0, 0));
        sideTables.addInlineDeclaration(new InlineDeclaration(2, 2));

        assertThat(compactor.apply(buffer, sideTables)).isEmpty();
        assertThat(buffer.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("a non-blank line between definitions is never deleted")
    void contentBetweenKept() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("def a; end", "# note", "def b; end"));
        sideTables.addInlineDeclaration(new InlineDeclaration(0, 0));
        sideTables.addInlineDeclaration(new InlineDeclaration(2, 1));

        compactor.apply(buffer, sideTables);

        assertThat(buffer.getLines()).containsExactly("def a; end", "# note", "def b; end");
    }

    @Test
    @DisplayName("a declaration outside the rendered text is a formatter bug")
    void declarationOutOfRange() {
        LineBuffer buffer = LineBuffer.ofLines(List.of("def a; end"));
        sideTables.addInlineDeclaration(new InlineDeclaration(0, 0));
        sideTables.addInlineDeclaration(new InlineDeclaration(2, 1));

        assertThatThrownBy(() -> compactor.apply(buffer, sideTables))
                .isInstanceOf(FormatterBugException.class)
                .hasMessageContaining("InlineDeclaration");
        assertThat(buffer.size()).isEqualTo(1);
    }
}
