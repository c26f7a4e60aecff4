package com.layoutformatter.doc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.layoutformatter.doc.DocBuilder.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocBuilderTest {

    @Test
    @DisplayName("text rejects embedded line breaks")
    void textWithNewline() {
        assertThatThrownBy(() -> text("a\nb")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> text("a\rb")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("empty text is the shared empty node")
    void emptyText() {
        assertThat(text("")).isSameAs(empty());
        assertThat(((Doc.Text) text("abc")).width()).isEqualTo(3);
    }

    @Test
    @DisplayName("negative align column is rejected")
    void negativeAlign() {
        assertThatThrownBy(() -> align(-1, text("x"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("null children are rejected")
    void nullChildren() {
        assertThatThrownBy(() -> concat(text("a"), null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> group(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> join(null, List.of())).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("concat copies its parts")
    void concatCopies() {
        List<Doc> parts = new ArrayList<>(Arrays.asList(text("a"), text("b")));
        Doc.Concat doc = (Doc.Concat) concat(parts);
        parts.add(text("c"));

        assertThat(doc.getParts()).hasSize(2);
    }

    @Test
    @DisplayName("forcedGroup sets the force-break flag")
    void forcedGroupFlag() {
        assertThat(((Doc.Group) forcedGroup(text("x"))).isForceBreak()).isTrue();
        assertThat(((Doc.Group) group(text("x"))).isForceBreak()).isFalse();
    }

    @Test
    @DisplayName("break nodes render as a space or nothing when flat")
    void breakFlatText() {
        assertThat(((Doc.Break) LINE).flatText()).isEqualTo(" ");
        assertThat(((Doc.Break) SOFT_LINE).flatText()).isEmpty();
        assertThat(((Doc.Break) DOUBLE_SOFT_LINE).flatText()).isEmpty();
    }
}
