package org.gscript.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SourceSpanTest {

    @Test
    void extract_returnsCoveredText() {
        var span = SourceSpan.of(SourceLocation.at(1, 5, 4), SourceLocation.at(1, 10, 9));

        assertThat(span.extract("let total = 1;")).isEqualTo("total");
        assertThat(span.length()).isEqualTo(5);
        assertThat(span.line()).isEqualTo(1);
    }

    @Test
    void toString_showsLineAndColumn() {
        var span = SourceSpan.of(SourceLocation.at(3, 7, 20), SourceLocation.at(3, 12, 25));

        assertThat(span.toString()).isEqualTo("3:7-3:12");
        assertThat(SourceSpan.NONE.length()).isZero();
    }
}
