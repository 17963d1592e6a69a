package org.syntaxscript.compiler.api;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SourceRange} and {@link SourcePosition}.
 */
public class SourceRangeTest {

    /**
     * Verifies that conversion to 0-based coordinates decrements both coordinates and clamps at zero.
     */
    @Test
    @Tag("unit")
    void testToZeroBased() {
        assertThat(SourceRange.of(3, 5, 9).toZeroBased()).isEqualTo(SourceRange.of(2, 4, 8));
        assertThat(SourceRange.ORIGIN.toZeroBased()).isEqualTo(SourceRange.ORIGIN);
        assertThat(new SourcePosition(1, 0).toZeroBased()).isEqualTo(new SourcePosition(0, 0));
    }

    @Test
    @Tag("unit")
    void testSpanAndExtend() {
        SourceRange span = SourceRange.span(SourceRange.of(1, 1, 7), SourceRange.of(2, 3, 8));
        assertThat(span).isEqualTo(new SourceRange(new SourcePosition(1, 1), new SourcePosition(2, 8)));
        assertThat(span.extendEnd(1).end()).isEqualTo(new SourcePosition(2, 9));
    }

    @Test
    @Tag("unit")
    void testStartMustNotFollowEnd() {
        assertThatThrownBy(() -> SourceRange.of(1, 5, 4)).isInstanceOf(IllegalArgumentException.class);
    }
}
