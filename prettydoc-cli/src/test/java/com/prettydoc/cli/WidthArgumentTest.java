package com.prettydoc.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link WidthArgument}.
 */
class WidthArgumentTest {

    @Test
    void parse_withDecimal_returnsValue() {
        assertThat(WidthArgument.parse("40", 80)).isEqualTo(40);
        assertThat(WidthArgument.parse(" 120 ", 80)).isEqualTo(120);
    }

    @Test
    void parse_withZero_returnsZero() {
        assertThat(WidthArgument.parse("0", 80)).isZero();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "abc", "4O", "12.5", "0x20", "99999999999", "-1", "-40"})
    void parse_withUnusableValue_returnsFallback(String raw) {
        assertThat(WidthArgument.parse(raw, 80)).isEqualTo(80);
    }
}
