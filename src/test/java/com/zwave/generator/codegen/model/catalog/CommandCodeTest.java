package com.zwave.generator.codegen.model.catalog;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CommandCode.
 */
class CommandCodeTest {

    @Test
    void testParseHexOneAndTwoDigits() {
        assertThat(CommandCode.parseHex("0x20")).contains(CommandCode.of(0x20));
        assertThat(CommandCode.parseHex("0x1")).contains(CommandCode.of(1));
        assertThat(CommandCode.parseHex("0XfF")).contains(CommandCode.of(255));
    }

    @Test
    void testParseHexRejectsMalformedValues() {
        assertThat(CommandCode.parseHex(null)).isEmpty();
        assertThat(CommandCode.parseHex("0x")).isEmpty();
        assertThat(CommandCode.parseHex("20")).isEmpty();
        assertThat(CommandCode.parseHex("x20")).isEmpty();
        assertThat(CommandCode.parseHex("0xZZ")).isEmpty();
        assertThat(CommandCode.parseHex("0x-1")).isEmpty();
        assertThat(CommandCode.parseHex("0x2 ")).isEmpty();
    }

    @Test
    void testParseHexRejectsValuesAboveEightBits() {
        assertThat(CommandCode.parseHex("0x100")).isEmpty();
        assertThat(CommandCode.parseHex("0xFFFFFFFFFF")).isEmpty();
    }

    @Test
    void testParseHexAcceptsAsciiDigitsOnly() {
        assertThat(CommandCode.parseHex("0x\uFF12\uFF15")).isEmpty();
        assertThat(CommandCode.parseHex("0x\u0662\u0665")).isEmpty();
        assertThat(CommandCode.parseHex("0x2\uFF21")).isEmpty();
    }

    @Test
    void testLeadingZerosAreAccepted() {
        assertThat(CommandCode.parseHex("0x0025")).contains(CommandCode.of(0x25));
    }

    @Test
    void testOfRejectsOutOfRange() {
        assertThatThrownBy(() -> CommandCode.of(256)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CommandCode.of(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testHexFormatting() {
        assertThat(CommandCode.of(0x0a).toHex()).isEqualTo("0a");
        assertThat(CommandCode.of(0x9f)).hasToString("0x9f");
    }
}
