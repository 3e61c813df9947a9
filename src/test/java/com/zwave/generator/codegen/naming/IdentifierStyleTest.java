package com.zwave.generator.codegen.naming;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for IdentifierStyle.
 */
class IdentifierStyleTest {

    @Test
    void testUpperCamelConvertsScreamingSnakeCase() {
        assertThat(IdentifierStyle.UPPER_CAMEL.normalize("SWITCH_BINARY")).isEqualTo("SwitchBinary");
    }

    @Test
    void testVerbatimKeepsToken() {
        assertThat(IdentifierStyle.VERBATIM.normalize("SWITCH_BINARY")).isEqualTo("SWITCH_BINARY");
    }

    @Test
    void testEmptyTokenUnderBothStyles() {
        assertThat(IdentifierStyle.UPPER_CAMEL.normalize("")).isEmpty();
        assertThat(IdentifierStyle.VERBATIM.normalize("")).isEmpty();
    }

    @Test
    void testUpperCamelWithoutSeparators() {
        assertThat(IdentifierStyle.UPPER_CAMEL.normalize("BASIC")).isEqualTo("Basic");
    }

    @Test
    void testUpperCamelCapitalizesDigitAfterSeparator() {
        // digit takes the capital slot, so the following letter stays lower-case
        assertThat(IdentifierStyle.UPPER_CAMEL.normalize("ZIP_6LOWPAN")).isEqualTo("Zip6lowpan");
    }

    @Test
    void testUpperCamelDropsRepeatedAndLeadingSeparators() {
        assertThat(IdentifierStyle.UPPER_CAMEL.normalize("__METER__TBL-PUSH ")).isEqualTo("MeterTblPush");
    }

    @Test
    void testUpperCamelOfSeparatorsOnlyIsEmpty() {
        assertThat(IdentifierStyle.UPPER_CAMEL.normalize("___")).isEmpty();
    }

    @Test
    void testNullIsTreatedAsEmpty() {
        assertThat(IdentifierStyle.UPPER_CAMEL.normalize(null)).isEmpty();
        assertThat(IdentifierStyle.VERBATIM.normalize(null)).isEmpty();
    }
}
