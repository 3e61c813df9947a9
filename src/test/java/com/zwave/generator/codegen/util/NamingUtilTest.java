package com.zwave.generator.codegen.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NamingUtil.
 */
class NamingUtilTest {

    @Test
    void testValidIdentifiers() {
        assertThat(NamingUtil.isValidIdentifier("SWITCH_BINARY")).isTrue();
        assertThat(NamingUtil.isValidIdentifier("SwitchBinary")).isTrue();
        assertThat(NamingUtil.isValidIdentifier("_RESERVED")).isTrue();
        assertThat(NamingUtil.isValidIdentifier("V2")).isTrue();
    }

    @Test
    void testInvalidIdentifiers() {
        assertThat(NamingUtil.isValidIdentifier("")).isFalse();
        assertThat(NamingUtil.isValidIdentifier(null)).isFalse();
        assertThat(NamingUtil.isValidIdentifier("6LOWPAN")).isFalse();
        assertThat(NamingUtil.isValidIdentifier("METER-TBL")).isFalse();
        assertThat(NamingUtil.isValidIdentifier("A B")).isFalse();
    }

    @Test
    void testLoneUnderscoreIsNotAnIdentifier() {
        assertThat(NamingUtil.isValidIdentifier("_")).isFalse();
        assertThat(NamingUtil.isValidIdentifier("__")).isTrue();
        assertThat(NamingUtil.isValidPackageName("com._.zwave")).isFalse();
    }

    @Test
    void testPackageNames() {
        assertThat(NamingUtil.isValidPackageName("com.zwave.commandclass")).isTrue();
        assertThat(NamingUtil.isValidPackageName("zwave")).isTrue();
        assertThat(NamingUtil.isValidPackageName("com..zwave")).isFalse();
        assertThat(NamingUtil.isValidPackageName("com.zwave.")).isFalse();
        assertThat(NamingUtil.isValidPackageName("com.1zwave")).isFalse();
        assertThat(NamingUtil.isValidPackageName(" ")).isFalse();
    }

    @Test
    void testLowerSnakeCase() {
        assertThat(NamingUtil.toLowerSnakeCase("SWITCH_BINARY")).isEqualTo("switch_binary");
        assertThat(NamingUtil.toLowerSnakeCase("METER-TBL PUSH")).isEqualTo("meter_tbl_push");
    }
}
