package com.zwave.generator.codegen.naming;

import com.zwave.generator.codegen.util.NamingUtil;

/**
 * Casing policy applied to command class and command names.
 */
public enum IdentifierStyle {

    /** Keeps the source token as-is, e.g. {@code SWITCH_BINARY}. */
    VERBATIM {
        @Override
        public String normalize(String token) {
            return token == null ? "" : token;
        }
    },

    /** Converts the source token to UpperCamelCase, e.g. {@code SwitchBinary}. */
    UPPER_CAMEL {
        @Override
        public String normalize(String token) {
            return NamingUtil.toUpperCamelCase(token);
        }
    };

    /**
     * Normalizes a source token. Total over any input; the result may still be
     * rejected by {@link NamingUtil#isValidIdentifier(String)}.
     */
    public abstract String normalize(String token);
}
