package com.zwave.generator.codegen.model.catalog;

import java.util.Locale;
import java.util.Optional;

import lombok.Value;

/**
 * 8-bit unsigned protocol identifier (0x00-0xFF).
 *
 * Command classes share one code namespace; command codes are scoped to
 * their owning command class.
 */
@Value
public class CommandCode {

    public static final int MAX_VALUE = 0xFF;

    private static final String HEX_PREFIX = "0x";

    int value;

    private CommandCode(int value) {
        this.value = value;
    }

    public static CommandCode of(int value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("Command code out of range 0x00-0xFF: " + value);
        }
        return new CommandCode(value);
    }

    /**
     * Parses a {@code 0x}-prefixed hex attribute such as {@code 0x25}.
     *
     * @return empty if the value is missing, lacks the prefix (case-insensitive),
     *         has a non-hex payload, or does not fit in 8 bits
     */
    public static Optional<CommandCode> parseHex(String raw) {
        if (raw == null || raw.length() <= HEX_PREFIX.length()) {
            return Optional.empty();
        }
        if (!raw.substring(0, HEX_PREFIX.length()).toLowerCase(Locale.ROOT).equals(HEX_PREFIX)) {
            return Optional.empty();
        }
        String payload = raw.substring(HEX_PREFIX.length());
        int value = 0;
        for (int i = 0; i < payload.length(); i++) {
            int digit = hexDigit(payload.charAt(i));
            if (digit < 0) {
                return Optional.empty();
            }
            value = value * 16 + digit;
            if (value > MAX_VALUE) {
                return Optional.empty();
            }
        }
        return Optional.of(new CommandCode(value));
    }

    /** ASCII only; -1 for anything else. */
    private static int hexDigit(char ch) {
        if (ch >= '0' && ch <= '9') return ch - '0';
        if (ch >= 'a' && ch <= 'f') return ch - 'a' + 10;
        if (ch >= 'A' && ch <= 'F') return ch - 'A' + 10;
        return -1;
    }

    /** Two lower-case hex digits, without prefix. */
    public String toHex() {
        return String.format("%02x", value);
    }

    @Override
    public String toString() {
        return HEX_PREFIX + toHex();
    }
}
