package com.zwave.generator.codegen.util;

import java.util.Locale;

/**
 * Utility for converting catalog names to target-language identifiers.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts SCREAMING_SNAKE_CASE (or any separator-delimited token) to UpperCamelCase.
     *
     * A letter or digit following a non-alphanumeric separator, or the first
     * alphanumeric character, is upper-cased; every other letter is lower-cased
     * and separators are dropped. Never fails: {@code null} and {@code ""} both
     * yield {@code ""}.
     */
    public static String toUpperCamelCase(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(name.length());
        boolean upperNext = true;
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            if (Character.isLetterOrDigit(ch)) {
                if (upperNext) {
                    sb.append(String.valueOf(ch).toUpperCase(Locale.ROOT));
                    upperNext = false;
                } else {
                    sb.append(String.valueOf(ch).toLowerCase(Locale.ROOT));
                }
            } else {
                upperNext = true;
            }
        }
        return sb.toString();
    }

    /**
     * Converts SCREAMING_SNAKE_CASE to lower_snake_case for file names.
     */
    public static String toLowerSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        return name.replaceAll("[^A-Za-z0-9]+", "_").toLowerCase(Locale.ROOT);
    }

    /**
     * True if the name can be used unchanged as a constant or property name in
     * every supported target language. Rejects a lone {@code _}.
     */
    public static boolean isValidIdentifier(String name) {
        // a lone underscore is a Java keyword
        if (name == null || name.isEmpty() || name.equals("_")) {
            return false;
        }
        char first = name.charAt(0);
        if (!isAsciiLetter(first) && first != '_') {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char ch = name.charAt(i);
            if (!isAsciiLetter(ch) && !(ch >= '0' && ch <= '9') && ch != '_') {
                return false;
            }
        }
        return true;
    }

    /**
     * True if the value is a dotted sequence of valid identifiers, e.g. {@code com.zwave.commandclass}.
     */
    public static boolean isValidPackageName(String packageName) {
        if (packageName == null || packageName.isBlank()) {
            return false;
        }
        for (String segment : packageName.split("\\.", -1)) {
            if (!isValidIdentifier(segment)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAsciiLetter(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
    }
}
