package com.questrail.yamlite.codec.impl;

import com.questrail.yamlite.config.ScalarQuoting;

import java.util.regex.Pattern;

/**
 * YamlQuoting
 * -----------------------------------------------------------------------------
 * Decides whether a string (value or key) must be double-quoted on output, and
 * applies the escaping.
 *
 * <p>Escaping covers backslash, double quote, newline, carriage return and tab.
 * The decoder does not reverse it; quoting exists to keep the string from being
 * read as another scalar type or as structure, not to make it byte-exact.</p>
 */
final class YamlQuoting
{
    /** Characters that are structure in block context. */
    static final String SPECIAL_CHARACTERS = ":#[]{}";

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");
    private static final Pattern DIGITS_AND_DOTS = Pattern.compile("[0-9.]+");

    /** The character class the earlier encoder used for its reserved-word test. */
    private static final String LEGACY_RESERVED_CLASS = "true|falsyon";

    private YamlQuoting() {}

    static boolean containsSpecial(String s)
    {
        for (int i = 0; i < s.length(); i++) {
            if (SPECIAL_CHARACTERS.indexOf(s.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    static boolean needsQuotes(String s, ScalarQuoting mode)
    {
        if (DIGITS.matcher(s).matches() || DIGITS_AND_DOTS.matcher(s).matches()) {
            return true;
        }
        if (containsSpecial(s) || s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0) {
            return true;
        }
        if (!s.isEmpty()
                && (Character.isWhitespace(s.charAt(0)) || Character.isWhitespace(s.charAt(s.length() - 1)))) {
            return true;
        }

        if (mode == ScalarQuoting.LEGACY) {
            return s.length() == 1 && LEGACY_RESERVED_CLASS.indexOf(s.charAt(0)) >= 0;
        }
        return s.isEmpty()
                || YamlScalars.isReservedWord(s)
                || YamlScalars.isNumber(s)
                || YamlScalars.isQuoted(s)
                || s.equals("|")
                || s.equals(">")
                || s.equals("-")
                || s.startsWith("- ");
    }

    static String quote(String s)
    {
        StringBuilder out = new StringBuilder(s.length() + 2);
        out.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }

    static String quoteIfNeeded(String s, ScalarQuoting mode)
    {
        return needsQuotes(s, mode) ? quote(s) : s;
    }
}
