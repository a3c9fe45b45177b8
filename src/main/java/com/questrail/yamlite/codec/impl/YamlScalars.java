package com.questrail.yamlite.codec.impl;

import com.questrail.yamlite.model.YamlBool;
import com.questrail.yamlite.model.YamlMapping;
import com.questrail.yamlite.model.YamlNull;
import com.questrail.yamlite.model.YamlNumber;
import com.questrail.yamlite.model.YamlSequence;
import com.questrail.yamlite.model.YamlString;
import com.questrail.yamlite.model.YamlValue;

import java.math.BigInteger;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * YamlScalars
 * -----------------------------------------------------------------------------
 * Scalar literal grammar shared by the decoder and the encoder's quoting test.
 *
 * <p>Resolution order for a stripped literal:</p>
 * <ol>
 *   <li>{@code null}, {@code ~} or empty: null</li>
 *   <li>{@code true yes on} / {@code false no off}: booleans (case-sensitive)</li>
 *   <li>{@code []} / {@code {}}: empty sequence / mapping</li>
 *   <li>integer, hexadecimal or decimal literal: number</li>
 *   <li>text wrapped in matching {@code "} or {@code '}: the inner text, verbatim</li>
 *   <li>anything else: the text itself</li>
 * </ol>
 *
 * <p>Because quotes are only stripped after the keyword and number tests fail,
 * {@code "true"} and {@code "42"} decode as strings.</p>
 */
final class YamlScalars
{
    private static final Pattern INTEGER = Pattern.compile("[-+]?[0-9]+");
    private static final Pattern HEX = Pattern.compile("([-+]?)0[xX]([0-9a-fA-F]+)");
    private static final Pattern DECIMAL =
            Pattern.compile("[-+]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][-+]?[0-9]+)?");

    private static final Set<String> NULL_WORDS = Set.of("null", "~");
    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "on");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "off");

    private YamlScalars() {}

    static YamlValue parse(String literal)
    {
        String value = literal.strip();

        if (value.isEmpty() || NULL_WORDS.contains(value)) {
            return YamlNull.INSTANCE;
        }
        if (TRUE_WORDS.contains(value)) {
            return YamlBool.TRUE;
        }
        if (FALSE_WORDS.contains(value)) {
            return YamlBool.FALSE;
        }
        if (value.equals("[]")) {
            return new YamlSequence();
        }
        if (value.equals("{}")) {
            return new YamlMapping();
        }

        Number number = parseNumber(value);
        if (number != null) {
            return new YamlNumber(number);
        }

        return YamlString.of(unquote(value));
    }

    /**
     * @return true for the words the grammar reads as null or boolean
     */
    static boolean isReservedWord(String value)
    {
        return NULL_WORDS.contains(value) || TRUE_WORDS.contains(value) || FALSE_WORDS.contains(value);
    }

    static boolean isNumber(String value)
    {
        return parseNumber(value) != null;
    }

    static boolean isQuoted(String value)
    {
        if (value.length() < 2) {
            return false;
        }
        char first = value.charAt(0);
        return (first == '"' || first == '\'') && value.charAt(value.length() - 1) == first;
    }

    /**
     * Strips one pair of matching outer quotes. Escape sequences are left as they are.
     */
    static String unquote(String value)
    {
        return isQuoted(value) ? value.substring(1, value.length() - 1) : value;
    }

    private static Number parseNumber(String value)
    {
        if (INTEGER.matcher(value).matches()) {
            try {
                return Long.parseLong(value);
            }
            catch (NumberFormatException overflow) {
                return new BigInteger(value);
            }
        }

        var hex = HEX.matcher(value);
        if (hex.matches()) {
            BigInteger magnitude = new BigInteger(hex.group(2), 16);
            BigInteger signed = hex.group(1).equals("-") ? magnitude.negate() : magnitude;
            return signed.bitLength() < Long.SIZE ? (Number) signed.longValue() : signed;
        }

        if (DECIMAL.matcher(value).matches()) {
            return Double.parseDouble(value);
        }
        return null;
    }
}
