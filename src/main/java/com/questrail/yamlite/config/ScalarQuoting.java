package com.questrail.yamlite.config;

/**
 * Selects how the encoder decides that a plain string must be double-quoted
 * because it would otherwise read back as a different scalar.
 *
 * <p>Both modes quote strings that are all digits, all digits and dots,
 * contain one of {@code : # [ ] { }}, start or end with whitespace, or
 * contain a line break. They differ only in the reserved-word test.</p>
 */
public enum ScalarQuoting {
    /**
     * Output-compatible with the earlier encoder, whose reserved-word test was
     * written as a character class: it quotes any one-character string drawn
     * from {@code t r u e | f a l s y o n} and leaves {@code true}, {@code no}
     * and the other words unquoted.
     */
    LEGACY,

    /**
     * Quotes every string the decoder would not read back as the same string:
     * {@code true false yes no on off null ~}, the empty string, numeric
     * literals, the empty containers {@code []} and {@code {}}, and text the
     * decoder would take as structure ({@code |}, {@code >}, {@code -} and
     * anything starting with {@code - }).
     */
    UNAMBIGUOUS
}
