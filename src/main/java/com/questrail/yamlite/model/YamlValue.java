package com.questrail.yamlite.model;

/**
 * Canonical in-memory representation of a decoded YAML node.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code YamlValue} is the one data model shared by the decoder, the encoder
 * and the path accessor. Every node carries its variant as its Java type, so a
 * {@link YamlSequence} and a {@link YamlMapping} stay distinguishable even when
 * they are empty.
 * </p>
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link YamlNull} - the null scalar</li>
 *   <li>{@link YamlBool} - booleans</li>
 *   <li>{@link YamlNumber} - integral and floating point numbers</li>
 *   <li>{@link YamlString} - text</li>
 *   <li>{@link YamlSequence} - ordered list of values</li>
 *   <li>{@link YamlMapping} - insertion-ordered map with unique string keys</li>
 * </ul>
 *
 * <p>
 * Scalars are immutable records. Containers are mutable: the decoder populates
 * them as nesting is discovered and the path accessor vivifies mappings in place.
 * </p>
 */
public sealed interface YamlValue
        permits YamlNull, YamlBool, YamlNumber, YamlString, YamlSequence, YamlMapping {

    /**
     * @return true for {@link YamlSequence} and {@link YamlMapping}
     */
    default boolean isContainer()
    {
        return this instanceof YamlSequence || this instanceof YamlMapping;
    }

    /**
     * Maps a Java {@code null} to {@link YamlNull#INSTANCE}.
     */
    static YamlValue orNull(YamlValue value)
    {
        return value == null ? YamlNull.INSTANCE : value;
    }
}
