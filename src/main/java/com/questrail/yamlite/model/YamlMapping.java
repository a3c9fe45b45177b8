package com.questrail.yamlite.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Insertion-ordered mapping from string keys to values.
 *
 * <p>
 * Keys are unique. Putting an existing key replaces its value in place, so the
 * key keeps the position where it was first inserted. Decoding preserves the
 * order keys were read in; the encoder ignores it and sorts keys.
 * </p>
 *
 * <p>
 * Equality compares the mappings as sets of pairs: two mappings with the same
 * entries in a different order are equal.
 * </p>
 */
public final class YamlMapping implements YamlValue
{
    private final Map<String, YamlValue> entries = new LinkedHashMap<>();

    public YamlMapping() {}

    public YamlMapping put(String key, YamlValue value)
    {
        Objects.requireNonNull(key, "key");
        entries.put(key, YamlValue.orNull(value));
        return this;
    }

    public YamlMapping put(String key, String value)
    {
        return put(key, YamlString.of(value));
    }

    public YamlMapping put(String key, long value)
    {
        return put(key, YamlNumber.of(value));
    }

    public YamlMapping put(String key, boolean value)
    {
        return put(key, YamlBool.of(value));
    }

    /**
     * @return the value stored under {@code key}, or empty if the key is absent
     */
    public Optional<YamlValue> get(String key)
    {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key)
    {
        return entries.containsKey(key);
    }

    public Optional<YamlValue> remove(String key)
    {
        return Optional.ofNullable(entries.remove(key));
    }

    public Set<String> keys()
    {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /**
     * @return an unmodifiable, insertion-ordered view of the entries
     */
    public Map<String, YamlValue> entries()
    {
        return Collections.unmodifiableMap(entries);
    }

    public int size()
    {
        return entries.size();
    }

    public boolean isEmpty()
    {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        return o instanceof YamlMapping other && entries.equals(other.entries);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(YamlMapping.class, entries);
    }

    @Override
    public String toString()
    {
        return entries.toString();
    }
}
