package com.questrail.yamlite.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of values ({@code - item} blocks, or {@code []} when empty).
 *
 * <p>
 * Element order is significant and preserved by both the decoder and the
 * encoder. Java {@code null} elements are stored as {@link YamlNull#INSTANCE}.
 * </p>
 */
public final class YamlSequence implements YamlValue, Iterable<YamlValue>
{
    private final List<YamlValue> items = new ArrayList<>();

    public YamlSequence() {}

    public static YamlSequence of(YamlValue... items)
    {
        YamlSequence sequence = new YamlSequence();
        Arrays.stream(items).forEach(sequence::add);
        return sequence;
    }

    public YamlSequence add(YamlValue item)
    {
        items.add(YamlValue.orNull(item));
        return this;
    }

    public YamlValue get(int index)
    {
        return items.get(index);
    }

    public YamlValue set(int index, YamlValue item)
    {
        return items.set(index, YamlValue.orNull(item));
    }

    public int size()
    {
        return items.size();
    }

    public boolean isEmpty()
    {
        return items.isEmpty();
    }

    /**
     * @return an unmodifiable view of the elements, in order
     */
    public List<YamlValue> items()
    {
        return Collections.unmodifiableList(items);
    }

    @Override
    public Iterator<YamlValue> iterator()
    {
        return items().iterator();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        return o instanceof YamlSequence other && items.equals(other.items);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(YamlSequence.class, items);
    }

    @Override
    public String toString()
    {
        return items.toString();
    }
}
