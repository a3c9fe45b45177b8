package com.questrail.yamlite.path;

import com.questrail.yamlite.model.YamlMapping;
import com.questrail.yamlite.model.YamlValue;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Dot-separated key path access over a decoded tree.
 *
 * <p>A path such as {@code database.host} names a chain of mapping keys.
 * Empty segments are ignored, so {@code a..b} is the same path as {@code a.b}.
 * Keys that themselves contain a dot cannot be addressed.</p>
 */
public final class YamlPaths
{
    private YamlPaths() {}

    /**
     * Walks the mapping chain named by {@code path}.
     *
     * @return the value at the path; empty if a key is missing or an
     *         intermediate value is not a mapping. An empty path returns
     *         {@code tree} itself.
     */
    public static Optional<YamlValue> get(YamlValue tree, String path)
    {
        Objects.requireNonNull(path, "path");

        YamlValue current = tree;
        for (String key : segments(path)) {
            if (!(current instanceof YamlMapping mapping)) {
                return Optional.empty();
            }
            Optional<YamlValue> next = mapping.get(key);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.ofNullable(current);
    }

    /**
     * Stores {@code value} at {@code path}, creating missing intermediate
     * mappings. An intermediate value that is not a mapping, a sequence
     * included, is replaced by a new empty mapping.
     *
     * @return {@code tree}, mutated in place
     * @throws IllegalArgumentException if {@code tree} is not a mapping or the
     *                                  path has no segments
     */
    public static YamlValue set(YamlValue tree, String path, YamlValue value)
    {
        YamlMapping parent = vivifyParent(tree, path);
        List<String> keys = segments(path);
        parent.put(keys.get(keys.size() - 1), value);
        return tree;
    }

    /**
     * Removes the key at {@code path}. Nothing is created along the way.
     *
     * @return the removed value, or empty if the path did not resolve
     */
    public static Optional<YamlValue> remove(YamlValue tree, String path)
    {
        List<String> keys = segments(path);
        if (keys.isEmpty()) {
            return Optional.empty();
        }

        String parentPath = String.join(".", keys.subList(0, keys.size() - 1));
        return get(tree, parentPath)
                .filter(YamlMapping.class::isInstance)
                .map(YamlMapping.class::cast)
                .flatMap(parent -> parent.remove(keys.get(keys.size() - 1)));
    }

    static List<String> segments(String path)
    {
        Objects.requireNonNull(path, "path");
        return Arrays.stream(path.split("\\."))
                .filter(segment -> !segment.isEmpty())
                .collect(Collectors.toList());
    }

    private static YamlMapping vivifyParent(YamlValue tree, String path)
    {
        if (!(tree instanceof YamlMapping root)) {
            throw new IllegalArgumentException("Path root must be a mapping, was " + describe(tree));
        }
        List<String> keys = segments(path);
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("Path has no keys: '" + path + "'");
        }

        YamlMapping current = root;
        for (String key : keys.subList(0, keys.size() - 1)) {
            Optional<YamlValue> existing = current.get(key);
            if (existing.isPresent() && existing.get() instanceof YamlMapping nested) {
                current = nested;
            }
            else {
                YamlMapping created = new YamlMapping();
                current.put(key, created);
                current = created;
            }
        }
        return current;
    }

    private static String describe(YamlValue value)
    {
        return value == null ? "null reference" : value.getClass().getSimpleName();
    }
}
