package com.questrail.yamlite.model;

import java.util.Objects;

/**
 * Text scalar.
 */
public record YamlString(String value) implements YamlValue
{
    public YamlString {
        Objects.requireNonNull(value, "value");
    }

    public static YamlString of(String value)
    {
        return new YamlString(value);
    }

    @Override
    public String toString()
    {
        return value;
    }
}
