package com.questrail.yamlite.model;

/**
 * Boolean scalar.
 */
public record YamlBool(boolean value) implements YamlValue
{
    public static final YamlBool TRUE = new YamlBool(true);
    public static final YamlBool FALSE = new YamlBool(false);

    public static YamlBool of(boolean value)
    {
        return value ? TRUE : FALSE;
    }

    @Override
    public String toString()
    {
        return Boolean.toString(value);
    }
}
