package com.questrail.yamlite.model;

/**
 * The null scalar ({@code null}, {@code ~} or an empty value).
 */
public record YamlNull() implements YamlValue
{
    public static final YamlNull INSTANCE = new YamlNull();

    @Override
    public String toString()
    {
        return "null";
    }
}
