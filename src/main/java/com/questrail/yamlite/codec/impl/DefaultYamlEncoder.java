package com.questrail.yamlite.codec.impl;

import com.questrail.yamlite.codec.YamlEncoder;
import com.questrail.yamlite.config.YamlEncoderConfig;
import com.questrail.yamlite.model.YamlBool;
import com.questrail.yamlite.model.YamlMapping;
import com.questrail.yamlite.model.YamlNull;
import com.questrail.yamlite.model.YamlNumber;
import com.questrail.yamlite.model.YamlSequence;
import com.questrail.yamlite.model.YamlString;
import com.questrail.yamlite.model.YamlValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * DefaultYamlEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link YamlEncoder}.
 *
 * <p>Rendering is recursive by value shape. A non-empty container renders as a
 * run of lines, each preceded by a newline, at the depth it was given; the
 * caller decides whether that run follows {@code key:} or a lone {@code -}.
 * Scalars render inline.</p>
 *
 * <ul>
 *   <li>Null, booleans and numbers use their plain text form</li>
 *   <li>A string with a newline, no carriage return and none of {@code : # [ ] { }} becomes a
 *       {@code |} block whose lines sit at the value's own depth; blank lines
 *       are not written</li>
 *   <li>Other strings, and mapping keys, are double-quoted only when
 *       {@link YamlQuoting#needsQuotes} says so</li>
 *   <li>Empty sequences and mappings are {@code []} and {@code {}}</li>
 *   <li>Mapping keys are sorted ascending</li>
 * </ul>
 */
public final class DefaultYamlEncoder implements YamlEncoder
{
    private final YamlEncoderConfig config;

    public DefaultYamlEncoder()
    {
        this(YamlEncoderConfig.defaults());
    }

    public DefaultYamlEncoder(YamlEncoderConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    public YamlEncoderConfig config()
    {
        return config;
    }

    @Override
    public String encode(YamlValue value)
    {
        YamlValue root = YamlValue.orNull(value);
        String text = render(root, 0);

        // Containers render with a leading newline; the document starts without one.
        if (root.isContainer() && text.startsWith("\n")) {
            return text.substring(1);
        }
        return text;
    }

    private String render(YamlValue value, int depth)
    {
        if (value instanceof YamlNull) {
            return "null";
        }
        if (value instanceof YamlBool bool) {
            return Boolean.toString(bool.value());
        }
        if (value instanceof YamlNumber number) {
            return number.value().toString();
        }
        if (value instanceof YamlString string) {
            return renderString(string.value(), depth);
        }
        if (value instanceof YamlSequence sequence) {
            return renderSequence(sequence, depth);
        }
        return renderMapping((YamlMapping) value, depth);
    }

    private String renderString(String value, int depth)
    {
        if (value.indexOf('\n') >= 0 && value.indexOf('\r') < 0 && !YamlQuoting.containsSpecial(value)) {
            StringBuilder block = new StringBuilder("|");
            String pad = pad(depth);
            for (String line : value.split("\n")) {
                if (!line.isEmpty()) {
                    block.append('\n').append(pad).append(line);
                }
            }
            return block.toString();
        }
        return YamlQuoting.quoteIfNeeded(value, config.scalarQuoting());
    }

    private String renderSequence(YamlSequence sequence, int depth)
    {
        if (sequence.isEmpty()) {
            return "[]";
        }

        String pad = pad(depth);
        StringBuilder out = new StringBuilder();
        for (YamlValue item : sequence) {
            String rendered = render(item, depth + config.indentWidth());
            out.append('\n').append(pad);
            if (startsBlockRun(item, rendered)) {
                out.append('-').append(rendered);
            }
            else {
                out.append("- ").append(rendered);
            }
        }
        return out.toString();
    }

    private String renderMapping(YamlMapping mapping, int depth)
    {
        if (mapping.isEmpty()) {
            return "{}";
        }

        List<String> keys = new ArrayList<>(mapping.keys());
        Collections.sort(keys);

        String pad = pad(depth);
        StringBuilder out = new StringBuilder();
        for (String key : keys) {
            YamlValue value = mapping.get(key).orElse(YamlNull.INSTANCE);
            String rendered = render(value, depth + config.indentWidth());
            out.append('\n').append(pad).append(YamlQuoting.quoteIfNeeded(key, config.scalarQuoting()));
            if (startsBlockRun(value, rendered)) {
                out.append(':').append(rendered);
            }
            else {
                out.append(": ").append(rendered);
            }
        }
        return out.toString();
    }

    private static boolean startsBlockRun(YamlValue value, String rendered)
    {
        return value.isContainer() && rendered.startsWith("\n");
    }

    private static String pad(int depth)
    {
        return " ".repeat(depth);
    }
}
