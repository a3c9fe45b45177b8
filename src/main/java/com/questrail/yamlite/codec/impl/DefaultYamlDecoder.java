package com.questrail.yamlite.codec.impl;

import com.questrail.yamlite.codec.YamlDecoder;
import com.questrail.yamlite.model.YamlMapping;
import com.questrail.yamlite.model.YamlNull;
import com.questrail.yamlite.model.YamlSequence;
import com.questrail.yamlite.model.YamlString;
import com.questrail.yamlite.model.YamlValue;
import com.questrail.yamlite.observability.NullObservabilitySink;
import com.questrail.yamlite.observability.YamlObservabilitySink;
import com.questrail.yamlite.observability.YamlSkippedLineEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * DefaultYamlDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link YamlDecoder}.
 *
 * <p>The decoder walks the document once, keeping a stack of
 * {@code (container, indent)} frames. The bottom frame is the root at indent
 * -1; its variant is decided by the first content line. For each line:</p>
 * <ol>
 *   <li>Pop frames whose indent is greater than or equal to the line's indent;
 *       the top frame is the active container</li>
 *   <li>{@code - value}: append to the active sequence. If the value contains
 *       {@code :}, append a new mapping instead, parse the entry into it and
 *       push it so deeper lines add further keys. {@code - |} takes a literal
 *       block as the item</li>
 *   <li>A lone {@code -}: append a nested container chosen by lookahead</li>
 *   <li>{@code key: value}: put into the active mapping. {@code |} or {@code >}
 *       consumes the deeper lines as a literal block; an empty value looks at
 *       the next content line to create a nested sequence, a nested mapping,
 *       or an explicit null</li>
 * </ol>
 *
 * <p>A document whose first content line is {@code []} or {@code {}} at the
 * root is an empty sequence or mapping.</p>
 *
 * <p>Lines that fit none of these, or that would put an entry into the wrong
 * container variant, are reported to the {@link YamlObservabilitySink} and
 * otherwise ignored.</p>
 */
public final class DefaultYamlDecoder implements YamlDecoder
{
    private final YamlObservabilitySink sink;

    public DefaultYamlDecoder()
    {
        this(NullObservabilitySink.INSTANCE);
    }

    public DefaultYamlDecoder(YamlObservabilitySink sink)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public YamlValue decode(String text)
    {
        if (text == null || text.isEmpty()) {
            return new YamlMapping();
        }
        return new DecodePass(YamlLines.split(text)).run();
    }

    /**
     * A container and the indentation at which it was opened.
     * The root frame starts with no container until its variant is known.
     */
    private static final class Frame
    {
        private YamlValue container;
        private final int indent;

        Frame(YamlValue container, int indent)
        {
            this.container = container;
            this.indent = indent;
        }

        YamlSequence asSequence()
        {
            if (container == null) {
                container = new YamlSequence();
            }
            return container instanceof YamlSequence sequence ? sequence : null;
        }

        YamlMapping asMapping()
        {
            if (container == null) {
                container = new YamlMapping();
            }
            return container instanceof YamlMapping mapping ? mapping : null;
        }
    }

    private final class DecodePass
    {
        private final List<YamlLines.Line> lines;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final Frame root = new Frame(null, -1);

        DecodePass(List<YamlLines.Line> lines)
        {
            this.lines = lines;
        }

        YamlValue run()
        {
            stack.push(root);

            int i = 0;
            while (i < lines.size()) {
                YamlLines.Line line = lines.get(i);
                if (!line.isContent()) {
                    i++;
                    continue;
                }

                while (stack.size() > 1 && line.indent() <= stack.peek().indent) {
                    stack.pop();
                }
                Frame active = stack.peek();

                if (line.isSequenceItem()) {
                    i = sequenceItem(i, line, active);
                }
                else if (line.content().indexOf(':') >= 0) {
                    i = mappingEntry(i, line, active);
                }
                else if (active == root && root.container == null && isEmptyContainer(line.content())) {
                    root.container = YamlScalars.parse(line.content());
                    i++;
                }
                else {
                    skip(line, "neither a sequence item nor a key");
                    i++;
                }
            }

            return root.container == null ? new YamlMapping() : root.container;
        }

        private int sequenceItem(int i, YamlLines.Line line, Frame active)
        {
            YamlSequence sequence = active.asSequence();
            if (sequence == null) {
                skip(line, "sequence item inside a mapping");
                return i + 1;
            }

            if (line.content().equals("-")) {
                YamlValue nested = containerAfter(i, line.indent());
                sequence.add(nested);
                if (nested.isContainer()) {
                    stack.push(new Frame(nested, line.indent()));
                }
                return i + 1;
            }

            String rest = line.content().substring(2);
            if (isBlockIndicator(rest.strip())) {
                StringBuilder text = new StringBuilder();
                int next = blockBody(i, line.indent(), text);
                sequence.add(YamlString.of(text.toString()));
                return next;
            }
            if (rest.indexOf(':') < 0) {
                sequence.add(YamlScalars.parse(rest));
                return i + 1;
            }

            YamlMapping item = new YamlMapping();
            sequence.add(item);
            stack.push(new Frame(item, line.indent()));

            String entry = rest.stripLeading();
            int keyColumn = line.indent() + line.content().length() - entry.length();
            return entry(i, line, item, entry, keyColumn);
        }

        private int mappingEntry(int i, YamlLines.Line line, Frame active)
        {
            YamlMapping mapping = active.asMapping();
            if (mapping == null) {
                skip(line, "key inside a sequence");
                return i + 1;
            }
            return entry(i, line, mapping, line.content(), line.indent());
        }

        /**
         * Parses {@code key: value} into {@code mapping}.
         *
         * @param keyColumn column of the key's first character; block bodies and
         *                  nested containers are measured against it
         * @return index of the next line to process
         */
        private int entry(int i, YamlLines.Line line, YamlMapping mapping, String text, int keyColumn)
        {
            int colon = text.indexOf(':');
            String key = text.substring(0, colon).strip();
            if (key.isEmpty()) {
                skip(line, "empty key");
                return i + 1;
            }
            key = YamlScalars.unquote(key);

            String raw = text.substring(colon + 1).strip();

            if (isBlockIndicator(raw)) {
                StringBuilder body = new StringBuilder();
                int next = blockBody(i, keyColumn, body);
                mapping.put(key, YamlString.of(body.toString()));
                return next;
            }

            if (raw.isEmpty()) {
                YamlValue nested = containerAfter(i, keyColumn);
                mapping.put(key, nested);
                if (nested.isContainer()) {
                    stack.push(new Frame(nested, keyColumn));
                }
                return i + 1;
            }

            mapping.put(key, YamlScalars.parse(raw));
            return i + 1;
        }

        /**
         * Collects the raw lines after {@code i} that are indented past
         * {@code column}, each with {@code column + 2} leading characters removed,
         * joined by newlines. {@code |} and {@code >} are treated alike: no
         * folding, no chomping.
         *
         * @return index of the first line after the body
         */
        private int blockBody(int i, int column, StringBuilder body)
        {
            List<String> parts = new ArrayList<>();
            int next = i + 1;
            while (next < lines.size() && lines.get(next).indent() > column) {
                parts.add(YamlLines.dropColumns(lines.get(next).raw(), column + 2));
                next++;
            }
            body.append(String.join("\n", parts));
            return next;
        }

        /**
         * Looks at the next content line after {@code i}. If it is indented past
         * {@code column}, its shape picks an empty sequence or mapping; otherwise
         * the value is null.
         */
        private YamlValue containerAfter(int i, int column)
        {
            for (int next = i + 1; next < lines.size(); next++) {
                YamlLines.Line candidate = lines.get(next);
                if (!candidate.isContent()) {
                    continue;
                }
                if (candidate.indent() <= column) {
                    return YamlNull.INSTANCE;
                }
                return candidate.isSequenceItem() ? new YamlSequence() : new YamlMapping();
            }
            return YamlNull.INSTANCE;
        }

        private boolean isEmptyContainer(String content)
        {
            return content.equals("[]") || content.equals("{}");
        }

                private boolean isBlockIndicator(String raw)
        {
            return raw.equals("|") || raw.equals(">");
        }

        private void skip(YamlLines.Line line, String reason)
        {
            sink.onLineSkipped(new YamlSkippedLineEvent(line.number(), line.raw(), reason));
        }
    }
}
