package com.questrail.yamlite.codec.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * YamlLines
 * -----------------------------------------------------------------------------
 * Splits document text into lines and measures their indentation.
 *
 * <p>Indentation is the count of leading space characters only. Tabs are not
 * indentation: a tab-indented line has the indentation of the spaces before
 * its first tab.</p>
 *
 * <p>Empty lines are dropped here. Whitespace-only lines and comment lines are
 * kept because a block scalar body consumes raw lines verbatim; the decoder
 * skips them itself via {@link Line#isContent()}.</p>
 */
final class YamlLines
{
    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    private YamlLines() {}

    /**
     * One non-empty source line.
     *
     * @param number one-based line number in the original text
     * @param raw the line without its terminator
     * @param indent leading space count
     * @param content the line stripped of surrounding whitespace
     */
    record Line(int number, String raw, int indent, String content)
    {
        boolean isContent()
        {
            return !content.isEmpty() && !content.startsWith("#");
        }

        boolean isSequenceItem()
        {
            return content.startsWith("- ") || content.equals("-");
        }
    }

    static List<Line> split(String text)
    {
        String[] rawLines = LINE_BREAK.split(text, -1);
        List<Line> lines = new ArrayList<>(rawLines.length);

        for (int i = 0; i < rawLines.length; i++) {
            String raw = rawLines[i];
            if (raw.isEmpty()) {
                continue;
            }
            lines.add(new Line(i + 1, raw, indentOf(raw), raw.strip()));
        }
        return lines;
    }

    static int indentOf(String line)
    {
        int indent = 0;
        while (indent < line.length() && line.charAt(indent) == ' ') {
            indent++;
        }
        return indent;
    }

    /**
     * Removes {@code columns} leading characters, whatever they are.
     */
    static String dropColumns(String line, int columns)
    {
        return line.length() <= columns ? "" : line.substring(columns);
    }
}
