package com.questrail.yamlite.codec;

import com.questrail.yamlite.model.YamlMapping;
import com.questrail.yamlite.model.YamlValue;

/**
 * YamlDecoder
 * -----------------------------------------------------------------------------
 * Text-level decoder for the indentation-based YAML subset.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Splitting text into lines and measuring indentation</li>
 *   <li>Attaching each line to the container active at its indentation</li>
 *   <li>Interpreting scalar literals</li>
 * </ul>
 *
 * <p>The decoder is <strong>lenient</strong>. There is no syntax error: a line
 * that cannot be attached to the tree is ignored and decoding continues, so
 * malformed input degrades to a partial or empty tree.</p>
 */
public interface YamlDecoder
{
    /**
     * Decode a complete document.
     *
     * @param text document text; lines end in {@code \n} or {@code \r\n}
     * @return the root container; an empty {@link YamlMapping} for empty or
     *         {@code null} text
     */
    YamlValue decode(String text);
}
