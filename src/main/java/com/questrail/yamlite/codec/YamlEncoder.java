package com.questrail.yamlite.codec;

import com.questrail.yamlite.model.YamlValue;

/**
 * YamlEncoder
 * -----------------------------------------------------------------------------
 * Text-level encoder for the indentation-based YAML subset.
 *
 * <p>Output is deterministic: mapping keys are always emitted in ascending
 * order, whatever order they were inserted or decoded in.</p>
 */
public interface YamlEncoder
{
    /**
     * Encode a value tree. Never fails for a well-formed tree.
     *
     * <p>A scalar encodes to its scalar text. A container encodes to block
     * lines without a leading or trailing newline.</p>
     */
    String encode(YamlValue value);
}
