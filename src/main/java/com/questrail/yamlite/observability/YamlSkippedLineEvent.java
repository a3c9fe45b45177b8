package com.questrail.yamlite.observability;

/**
 * Record describing a line the lenient decoder ignored.
 *
 * @param lineNumber one-based line number within the decoded text
 * @param line the raw line
 * @param reason short description of why the line was ignored
 */
public record YamlSkippedLineEvent(
    int lineNumber,
    String line,
    String reason
) {
}
