package com.questrail.yamlite.observability;

import com.questrail.yamlite.io.YamlError;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Record representing a failed document operation.
 */
public record YamlErrorEvent(
    Instant timestamp,
    Path path,
    YamlError error
) {
}
