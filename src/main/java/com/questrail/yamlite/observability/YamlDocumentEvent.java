package com.questrail.yamlite.observability;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Record representing a successful document read or write.
 */
public record YamlDocumentEvent(
    Instant timestamp,
    Kind kind,
    Path path,
    int characters
) {
    public enum Kind {
        READ,
        WRITTEN
    }
}
