package com.questrail.yamlite.io;

import java.util.Objects;

/**
 * Human-readable description of a failed document operation.
 *
 * @param kind failure category
 * @param message message suitable for display
 * @param cause underlying exception, or {@code null} when there is none
 */
public record YamlError(
    YamlErrorKind kind,
    String message,
    Throwable cause
) {
    public YamlError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static YamlError io(String message, Throwable cause) {
        return new YamlError(YamlErrorKind.IO, message, cause);
    }

    public static YamlError mutator(String message) {
        return new YamlError(YamlErrorKind.MUTATOR, message, null);
    }
}
