package com.questrail.yamlite.config;

import java.util.Objects;

/**
 * Encoder configuration.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>indentWidth</b> - spaces per nesting level, applied at every level.
 *       The decoder strips exactly two columns from block scalar bodies, so
 *       widths other than 2 only round-trip for documents without multi-line
 *       strings.</li>
 *   <li><b>scalarQuoting</b> - reserved-word quoting behavior, see
 *       {@link ScalarQuoting}.</li>
 * </ul>
 */
public record YamlEncoderConfig(
    int indentWidth,
    ScalarQuoting scalarQuoting
) {
    public static final int DEFAULT_INDENT_WIDTH = 2;

    public YamlEncoderConfig {
        Objects.requireNonNull(scalarQuoting, "scalarQuoting");
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be positive");
        }
    }

    public static YamlEncoderConfig defaults() {
        return new YamlEncoderConfig(DEFAULT_INDENT_WIDTH, ScalarQuoting.UNAMBIGUOUS);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .withIndentWidth(indentWidth)
            .withScalarQuoting(scalarQuoting);
    }

    public static final class Builder {
        private int indentWidth = DEFAULT_INDENT_WIDTH;
        private ScalarQuoting scalarQuoting = ScalarQuoting.UNAMBIGUOUS;

        public Builder withIndentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder withScalarQuoting(ScalarQuoting scalarQuoting) {
            this.scalarQuoting = scalarQuoting;
            return this;
        }

        public YamlEncoderConfig build() {
            return new YamlEncoderConfig(indentWidth, scalarQuoting);
        }
    }
}
