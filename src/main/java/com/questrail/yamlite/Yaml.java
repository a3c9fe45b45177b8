package com.questrail.yamlite;

import com.questrail.yamlite.codec.YamlDecoder;
import com.questrail.yamlite.codec.YamlEncoder;
import com.questrail.yamlite.codec.impl.DefaultYamlDecoder;
import com.questrail.yamlite.codec.impl.DefaultYamlEncoder;
import com.questrail.yamlite.config.YamlEncoderConfig;
import com.questrail.yamlite.io.YamlFiles;
import com.questrail.yamlite.io.YamlResult;
import com.questrail.yamlite.model.YamlValue;
import com.questrail.yamlite.observability.Slf4jYamlObservabilitySink;
import com.questrail.yamlite.observability.YamlObservabilitySink;
import com.questrail.yamlite.path.YamlPaths;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Yaml
 * =============================================================================
 * Composition root for the codec, the path accessor and document files.
 *
 * <p>An instance owns one immutable {@link YamlEncoderConfig} and one
 * {@link YamlObservabilitySink}. Instances hold no other state, so a single
 * instance can be shared; the value trees it returns are not thread-safe.</p>
 *
 * <pre>
 *   Yaml yaml = Yaml.builder().withIndentWidth(4).build();
 *   yaml.modify(path, tree -> yaml.set(tree, "database.port", YamlNumber.of(5432)));
 * </pre>
 */
public final class Yaml {
    private final YamlEncoderConfig encoderConfig;
    private final YamlObservabilitySink sink;
    private final YamlDecoder decoder;
    private final YamlEncoder encoder;
    private final YamlFiles files;

    private Yaml(YamlEncoderConfig encoderConfig, YamlObservabilitySink sink) {
        this.encoderConfig = Objects.requireNonNull(encoderConfig, "encoderConfig");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.decoder = new DefaultYamlDecoder(sink);
        this.encoder = new DefaultYamlEncoder(encoderConfig);
        this.files = new YamlFiles(decoder, encoder, sink);
    }

    public static Yaml defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public YamlEncoderConfig encoderConfig() {
        return encoderConfig;
    }

    /**
     * Decodes {@code text}. Always succeeds; empty text yields an empty mapping.
     */
    public YamlResult<YamlValue> parse(String text) {
        return YamlResult.success(decoder.decode(text));
    }

    public YamlResult<YamlValue> read(Path path) {
        return files.read(path);
    }

    public String encode(YamlValue value) {
        return encoder.encode(value);
    }

    /**
     * Encodes with {@code config} instead of this instance's configuration.
     */
    public String encode(YamlValue value, YamlEncoderConfig config) {
        return new DefaultYamlEncoder(config).encode(value);
    }

    public YamlResult<Path> write(Path path, YamlValue value) {
        return files.write(path, value);
    }

    public YamlResult<Path> write(Path path, YamlValue value, YamlEncoderConfig config) {
        return new YamlFiles(decoder, new DefaultYamlEncoder(config), sink).write(path, value);
    }

    public YamlResult<YamlValue> modify(Path path, Function<? super YamlValue, ? extends YamlValue> mutator) {
        return files.modify(path, mutator);
    }

    public Optional<YamlValue> get(YamlValue tree, String path) {
        return YamlPaths.get(tree, path);
    }

    public YamlValue set(YamlValue tree, String path, YamlValue value) {
        return YamlPaths.set(tree, path, value);
    }

    public Optional<YamlValue> remove(YamlValue tree, String path) {
        return YamlPaths.remove(tree, path);
    }

    public static final class Builder {
        private YamlEncoderConfig encoderConfig = YamlEncoderConfig.defaults();
        private YamlObservabilitySink sink = new Slf4jYamlObservabilitySink();

        public Builder withEncoderConfig(YamlEncoderConfig encoderConfig) {
            this.encoderConfig = encoderConfig;
            return this;
        }

        public Builder withIndentWidth(int indentWidth) {
            this.encoderConfig = encoderConfig.toBuilder().withIndentWidth(indentWidth).build();
            return this;
        }

        public Builder withObservabilitySink(YamlObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public Yaml build() {
            return new Yaml(encoderConfig, sink);
        }
    }
}
