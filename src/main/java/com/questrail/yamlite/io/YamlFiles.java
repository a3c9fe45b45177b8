package com.questrail.yamlite.io;

import com.questrail.yamlite.codec.YamlDecoder;
import com.questrail.yamlite.codec.YamlEncoder;
import com.questrail.yamlite.model.YamlValue;
import com.questrail.yamlite.observability.YamlDocumentEvent;
import com.questrail.yamlite.observability.YamlErrorEvent;
import com.questrail.yamlite.observability.YamlObservabilitySink;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * YamlFiles
 * -----------------------------------------------------------------------------
 * Reads, writes and modifies YAML documents on disk.
 *
 * <p>Each call is a single blocking open, read-or-write, close sequence in
 * UTF-8. There is no caching and no locking. Failures are returned as
 * {@link YamlResult} values and reported to the observability sink; no
 * exception crosses this boundary for an I/O failure.</p>
 */
public final class YamlFiles {
    static final String READ_FAILURE = "Failed to open file: ";
    static final String WRITE_FAILURE = "Failed to open file for writing: ";
    static final String MUTATOR_FAILURE = "Mutator returned nothing";

    private final YamlDecoder decoder;
    private final YamlEncoder encoder;
    private final YamlObservabilitySink sink;

    public YamlFiles(YamlDecoder decoder, YamlEncoder encoder, YamlObservabilitySink sink) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Reads and decodes the document at {@code path}.
     */
    public YamlResult<YamlValue> read(Path path) {
        Objects.requireNonNull(path, "path");
        final String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            return fail(path, YamlError.io(READ_FAILURE + reason(e), e));
        }
        sink.onDocumentEvent(new YamlDocumentEvent(Instant.now(), YamlDocumentEvent.Kind.READ, path, text.length()));
        return YamlResult.success(decoder.decode(text));
    }

    /**
     * Encodes {@code value} and writes it to {@code path}, creating or
     * truncating the file.
     *
     * @return the path written
     */
    public YamlResult<Path> write(Path path, YamlValue value) {
        Objects.requireNonNull(path, "path");
        String text = encoder.encode(value);
        try {
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            return fail(path, YamlError.io(WRITE_FAILURE + reason(e), e));
        }
        sink.onDocumentEvent(new YamlDocumentEvent(Instant.now(), YamlDocumentEvent.Kind.WRITTEN, path, text.length()));
        return YamlResult.success(path);
    }

    /**
     * Reads the document at {@code path}, applies {@code mutator} to the tree
     * and writes the result back.
     *
     * <p>The mutator may change the tree in place and return it, or return a
     * different tree. A {@code null} return is a {@link YamlErrorKind#MUTATOR}
     * failure and leaves the file untouched.</p>
     *
     * @return the tree that was written
     */
    public YamlResult<YamlValue> modify(Path path, Function<? super YamlValue, ? extends YamlValue> mutator) {
        Objects.requireNonNull(mutator, "mutator");
        return read(path).flatMap(tree -> {
            YamlValue modified = mutator.apply(tree);
            if (modified == null) {
                return fail(path, YamlError.mutator(MUTATOR_FAILURE));
            }
            return write(path, modified).flatMap(written -> YamlResult.success(modified));
        });
    }

    private <T> YamlResult<T> fail(Path path, YamlError error) {
        sink.onError(new YamlErrorEvent(Instant.now(), path, error));
        return YamlResult.failure(error);
    }

    private static String reason(Exception e) {
        // NoSuchFileException and friends carry only the path as their message.
        String simpleName = e.getClass().getSimpleName();
        return e.getMessage() == null ? simpleName : simpleName + " (" + e.getMessage() + ")";
    }
}
