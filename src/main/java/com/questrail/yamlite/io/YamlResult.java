package com.questrail.yamlite.io;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a document operation: either a value or a {@link YamlError}.
 *
 * <p>Operations returning a result never throw for operational failures;
 * callers check {@link #isSuccess()} before using {@link #value()}.</p>
 */
public final class YamlResult<T> {
    private final T value;
    private final YamlError error;

    private YamlResult(T value, YamlError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> YamlResult<T> success(T value) {
        return new YamlResult<>(value, null);
    }

    public static <T> YamlResult<T> failure(YamlError error) {
        return new YamlResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if the operation failed
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value: " + error.message());
        }
        return value;
    }

    public Optional<YamlError> error() {
        return Optional.ofNullable(error);
    }

    /**
     * @return the error message, or empty on success
     */
    public Optional<String> message() {
        return error().map(YamlError::message);
    }

    public <R> YamlResult<R> flatMap(Function<? super T, YamlResult<R>> next) {
        if (error != null) {
            return failure(error);
        }
        return next.apply(value);
    }

    @Override
    public String toString() {
        return isSuccess() ? "YamlResult[success=" + value + "]" : "YamlResult[failure=" + error + "]";
    }
}
