package com.example.mathverify.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Success value or failure reason. Parse and engine failures travel as values
 * of this type until they are turned into a {@link CheckItem}.
 *
 * @param value success value (null on failure)
 * @param error failure reason (null on success)
 * @param <T>   value type
 */
public record Outcome<T>(T value, String error) {

    public Outcome {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of value or error must be set");
        }
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Outcome<T> failure(String error) {
        return new Outcome<>(null, error == null || error.isBlank() ? "unknown error" : error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error);
    }

    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        return isSuccess() ? mapper.apply(value) : failure(error);
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }
}
