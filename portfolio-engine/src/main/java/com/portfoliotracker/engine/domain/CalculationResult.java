package com.portfoliotracker.engine.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a calculation that can legitimately fail for lack of data. Failures carry a
 * human-readable reason instead of surfacing as exceptions.
 *
 * @param <T> the computed value type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CalculationResult<T> {

    private final T value;
    private final String error;

    private CalculationResult(T value, String error) {
        this.value = value;
        this.error = error;
    }

    public static <T> CalculationResult<T> ok(T value) {
        return new CalculationResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> CalculationResult<T> error(String reason) {
        return new CalculationResult<>(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * The computed value, or {@code null} when the calculation failed.
     */
    public T getValue() {
        return value;
    }

    public String getError() {
        return error;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public <R> CalculationResult<R> map(Function<? super T, ? extends R> mapper) {
        return isOk() ? ok(mapper.apply(value)) : error(error);
    }

    @Override
    public String toString() {
        return isOk() ? "CalculationResult[ok=" + value + "]" : "CalculationResult[error=" + error + "]";
    }
}
