package com.di.skyflow.common;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of an operation that either produced a value or failed with a typed {@link Failure}.
 * Collaborators and stores return this instead of throwing; the stage orchestrator is the
 * only place that turns a failure into a retry, a recorded failure or a degraded outcome.
 *
 * @param <T> value type; {@link Void} for operations with no payload
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Result<T> {

    boolean success;
    T data;
    Failure failure;

    public static <T> Result<T> success(T data) {
        return new Result<>(true, data, null);
    }

    public static Result<Void> ok() {
        return new Result<>(true, null, null);
    }

    public static <T> Result<T> failure(Failure failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure must not be null");
        }
        return new Result<>(false, null, failure);
    }

    public static <T> Result<T> failure(FailureKind kind, String code, String message) {
        return failure(Failure.of(kind, code, message));
    }

    public static <T> Result<T> validation(String code, String message) {
        return failure(FailureKind.VALIDATION, code, message);
    }

    public static <T> Result<T> transientFailure(String code, String message) {
        return failure(FailureKind.TRANSIENT, code, message);
    }

    public static <T> Result<T> fatal(String code, String message) {
        return failure(FailureKind.FATAL, code, message);
    }

    public boolean isFailure() {
        return !success;
    }

    public Optional<T> value() {
        return Optional.ofNullable(data);
    }

    public Optional<Failure> error() {
        return Optional.ofNullable(failure);
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (!success) {
            return failure(failure);
        }
        return success(mapper.apply(data));
    }

    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (!success) {
            return failure(failure);
        }
        return mapper.apply(data);
    }

    public T orElse(T other) {
        return success ? data : other;
    }

    /** Code of the failure, or {@code null} on success. */
    public String failureCode() {
        return failure == null ? null : failure.getCode();
    }
}
