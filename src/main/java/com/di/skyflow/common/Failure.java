package com.di.skyflow.common;

import lombok.NonNull;
import lombok.Value;

/**
 * Typed failure carried by a {@link Result}.
 */
@Value
public class Failure {

    @NonNull FailureKind kind;
    @NonNull String code;
    String message;

    public static Failure of(FailureKind kind, String code, String message) {
        return new Failure(kind, code, message);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public String describe() {
        return kind + "/" + code + (message == null ? "" : ": " + message);
    }
}
