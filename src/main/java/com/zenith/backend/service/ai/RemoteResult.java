package com.zenith.backend.service.ai;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a remote AI operation: either a value or a failure kind with a diagnostic detail.
 */
public record RemoteResult<T>(T value, RemoteFailure failure, String detail) {

    public RemoteResult {
        if ((value == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of value or failure must be set");
        }
    }

    public static <T> RemoteResult<T> success(T value) {
        return new RemoteResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> RemoteResult<T> failure(RemoteFailure failure, String detail) {
        return new RemoteResult<>(null, Objects.requireNonNull(failure, "failure"), detail);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    public <R> RemoteResult<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(failure, detail);
    }

    public <R> RemoteResult<R> flatMap(Function<T, RemoteResult<R>> mapper) {
        return isSuccess() ? mapper.apply(value) : failure(failure, detail);
    }

    public <R> R fold(Function<T, R> onSuccess, Function<RemoteFailure, R> onFailure) {
        return isSuccess() ? onSuccess.apply(value) : onFailure.apply(failure);
    }
}
