package com.selfplay.runtime;

import java.util.Objects;

/**
 * Outcome of an initialization step. Setup code returns these instead of throwing so the top level
 * decides the process exit status.
 */
public record SetupResult<T>(T value, String error) {

    public static <T> SetupResult<T> ok(T value) {
        return new SetupResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> SetupResult<T> failed(String error) {
        return new SetupResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public T orElseThrow() {
        if (!isOk()) {
            throw new IllegalStateException("Setup step failed: " + error);
        }
        return value;
    }
}
