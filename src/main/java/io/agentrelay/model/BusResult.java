package io.agentrelay.model;

import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Success-or-error outcome returned by bus, task and registry operations instead of throwing.
 */
public record BusResult<T>(
        T value,
        BusError error
) {
    public static <T> BusResult<T> ok(T value) {
        return new BusResult<>(value, null);
    }

    public static <T> BusResult<T> fail(ErrorKind kind, String message) {
        return new BusResult<>(null, BusError.of(kind, message));
    }

    public static <T> BusResult<T> fail(BusError error) {
        return new BusResult<>(null, error);
    }

    public boolean success() {
        return error == null;
    }

    public boolean isError() {
        return error != null;
    }

    public boolean failedWith(ErrorKind kind) {
        return error != null && error.kind() == kind;
    }

    public T orElseThrow() {
        if (error != null) {
            throw new NoSuchElementException(error.kind() + ": " + error.message());
        }
        return value;
    }

    public <R> BusResult<R> map(Function<T, R> mapper) {
        if (error != null) {
            return fail(error);
        }
        return ok(mapper.apply(value));
    }
}
