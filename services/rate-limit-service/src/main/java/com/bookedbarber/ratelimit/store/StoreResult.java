package com.bookedbarber.ratelimit.store;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a counter store call.
 *
 * Store implementations never surface infrastructure errors as exceptions; a call either
 * carries a value or an {@link StoreFailure} describing why the store could not answer.
 * Callers decide whether an unavailable store means allow or deny.
 *
 * @param <T> value type
 */
public final class StoreResult<T> {

    private final T value;
    private final StoreFailure failure;
    private final String detail;

    private StoreResult(T value, StoreFailure failure, String detail) {
        this.value = value;
        this.failure = failure;
        this.detail = detail;
    }

    public static <T> StoreResult<T> ok(T value) {
        return new StoreResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> StoreResult<T> unavailable(StoreFailure failure, String detail) {
        return new StoreResult<>(null, Objects.requireNonNull(failure, "failure"), detail);
    }

    public boolean isAvailable() {
        return failure == null;
    }

    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("Store unavailable: " + failure + " (" + detail + ")");
        }
        return value;
    }

    public T orElse(T fallback) {
        return failure == null ? value : fallback;
    }

    public StoreFailure getFailure() {
        return failure;
    }

    public String getDetail() {
        return detail;
    }

    public <R> StoreResult<R> map(Function<? super T, ? extends R> mapper) {
        if (failure != null) {
            return new StoreResult<>(null, failure, detail);
        }
        return StoreResult.ok(mapper.apply(value));
    }

    @Override
    public String toString() {
        return failure == null ? "StoreResult[" + value + "]" : "StoreResult[" + failure + ": " + detail + "]";
    }
}
