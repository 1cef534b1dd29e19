package com.shapeml.script.interpreter;

/**
 * Outcome of an evaluation step: either a value (possibly null for steps that only
 * have an effect) or a {@link RuntimeError}.
 */
public final class Result<T> {
    private final T value;
    private final RuntimeError error;

    private Result(T value, RuntimeError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> ok() {
        return new Result<>(null, null);
    }

    public static <T> Result<T> fail(RuntimeError error) {
        if (error == null) throw new IllegalArgumentException("error must not be null");
        return new Result<>(null, error);
    }

    public boolean isOk() { return error == null; }

    public boolean failed() { return error != null; }

    public T value() {
        if (error != null) throw new IllegalStateException("Result holds an error: " + error);
        return value;
    }

    public RuntimeError error() { return error; }

    /** Re-types a failed result so it can be passed up unchanged. */
    public <U> Result<U> propagate() {
        if (error == null) throw new IllegalStateException("Only failed results can be propagated");
        return new Result<>(null, error);
    }

    @Override
    public String toString() {
        return error == null ? "Ok(" + value + ")" : error.toString();
    }
}
