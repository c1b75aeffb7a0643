package com.cfoPilot.aiCfo.orchestrator.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of one pipeline stage: either a value or the reason it degraded.
 *
 * @param <T> Stage output type
 */
public final class StageResult<T> {

    private final T value;
    private final DegradedReason reason;
    private final String detail;

    private StageResult(T value, DegradedReason reason, String detail) {
        this.value = value;
        this.reason = reason;
        this.detail = detail;
    }

    public static <T> StageResult<T> success(T value) {
        return new StageResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> StageResult<T> degraded(DegradedReason reason, String detail) {
        return new StageResult<>(null, Objects.requireNonNull(reason, "reason"), detail);
    }

    public boolean isSuccess() {
        return reason == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("Stage degraded: " + reason);
        }
        return value;
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }

    public DegradedReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    public <R> StageResult<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : degraded(reason, detail);
    }

    @Override
    public String toString() {
        return isSuccess() ? "StageResult[success]" : "StageResult[degraded=" + reason + ", " + detail + "]";
    }
}
