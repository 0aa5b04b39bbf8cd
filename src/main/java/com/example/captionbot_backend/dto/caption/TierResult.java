package com.example.captionbot_backend.dto.caption;

import java.util.Objects;

/**
 * Outcome of a single tier: either a value or a {@link TierError}. Tiers return this instead of
 * throwing so that only the orchestrator decides whether a failure ends the pipeline.
 */
public final class TierResult<T> {
    private final T value;
    private final TierError error;

    private TierResult(T value, TierError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> TierResult<T> success(T value) {
        return new TierResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> TierResult<T> failure(TierError error) {
        return new TierResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> TierResult<T> failure(Tier tier, FailureKind kind, String message, Throwable cause) {
        return failure(new TierError(tier, kind, message, cause));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value on failed tier result: " + error.describe());
        }
        return value;
    }

    public TierError error() {
        if (error == null) {
            throw new IllegalStateException("Tier result is a success");
        }
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "TierResult{success}" : "TierResult{" + error.describe() + "}";
    }
}
