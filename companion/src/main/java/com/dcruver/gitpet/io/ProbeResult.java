package com.dcruver.gitpet.io;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a git probe: either a value or a failure reason.
 * Callers must pick a fallback explicitly via {@link #orElse(Object)},
 * so a degraded metric is always a visible decision.
 *
 * @param <T> value type
 */
@ToString
@EqualsAndHashCode
public final class ProbeResult<T> {

    private final T value;
    private final ProbeFailure failure;
    private final String detail;

    private ProbeResult(T value, ProbeFailure failure, String detail) {
        this.value = value;
        this.failure = failure;
        this.detail = detail;
    }

    public static <T> ProbeResult<T> success(T value) {
        return new ProbeResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> ProbeResult<T> failure(ProbeFailure failure, String detail) {
        return new ProbeResult<>(null, Objects.requireNonNull(failure, "failure"), detail);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    /**
     * Failure reason, or null on success
     */
    public ProbeFailure getFailure() {
        return failure;
    }

    /**
     * Human-readable failure detail, or null on success
     */
    public String getDetail() {
        return detail;
    }

    /**
     * Transform a successful value. A mapper that throws or returns null turns the
     * result into a {@link ProbeFailure#MALFORMED_OUTPUT} failure.
     */
    public <R> ProbeResult<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailure()) {
            return failure(failure, detail);
        }

        R mapped;
        try {
            mapped = mapper.apply(value);
        } catch (RuntimeException e) {
            return failure(ProbeFailure.MALFORMED_OUTPUT, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (mapped == null) {
            return failure(ProbeFailure.MALFORMED_OUTPUT, "no value in output");
        }
        return success(mapped);
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * Short description for logs and degraded-check details
     */
    public String describeFailure() {
        if (isSuccess()) {
            return "ok";
        }
        return detail == null ? failure.name() : failure.name() + " (" + detail + ")";
    }
}
