package de.bsommerfeld.scalatest.core.domain;

import java.util.Objects;

/**
 * Terminal result of one runner invocation, as seen by the enclosing build.
 *
 * @param status  whether the tests passed, failed but were tolerated, or failed
 * @param message human-readable explanation; empty for {@link Status#SUCCESS}
 */
public record Outcome(Status status, String message) {

    public enum Status {
        SUCCESS,
        WARNED,
        FAILED
    }

    public Outcome {
        Objects.requireNonNull(status, "status");
        message = message != null ? message : "";
    }

    public static Outcome success() {
        return new Outcome(Status.SUCCESS, "");
    }

    public static Outcome warned(String message) {
        return new Outcome(Status.WARNED, message);
    }

    public static Outcome failed(String message) {
        return new Outcome(Status.FAILED, message);
    }

    /**
     * {@code true} unless the build step must fail. Tolerated failures count as
     * successful.
     */
    public boolean isSuccessful() {
        return status != Status.FAILED;
    }

    public boolean isWarned() {
        return status == Status.WARNED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /**
     * Surfaces a failed outcome as the reason the build step failed.
     *
     * @return this outcome if it is successful
     * @throws TestFailureException if the status is {@link Status#FAILED}
     */
    public Outcome orThrow() throws TestFailureException {
        if (isFailed()) {
            throw new TestFailureException(message);
        }
        return this;
    }
}
