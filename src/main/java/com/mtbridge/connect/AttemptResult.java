package com.mtbridge.connect;

import java.util.Optional;

/**
 * Outcome of one probing step: it worked, it was tried and failed, or it did not apply
 * to this account or deployment. Steps return this instead of throwing, so callers walk
 * an ordered list and take the first success.
 */
public final class AttemptResult<T> {

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        NOT_APPLICABLE
    }

    private final Outcome outcome;
    private final String label;
    private final T value;
    private final Throwable failure;

    private AttemptResult(Outcome outcome, String label, T value, Throwable failure) {
        this.outcome = outcome;
        this.label = label;
        this.value = value;
        this.failure = failure;
    }

    public static <T> AttemptResult<T> succeeded(String label, T value) {
        return new AttemptResult<>(Outcome.SUCCEEDED, label, value, null);
    }

    public static <T> AttemptResult<T> failed(String label, Throwable failure) {
        return new AttemptResult<>(Outcome.FAILED, label, null, failure);
    }

    public static <T> AttemptResult<T> notApplicable(String label) {
        return new AttemptResult<>(Outcome.NOT_APPLICABLE, label, null, null);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getLabel() {
        return label;
    }

    public boolean isSucceeded() {
        return outcome == Outcome.SUCCEEDED;
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }

    public boolean isNotApplicable() {
        return outcome == Outcome.NOT_APPLICABLE;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    /** Same outcome and label with the value dropped, for re-typing a result. */
    public <R> AttemptResult<R> withoutValue() {
        return new AttemptResult<>(outcome, label, null, failure);
    }

    @Override
    public String toString() {
        return label + ":" + outcome + (failure != null ? "(" + failure.getMessage() + ")" : "");
    }
}
