package com.example.clustermonitor.retry;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;

/**
 * Terminal result of {@link RetryEngine#execute}.
 * A value is present iff the operation succeeded; a last failure is present iff it did not.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RetryOutcome<T> {

    private final boolean succeeded;
    private final T value;
    private final int attemptsMade;
    private final Duration cumulativeDelay;
    private final Throwable lastFailure;

    public static <T> RetryOutcome<T> success(T value, int attemptsMade, Duration cumulativeDelay) {
        return new RetryOutcome<>(true, value, attemptsMade, cumulativeDelay, null);
    }

    public static <T> RetryOutcome<T> failure(Throwable lastFailure, int attemptsMade, Duration cumulativeDelay) {
        if (lastFailure == null) {
            throw new IllegalArgumentException("a failed outcome needs its last failure");
        }
        return new RetryOutcome<>(false, null, attemptsMade, cumulativeDelay, lastFailure);
    }

    /**
     * The value of a successful outcome.
     *
     * @throws RetryExhaustedException if every attempt failed
     */
    public T orElseThrow() {
        if (!succeeded) {
            throw new RetryExhaustedException(attemptsMade, cumulativeDelay, lastFailure);
        }
        return value;
    }
}
