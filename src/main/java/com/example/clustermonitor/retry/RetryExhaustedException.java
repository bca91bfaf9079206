package com.example.clustermonitor.retry;

import lombok.Getter;

import java.time.Duration;

/**
 * Every permitted attempt failed with a retryable error.
 * The cause is the failure raised by the last attempt.
 */
@Getter
public class RetryExhaustedException extends RuntimeException {

    private final int attemptsMade;
    private final Duration cumulativeDelay;

    public RetryExhaustedException(int attemptsMade, Duration cumulativeDelay, Throwable lastFailure) {
        super(String.format("All %d attempts failed. Last error: %s",
                attemptsMade, describe(lastFailure)), lastFailure);
        this.attemptsMade = attemptsMade;
        this.cumulativeDelay = cumulativeDelay;
    }

    private static String describe(Throwable failure) {
        if (failure == null) {
            return "unknown";
        }
        return failure.getClass().getSimpleName() + ": " + failure.getMessage();
    }
}
