package com.example.clustermonitor.retry;

/**
 * Thrown when a {@link RetryPolicy} is built with out-of-range settings.
 */
public class InvalidRetryPolicyException extends IllegalArgumentException {

    public InvalidRetryPolicyException(String message) {
        super(message);
    }
}
