package com.example.clustermonitor.retry;

/**
 * How the delay between attempts grows.
 */
public enum RetryStrategy {

    /** {@code baseDelay * multiplier^attempt} */
    EXPONENTIAL,

    /** {@code baseDelay * (attempt + 1)} */
    LINEAR,

    /** {@code baseDelay} on every attempt */
    CONSTANT
}
