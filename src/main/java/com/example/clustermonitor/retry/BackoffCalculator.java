package com.example.clustermonitor.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes the delay before a retry.
 *
 * <p>The strategy's raw delay is capped at {@code maxDelay} first; jitter is then
 * applied to the capped value and the result is clamped at zero.
 */
public class BackoffCalculator {

    private final DoubleSupplier uniform;

    public BackoffCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param uniform source of uniformly distributed values in {@code [0, 1)}
     */
    public BackoffCalculator(DoubleSupplier uniform) {
        this.uniform = uniform;
    }

    /**
     * Delay to wait after the failure of the given attempt.
     *
     * @param attempt zero-based attempt index
     * @param policy  the retry policy
     * @return a non-negative delay
     */
    public Duration delay(int attempt, RetryPolicy policy) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative: " + attempt);
        }
        double base = policy.getBaseDelay().toNanos();
        double raw = switch (policy.getStrategy()) {
            case EXPONENTIAL -> base * Math.pow(policy.getMultiplier(), attempt);
            case LINEAR -> base * (attempt + 1.0);
            case CONSTANT -> base;
        };
        double delay = Math.min(raw, (double) policy.getMaxDelay().toNanos());

        if (policy.isJitterEnabled() && policy.getJitterFraction() > 0) {
            double range = delay * policy.getJitterFraction();
            double offset = (uniform.getAsDouble() * 2.0 - 1.0) * range;
            delay = Math.max(0.0, delay + offset);
        }
        return Duration.ofNanos((long) delay);
    }
}
