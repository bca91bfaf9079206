package com.example.clustermonitor.retry;

import lombok.Getter;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Immutable description of how an operation is retried.
 *
 * <p>{@code maxAttempts} counts retries beyond the first try, so a policy with
 * {@code maxAttempts = 3} runs the operation at most four times. Settings are
 * validated when the policy is built; an out-of-range value raises
 * {@link InvalidRetryPolicyException}.
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *         .maxAttempts(5)
 *         .baseDelay(Duration.ofMillis(200))
 *         .maxDelay(Duration.ofSeconds(10))
 *         .strategy(RetryStrategy.EXPONENTIAL)
 *         .retryOn(e -> e instanceof IOException)
 *         .build();
 * }</pre>
 */
@Getter
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final boolean jitterEnabled;
    private final double jitterFraction;
    private final RetryStrategy strategy;
    private final Predicate<Throwable> retryablePredicate;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.multiplier = builder.multiplier;
        this.jitterEnabled = builder.jitterEnabled;
        this.jitterFraction = builder.jitterFraction;
        this.strategy = builder.strategy;
        this.retryablePredicate = builder.retryablePredicate;
    }

    /**
     * Whether the given failure should be retried under this policy.
     */
    public boolean isRetryable(Throwable failure) {
        return retryablePredicate.test(failure);
    }

    /**
     * A policy that runs the operation exactly once.
     */
    public static RetryPolicy noRetry() {
        return builder().maxAttempts(0).jitterEnabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .multiplier(multiplier)
                .jitterEnabled(jitterEnabled)
                .jitterFraction(jitterFraction)
                .strategy(strategy)
                .retryOn(retryablePredicate);
    }

    @Override
    public String toString() {
        return "RetryPolicy{strategy=" + strategy
                + ", maxAttempts=" + maxAttempts
                + ", baseDelay=" + baseDelay
                + ", maxDelay=" + maxDelay
                + ", multiplier=" + multiplier
                + ", jitter=" + (jitterEnabled ? jitterFraction : "off")
                + "}";
    }

    /**
     * Builder for {@link RetryPolicy}. Defaults: 3 retries, 1s base delay, 60s cap,
     * multiplier 2, 10% jitter, exponential strategy, every failure retryable.
     */
    public static final class Builder {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private boolean jitterEnabled = true;
        private double jitterFraction = 0.1;
        private RetryStrategy strategy = RetryStrategy.EXPONENTIAL;
        private Predicate<Throwable> retryablePredicate = failure -> true;

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
            return this;
        }

        /** Growth factor, only used by {@link RetryStrategy#EXPONENTIAL}. */
        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder jitterEnabled(boolean jitterEnabled) {
            this.jitterEnabled = jitterEnabled;
            return this;
        }

        /** Jitter range as a fraction of the computed delay, e.g. 0.2 for +/-20%. */
        public Builder jitterFraction(double jitterFraction) {
            this.jitterFraction = jitterFraction;
            return this;
        }

        public Builder strategy(RetryStrategy strategy) {
            this.strategy = Objects.requireNonNull(strategy, "strategy");
            return this;
        }

        public Builder retryOn(Predicate<Throwable> retryablePredicate) {
            this.retryablePredicate = Objects.requireNonNull(retryablePredicate, "retryablePredicate");
            return this;
        }

        public RetryPolicy build() {
            if (maxAttempts < 0) {
                throw new InvalidRetryPolicyException("maxAttempts must be non-negative");
            }
            if (baseDelay.isNegative()) {
                throw new InvalidRetryPolicyException("baseDelay must be non-negative");
            }
            if (maxDelay.compareTo(baseDelay) < 0) {
                throw new InvalidRetryPolicyException("maxDelay must be >= baseDelay");
            }
            if (Double.isNaN(jitterFraction) || jitterFraction < 0.0 || jitterFraction > 1.0) {
                throw new InvalidRetryPolicyException("jitterFraction must be between 0 and 1");
            }
            if (Double.isNaN(multiplier) || multiplier < 0.0) {
                throw new InvalidRetryPolicyException("multiplier must be non-negative");
            }
            return new RetryPolicy(this);
        }
    }
}
