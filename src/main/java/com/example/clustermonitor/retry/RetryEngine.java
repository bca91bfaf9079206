package com.example.clustermonitor.retry;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs an operation under a {@link RetryPolicy}.
 *
 * <p>A failure the policy does not consider retryable is rethrown at once, without a
 * delay and without touching the retry counter. Running out of attempts is reported
 * through a failed {@link RetryOutcome} instead.
 *
 * <p>The engine keeps no per-call state. The running total of retries is shared by
 * every call made through one engine instance and can be reset.
 */
@Slf4j
public class RetryEngine {

    private final BackoffCalculator backoff;
    private final Sleeper sleeper;
    private final AtomicLong totalRetries = new AtomicLong();

    public RetryEngine() {
        this(new BackoffCalculator(), Sleeper.SYSTEM);
    }

    public RetryEngine(BackoffCalculator backoff, Sleeper sleeper) {
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    /**
     * Execute the operation, retrying retryable failures with backoff.
     *
     * @throws RuntimeException the operation's own failure when it is not retryable
     */
    public <T> RetryOutcome<T> execute(Supplier<T> operation, RetryPolicy policy) {
        int totalAttempts = policy.getMaxAttempts() + 1;
        Duration cumulativeDelay = Duration.ZERO;
        RuntimeException lastFailure = null;

        for (int attempt = 0; attempt < totalAttempts; attempt++) {
            try {
                T value = operation.get();
                if (attempt > 0) {
                    log.info("Operation succeeded on attempt {}/{}", attempt + 1, totalAttempts);
                }
                return RetryOutcome.success(value, attempt + 1, cumulativeDelay);
            } catch (RuntimeException e) {
                if (!policy.isRetryable(e)) {
                    log.debug("Attempt {} failed with non-retryable {}: {}",
                            attempt + 1, e.getClass().getSimpleName(), e.getMessage());
                    throw e;
                }
                lastFailure = e;

                if (attempt + 1 >= totalAttempts) {
                    log.error("All {} attempts failed. Last error: {}: {}",
                            totalAttempts, e.getClass().getSimpleName(), e.getMessage());
                    return RetryOutcome.failure(e, totalAttempts, cumulativeDelay);
                }

                Duration delay = backoff.delay(attempt, policy);
                log.warn("Attempt {} failed with {}: {}. Retrying in {} ms...",
                        attempt + 1, e.getClass().getSimpleName(), e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while backing off after attempt {}", attempt + 1);
                    return RetryOutcome.failure(e, attempt + 1, cumulativeDelay);
                }
                cumulativeDelay = cumulativeDelay.plus(delay);
                totalRetries.incrementAndGet();
            }
        }
        // only reachable if totalAttempts were somehow < 1, which the policy forbids
        throw new IllegalStateException("Retry loop ended without an outcome", lastFailure);
    }

    /**
     * Execute the operation and return its value.
     *
     * @throws RetryExhaustedException when every attempt failed with a retryable error
     */
    public <T> T call(Supplier<T> operation, RetryPolicy policy) {
        return execute(operation, policy).orElseThrow();
    }

    public long getTotalRetries() {
        return totalRetries.get();
    }

    public void resetStats() {
        totalRetries.set(0);
    }
}
