package com.example.clustermonitor.mcp;

import com.example.clustermonitor.retry.RetryPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Immutable settings for one {@link McpClient}.
 */
@Value
@Builder
public class McpClientSettings {

    List<String> command;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);

    @Builder.Default
    Duration pollInterval = Duration.ofMillis(10);

    @Builder.Default
    Duration shutdownGrace = Duration.ofSeconds(5);

    @Builder.Default
    Duration toolsCacheTtl = Duration.ofSeconds(60);

    @Builder.Default
    RetryPolicy retryPolicy = RetryPolicy.noRetry();

    /**
     * Applied on top of the policy's own predicate: protocol and connection failures are
     * never retried whatever the policy says.
     */
    @Builder.Default
    McpFailureClassifier failureClassifier = McpFailureClassifier.withDefaultCodes();
}
