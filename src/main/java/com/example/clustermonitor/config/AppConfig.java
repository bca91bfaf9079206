package com.example.clustermonitor.config;

import com.example.clustermonitor.mcp.McpClient;
import com.example.clustermonitor.mcp.McpClientSettings;
import com.example.clustermonitor.mcp.McpFailureClassifier;
import com.example.clustermonitor.retry.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashSet;

@Slf4j
@Configuration
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public McpFailureClassifier mcpFailureClassifier(MonitorProperties properties) {
        return new McpFailureClassifier(new HashSet<>(properties.getRetry().getTransientErrorCodes()));
    }

    @Bean
    public RetryPolicy mcpRetryPolicy(MonitorProperties properties, McpFailureClassifier classifier) {
        MonitorProperties.RetryConfig retry = properties.getRetry();
        return RetryPolicy.builder()
                .maxAttempts(retry.getMaxAttempts())
                .baseDelay(Duration.ofMillis(retry.getBaseDelayMillis()))
                .maxDelay(Duration.ofMillis(retry.getMaxDelayMillis()))
                .multiplier(retry.getMultiplier())
                .jitterEnabled(retry.isJitterEnabled())
                .jitterFraction(retry.getJitterFraction())
                .strategy(retry.getStrategy())
                .retryOn(classifier)
                .build();
    }

    @Bean(destroyMethod = "close")
    public McpClient mcpClient(MonitorProperties properties, RetryPolicy mcpRetryPolicy,
                               McpFailureClassifier mcpFailureClassifier, ObjectMapper objectMapper) {
        MonitorProperties.McpConfig mcp = properties.getMcp();
        McpClientSettings settings = McpClientSettings.builder()
                .command(mcp.getCommand())
                .timeout(Duration.ofSeconds(mcp.getTimeoutSeconds()))
                .pollInterval(Duration.ofMillis(mcp.getPollIntervalMillis()))
                .shutdownGrace(Duration.ofSeconds(mcp.getShutdownGraceSeconds()))
                .toolsCacheTtl(Duration.ofSeconds(mcp.getToolsCacheTtlSeconds()))
                .retryPolicy(mcpRetryPolicy)
                .failureClassifier(mcpFailureClassifier)
                .build();
        McpClient client = new McpClient(settings, objectMapper);
        if (mcp.isAutoConnect()) {
            client.connect();
        }
        log.info("MCP client configured: command={}, timeout={}s, retry={}, transient codes={}",
                mcp.getCommand(), mcp.getTimeoutSeconds(), mcpRetryPolicy, mcpFailureClassifier.getTransientCodes());
        return client;
    }
}
