package com.example.clustermonitor.config;

import com.example.clustermonitor.retry.RetryStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Central configuration for the cluster monitor.
 * Maps to the 'cluster-monitor' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "cluster-monitor")
public class MonitorProperties {

    private McpConfig mcp = new McpConfig();
    private RetryConfig retry = new RetryConfig();
    private MonitoringConfig monitoring = new MonitoringConfig();
    private ToolsConfig tools = new ToolsConfig();

    @Data
    public static class McpConfig {
        private List<String> command = new ArrayList<>(List.of("python", "-m", "mcp_k3s_monitor"));
        private int timeoutSeconds = 30;
        private boolean autoConnect = false;
        private long pollIntervalMillis = 10;
        private int shutdownGraceSeconds = 5;
        private int toolsCacheTtlSeconds = 60;
    }

    @Data
    public static class RetryConfig {
        /** Retries beyond the first attempt */
        private int maxAttempts = 3;
        private long baseDelayMillis = 1000;
        private long maxDelayMillis = 60000;
        private double multiplier = 2.0;
        private boolean jitterEnabled = true;
        private double jitterFraction = 0.1;
        private RetryStrategy strategy = RetryStrategy.EXPONENTIAL;
        /** Server error codes treated as transient */
        private List<Integer> transientErrorCodes = new ArrayList<>(List.of(-32000, -32603));
    }

    @Data
    public static class MonitoringConfig {
        private boolean enabled = false;
        private int intervalSeconds = 30;
        private String namespace = "";
    }

    @Data
    public static class ToolsConfig {
        private boolean registerOnStartup = true;
    }
}
