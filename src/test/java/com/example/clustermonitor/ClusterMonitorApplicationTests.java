package com.example.clustermonitor;

import com.example.clustermonitor.agent.ToolRegistry;
import com.example.clustermonitor.config.MonitorProperties;
import com.example.clustermonitor.mcp.McpClient;
import com.example.clustermonitor.retry.RetryPolicy;
import com.example.clustermonitor.retry.RetryStrategy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ClusterMonitorApplicationTests {

    @Autowired
    private MonitorProperties properties;

    @Autowired
    private ToolRegistry toolRegistry;

    @Autowired
    private McpClient mcpClient;

    @Autowired
    private RetryPolicy mcpRetryPolicy;

    @Test
    void contextLoads() {
        assertNotNull(properties);
        assertNotNull(toolRegistry);
        assertNotNull(mcpClient);
    }

    @Test
    void clientIsNotStartedWithoutAutoConnect() {
        assertFalse(properties.getMcp().isAutoConnect());
        assertFalse(mcpClient.isConnected());
        assertEquals(0, toolRegistry.getToolCount());
    }

    @Test
    void configurationIsLoaded() {
        assertEquals(30, properties.getMcp().getTimeoutSeconds());
        assertEquals(Duration.ofSeconds(30), mcpClient.getSettings().getTimeout());
        assertFalse(properties.getMonitoring().isEnabled());
    }

    @Test
    void retryPolicyIsBuiltFromProperties() {
        assertEquals(3, mcpRetryPolicy.getMaxAttempts());
        assertEquals(Duration.ofSeconds(1), mcpRetryPolicy.getBaseDelay());
        assertEquals(RetryStrategy.EXPONENTIAL, mcpRetryPolicy.getStrategy());
        assertSame(mcpRetryPolicy, mcpClient.getSettings().getRetryPolicy());
    }
}
