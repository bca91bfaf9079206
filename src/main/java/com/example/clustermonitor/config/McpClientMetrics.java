package com.example.clustermonitor.config;

import com.example.clustermonitor.mcp.McpClient;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Exports MCP client statistics to Micrometer.
 */
@Component
@RequiredArgsConstructor
public class McpClientMetrics implements MeterBinder {

    private final McpClient mcpClient;

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("mcp.client.retries", mcpClient, McpClient::getTotalRetries)
                .description("Retries performed since the last stats reset")
                .register(registry);
        Gauge.builder("mcp.client.connected", mcpClient, client -> client.isConnected() ? 1 : 0)
                .description("1 while the MCP server process is running")
                .register(registry);
    }
}
