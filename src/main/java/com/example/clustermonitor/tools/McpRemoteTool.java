package com.example.clustermonitor.tools;

import com.example.clustermonitor.agent.AgentTool;
import com.example.clustermonitor.agent.FailureReport;
import com.example.clustermonitor.agent.ToolResult;
import com.example.clustermonitor.mcp.McpClient;
import com.example.clustermonitor.mcp.McpClientException;
import com.example.clustermonitor.mcp.McpTool;
import com.example.clustermonitor.retry.RetryExhaustedException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Agent tool backed by a tool advertised by the MCP server.
 */
@Slf4j
public class McpRemoteTool implements AgentTool {

    public static final String CATEGORY = "cluster";

    private final McpTool descriptor;
    private final McpClient client;

    public McpRemoteTool(McpTool descriptor, McpClient client) {
        this.descriptor = descriptor;
        this.client = client;
    }

    @Override
    public String getName() {
        return descriptor.getName();
    }

    @Override
    public String getDescription() {
        return descriptor.getDescription() != null ? descriptor.getDescription() : "";
    }

    @Override
    public String getCategory() {
        return CATEGORY;
    }

    @Override
    public Map<String, Object> getParameterSchema() {
        return descriptor.getInputSchema() != null ? descriptor.getInputSchema() : Map.of("type", "object");
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters) {
        String step = "MCP tool '" + getName() + "'";
        long started = System.currentTimeMillis();
        try {
            JsonNode result = client.callTool(getName(), parameters);
            return ToolResult.ok(getName(), result, System.currentTimeMillis() - started);
        } catch (McpClientException | RetryExhaustedException e) {
            String message = FailureReport.describe(step, e);
            log.warn(message);
            return ToolResult.failed(getName(), message, FailureReport.details(step, e),
                    System.currentTimeMillis() - started);
        }
    }
}
