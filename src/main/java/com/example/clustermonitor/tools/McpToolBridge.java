package com.example.clustermonitor.tools;

import com.example.clustermonitor.agent.AgentTool;
import com.example.clustermonitor.agent.FailureReport;
import com.example.clustermonitor.agent.ToolRegistry;
import com.example.clustermonitor.config.MonitorProperties;
import com.example.clustermonitor.mcp.McpClient;
import com.example.clustermonitor.mcp.McpClientException;
import com.example.clustermonitor.mcp.McpTool;
import com.example.clustermonitor.retry.RetryExhaustedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registers the tools advertised by the MCP server in the {@link ToolRegistry}
 * and drops registrations for tools the server no longer offers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class McpToolBridge {

    private final McpClient mcpClient;
    private final ToolRegistry toolRegistry;
    private final MonitorProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void registerOnStartup() {
        if (!properties.getTools().isRegisterOnStartup() || !mcpClient.isConnected()) {
            log.info("Skipping MCP tool registration at startup (server not connected or disabled)");
            return;
        }
        try {
            sync();
        } catch (McpClientException | RetryExhaustedException e) {
            log.error(FailureReport.describe("MCP tool discovery", e));
        }
    }

    /**
     * Fetch the server's tool list (bypassing the cache) and mirror it in the registry.
     *
     * @return number of MCP tools now registered
     */
    public int sync() {
        List<McpTool> tools = mcpClient.listTools(false);
        Set<String> advertised = tools.stream().map(McpTool::getName).collect(Collectors.toSet());

        toolRegistry.getToolsByCategory(McpRemoteTool.CATEGORY).stream()
                .map(AgentTool::getName)
                .filter(name -> !advertised.contains(name))
                .forEach(toolRegistry::unregister);

        for (McpTool tool : tools) {
            toolRegistry.register(new McpRemoteTool(tool, mcpClient));
        }
        log.info("MCP tool registration complete. {} tools available", tools.size());
        return tools.size();
    }
}
