package com.example.clustermonitor.tools;

import com.example.clustermonitor.agent.AgentTool;
import com.example.clustermonitor.agent.ToolRegistry;
import com.example.clustermonitor.agent.ToolResult;
import com.example.clustermonitor.config.MonitorProperties;
import com.example.clustermonitor.mcp.McpClient;
import com.example.clustermonitor.mcp.McpClientException;
import com.example.clustermonitor.mcp.McpError;
import com.example.clustermonitor.mcp.McpTool;
import com.example.clustermonitor.retry.RetryExhaustedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class McpToolBridgeTest {

    @Mock
    private McpClient mcpClient;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ToolRegistry registry = new ToolRegistry();
    private final MonitorProperties properties = new MonitorProperties();
    private McpToolBridge bridge;

    @BeforeEach
    void setUp() {
        bridge = new McpToolBridge(mcpClient, registry, properties);
    }

    private static McpTool tool(String name) {
        return McpTool.builder().name(name).description(name + " tool").build();
    }

    @Test
    void syncRegistersAdvertisedToolsAndDropsStaleOnes() {
        when(mcpClient.listTools(false))
                .thenReturn(List.of(tool("list_pods"), tool("list_nodes")))
                .thenReturn(List.of(tool("list_pods")));

        assertThat(bridge.sync()).isEqualTo(2);
        assertThat(registry.listTools()).containsOnlyKeys("list_nodes", "list_pods");

        assertThat(bridge.sync()).isEqualTo(1);
        assertThat(registry.getTool("list_nodes")).isEmpty();
        assertThat(registry.getTool("list_pods")).isPresent();
    }

    @Test
    void startupRegistrationSkippedWhenNotConnected() {
        when(mcpClient.isConnected()).thenReturn(false);

        bridge.registerOnStartup();

        verify(mcpClient, never()).listTools(false);
        assertThat(registry.getToolCount()).isZero();
    }

    @Test
    void startupDiscoveryFailureIsLoggedNotThrown() {
        when(mcpClient.isConnected()).thenReturn(true);
        when(mcpClient.listTools(false)).thenThrow(McpClientException.protocol("garbled"));

        bridge.registerOnStartup();

        assertThat(registry.getToolCount()).isZero();
    }

    @Test
    void remoteToolReturnsJsonResult() {
        when(mcpClient.callTool(eq("list_pods"), any())).thenReturn(mapper.createArrayNode().add("web-1"));
        AgentTool tool = new McpRemoteTool(tool("list_pods"), mcpClient);

        ToolResult result = tool.execute(Map.of("namespace", "default"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData().get(0).asText()).isEqualTo("web-1");
        assertThat(result.getToolName()).isEqualTo("list_pods");
        assertThat(tool.getCategory()).isEqualTo(McpRemoteTool.CATEGORY);
    }

    @Test
    void remoteToolReportsFailedStepAndLastCause() {
        McpClientException last = McpClientException.remote(
                McpError.builder().code(-32000).message("Server busy").build());
        when(mcpClient.callTool(eq("list_pods"), any()))
                .thenThrow(new RetryExhaustedException(4, Duration.ofSeconds(7), last));
        AgentTool tool = new McpRemoteTool(tool("list_pods"), mcpClient);

        ToolResult result = tool.execute(Map.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError())
                .contains("MCP tool 'list_pods' failed after 4 attempts")
                .contains("REMOTE")
                .contains("Server busy");
        assertThat(result.getFailure())
                .containsEntry("kind", "REMOTE")
                .containsEntry("remoteCode", -32000)
                .containsEntry("attempts", 4);
    }
}
