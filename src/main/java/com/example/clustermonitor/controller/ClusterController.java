package com.example.clustermonitor.controller;

import com.example.clustermonitor.agent.ToolRegistry;
import com.example.clustermonitor.agent.ToolResult;
import com.example.clustermonitor.mcp.McpClient;
import com.example.clustermonitor.mcp.McpTool;
import com.example.clustermonitor.tools.McpToolBridge;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API over the MCP cluster-monitoring server.
 */
@Slf4j
@RestController
@RequestMapping("/api/cluster")
@RequiredArgsConstructor
public class ClusterController {

    private final McpClient mcpClient;
    private final McpToolBridge toolBridge;
    private final ToolRegistry toolRegistry;

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("connected", mcpClient.isConnected());
        status.put("command", mcpClient.getSettings().getCommand());
        status.put("totalRetries", mcpClient.getTotalRetries());
        status.put("registeredTools", toolRegistry.getToolCount());
        return ResponseEntity.ok(status);
    }

    @PostMapping("/connect")
    public ResponseEntity<Map<String, Object>> connect() {
        boolean started = mcpClient.ensureConnected();
        return ResponseEntity.ok(Map.of("connected", mcpClient.isConnected(), "started", started));
    }

    @PostMapping("/disconnect")
    public ResponseEntity<Map<String, Object>> disconnect() {
        mcpClient.disconnect();
        return ResponseEntity.ok(Map.of("connected", mcpClient.isConnected()));
    }

    @GetMapping("/health")
    public ResponseEntity<JsonNode> health() {
        return ResponseEntity.ok(mcpClient.getClusterHealth());
    }

    @GetMapping("/pods")
    public ResponseEntity<JsonNode> pods(
            @RequestParam(required = false) String namespace,
            @RequestParam(required = false) String labelSelector) {
        return ResponseEntity.ok(mcpClient.listPods(namespace, labelSelector));
    }

    @GetMapping("/pods/{namespace}/{pod}/logs")
    public ResponseEntity<JsonNode> podLogs(
            @PathVariable String namespace,
            @PathVariable String pod,
            @RequestParam(defaultValue = "50") int lines) {
        return ResponseEntity.ok(mcpClient.getPodLogs(pod, namespace, lines));
    }

    @GetMapping("/deployments")
    public ResponseEntity<JsonNode> deployments(@RequestParam(required = false) String namespace) {
        return ResponseEntity.ok(mcpClient.listDeployments(namespace));
    }

    @GetMapping("/nodes")
    public ResponseEntity<JsonNode> nodes() {
        return ResponseEntity.ok(mcpClient.listNodes());
    }

    @GetMapping("/namespaces")
    public ResponseEntity<JsonNode> namespaces() {
        return ResponseEntity.ok(mcpClient.listNamespaces());
    }

    @GetMapping("/tools")
    public ResponseEntity<List<McpTool>> tools(@RequestParam(defaultValue = "true") boolean cache) {
        return ResponseEntity.ok(mcpClient.listTools(cache));
    }

    @PostMapping("/tools/sync")
    public ResponseEntity<Map<String, Object>> syncTools() {
        int count = toolBridge.sync();
        return ResponseEntity.ok(Map.of("status", "synced", "tools", count));
    }

    @PostMapping("/tools/{name}")
    public ResponseEntity<JsonNode> callTool(
            @PathVariable String name,
            @RequestBody(required = false) Map<String, Object> arguments) {
        return ResponseEntity.ok(mcpClient.callTool(name, arguments != null ? arguments : Map.of()));
    }

    @GetMapping("/agent-tools")
    public ResponseEntity<Map<String, String>> agentTools() {
        return ResponseEntity.ok(toolRegistry.listTools());
    }

    @PostMapping("/agent-tools/{name}")
    public ResponseEntity<ToolResult> executeAgentTool(
            @PathVariable String name,
            @RequestBody(required = false) Map<String, Object> parameters) {
        return toolRegistry.getTool(name)
                .map(tool -> {
                    ToolResult result = tool.execute(parameters != null ? parameters : Map.of());
                    log.debug("Agent tool result: {}", result.summary());
                    return ResponseEntity.ok(result);
                })
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/stats/reset")
    public ResponseEntity<Map<String, Object>> resetStats() {
        mcpClient.resetStats();
        return ResponseEntity.ok(Map.of("status", "reset", "totalRetries", mcpClient.getTotalRetries()));
    }
}
