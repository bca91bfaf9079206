package com.example.clustermonitor.mcp;

import com.example.clustermonitor.retry.RetryEngine;
import com.example.clustermonitor.retry.RetryExhaustedException;
import com.example.clustermonitor.retry.RetryPolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the MCP cluster-monitoring server.
 *
 * <p>Every call is a single JSON-RPC round trip over the server's stdio, wrapped in the
 * configured {@link RetryPolicy}. Timeouts and transient server errors are retried;
 * protocol violations and a dead process fail fast. Starting the process is never
 * retried.
 *
 * <p>The client owns its transport, exchange, tool cache and retry counter.
 */
@Slf4j
public class McpClient implements AutoCloseable {

    private static final TypeReference<List<McpTool>> TOOL_LIST = new TypeReference<>() {
    };

    private final McpClientSettings settings;
    private final ObjectMapper objectMapper;
    private final ProcessTransport transport;
    private final McpExchange exchange;
    private final CapabilityCache<List<McpTool>> toolsCache;
    private final RetryEngine retryEngine;
    private final RetryPolicy retryPolicy;

    public McpClient(McpClientSettings settings, ObjectMapper objectMapper) {
        this(settings, objectMapper, new RetryEngine());
    }

    public McpClient(McpClientSettings settings, ObjectMapper objectMapper, RetryEngine retryEngine) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.transport = new ProcessTransport(settings.getPollInterval(), settings.getShutdownGrace());
        this.exchange = new McpExchange(transport, new McpMessageCodec(objectMapper));
        this.toolsCache = new CapabilityCache<>(settings.getToolsCacheTtl());
        this.retryEngine = retryEngine;
        this.retryPolicy = classified(settings.getRetryPolicy(), settings.getFailureClassifier());
    }

    // ── Connection lifecycle ──

    /**
     * Start the MCP server process.
     *
     * @throws McpClientException of kind NOT_CONNECTED if the process cannot be spawned
     */
    public void connect() {
        transport.connect(settings.getCommand());
        toolsCache.invalidate();
    }

    public void disconnect() {
        transport.disconnect();
        toolsCache.invalidate();
    }

    /**
     * Start the server process unless one is already running.
     *
     * @return true if this call started it
     */
    public boolean ensureConnected() {
        boolean started = transport.connectIfDisconnected(settings.getCommand());
        if (started) {
            toolsCache.invalidate();
        }
        return started;
    }

    public boolean isConnected() {
        return transport.isAlive();
    }

    @Override
    public void close() {
        disconnect();
    }

    // ── Generic calls ──

    /**
     * Call an arbitrary method on the server.
     *
     * @return the response's {@code result} member
     * @throws McpClientException      a non-retryable failure
     * @throws RetryExhaustedException every attempt failed with a retryable failure
     */
    public JsonNode invoke(String method, Map<String, ?> params) {
        return invoke(method, params, settings.getTimeout());
    }

    /**
     * Same as {@link #invoke(String, Map)} with a per-call response timeout.
     */
    public JsonNode invoke(String method, Map<String, ?> params, Duration timeout) {
        return retryEngine.call(() -> exchange.call(method, params, timeout), retryPolicy);
    }

    /**
     * Tools offered by the server, served from a cache younger than the configured TTL
     * unless {@code useCache} is false.
     */
    public List<McpTool> listTools(boolean useCache) {
        if (!useCache) {
            return toolsCache.refresh(this::fetchTools);
        }
        return toolsCache.getOrRefresh(this::fetchTools);
    }

    public List<McpTool> listTools() {
        return listTools(true);
    }

    public JsonNode callTool(String toolName, Map<String, ?> arguments) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", toolName);
        params.put("arguments", arguments != null ? arguments : Map.of());
        return invoke("tools/call", params);
    }

    // ── Cluster operations ──

    public JsonNode getClusterHealth() {
        return callTool("get_cluster_health", Map.of());
    }

    public JsonNode listPods(String namespace, String labelSelector) {
        Map<String, Object> args = new LinkedHashMap<>();
        putIfPresent(args, "namespace", namespace);
        putIfPresent(args, "label_selector", labelSelector);
        return callTool("list_pods", args);
    }

    public JsonNode getPodLogs(String podName, String namespace, int lines) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("pod_name", podName);
        args.put("namespace", namespace);
        args.put("lines", lines);
        return callTool("get_pod_logs", args);
    }

    public JsonNode getPodLogs(String podName, String namespace) {
        return getPodLogs(podName, namespace, 50);
    }

    public JsonNode listDeployments(String namespace) {
        Map<String, Object> args = new LinkedHashMap<>();
        putIfPresent(args, "namespace", namespace);
        return callTool("list_deployments", args);
    }

    public JsonNode listNodes() {
        return callTool("list_nodes", Map.of());
    }

    public JsonNode listNamespaces() {
        return callTool("list_namespaces", Map.of());
    }

    // ── Statistics ──

    public long getTotalRetries() {
        return retryEngine.getTotalRetries();
    }

    public void resetStats() {
        retryEngine.resetStats();
    }

    public McpClientSettings getSettings() {
        return settings;
    }

    private List<McpTool> fetchTools() {
        JsonNode result = invoke("tools/list", Map.of());
        JsonNode tools = result != null ? result.path("tools") : null;
        if (tools == null || !tools.isArray()) {
            return List.of();
        }
        List<McpTool> parsed = List.copyOf(objectMapper.convertValue(tools, TOOL_LIST));
        log.debug("MCP server advertises {} tools", parsed.size());
        return parsed;
    }

    private static RetryPolicy classified(RetryPolicy policy, McpFailureClassifier classifier) {
        return policy.toBuilder()
                .retryOn(classifier.and(policy::isRetryable))
                .build();
    }

    private static void putIfPresent(Map<String, Object> args, String key, String value) {
        if (value != null && !value.isBlank()) {
            args.put(key, value);
        }
    }
}
