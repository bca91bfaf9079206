package com.example.clustermonitor.monitoring;

import com.example.clustermonitor.agent.FailureReport;
import com.example.clustermonitor.config.MonitorProperties;
import com.example.clustermonitor.mcp.McpClient;
import com.example.clustermonitor.mcp.McpClientException;
import com.example.clustermonitor.retry.RetryExhaustedException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically polls cluster health, pods and deployments through the MCP server and
 * warns when the health state changes between checks.
 * A failed check is logged; the schedule keeps running.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClusterHealthMonitor {

    private final McpClient mcpClient;
    private final MonitorProperties properties;

    private final AtomicLong iterations = new AtomicLong();
    private volatile HealthState lastState;
    private volatile Instant lastCheckAt;

    @Scheduled(fixedDelayString = "#{${cluster-monitor.monitoring.interval-seconds:30} * 1000}")
    public void scheduledCheck() {
        if (!properties.getMonitoring().isEnabled()) {
            return;
        }
        if (!mcpClient.isConnected()) {
            log.debug("Skipping cluster check, MCP server not connected");
            return;
        }
        runCheck();
    }

    /**
     * Run one check of health, pods and deployments.
     */
    public void runCheck() {
        long iteration = iterations.incrementAndGet();
        String namespace = properties.getMonitoring().getNamespace();
        log.info("[{}] Checking cluster (namespace: {})", iteration,
                namespace == null || namespace.isBlank() ? "all" : namespace);

        checkHealth();
        checkPods(namespace);
        checkDeployments(namespace);
        lastCheckAt = Instant.now();
    }

    void checkHealth() {
        try {
            JsonNode health = mcpClient.getClusterHealth();
            HealthState current = new HealthState(
                    health.path("status").asText("unknown"),
                    health.path("nodes_ready").asInt(0),
                    health.path("pods_failed").asInt(0));

            if (lastState != null && !lastState.equals(current)) {
                log.warn("Cluster state changed: {} -> {}", lastState, current);
            }
            lastState = current;

            log.info("  Health: {} | Nodes: {}/{} | Pods: {} running, {} failed",
                    current.status(), current.nodesReady(), health.path("nodes_count").asInt(0),
                    health.path("pods_running").asInt(0), current.podsFailed());
        } catch (McpClientException | RetryExhaustedException e) {
            log.error(FailureReport.describe("Cluster health check", e));
        }
    }

    void checkPods(String namespace) {
        try {
            JsonNode pods = mcpClient.listPods(namespace, null);
            if (!pods.isArray() || pods.isEmpty()) {
                log.info("  Pods: none found");
                return;
            }
            int running = 0;
            int pending = 0;
            int failed = 0;
            for (JsonNode pod : pods) {
                switch (pod.path("status").asText("")) {
                    case "Running" -> running++;
                    case "Pending" -> pending++;
                    case "Failed" -> {
                        failed++;
                        if (failed <= 5) {
                            log.error("    Failed pod: {} in {}",
                                    pod.path("name").asText(), pod.path("namespace").asText());
                        }
                    }
                    default -> { }
                }
            }
            int other = pods.size() - running - pending - failed;
            log.info("  Pods: {} running, {} pending, {} failed, {} other", running, pending, failed, other);
        } catch (McpClientException | RetryExhaustedException e) {
            log.error(FailureReport.describe("Pod check", e));
        }
    }

    void checkDeployments(String namespace) {
        try {
            JsonNode deployments = mcpClient.listDeployments(namespace);
            if (!deployments.isArray() || deployments.isEmpty()) {
                log.info("  Deployments: none found");
                return;
            }
            int ready = 0;
            for (JsonNode deployment : deployments) {
                int replicas = deployment.path("replicas").asInt(0);
                if (replicas == deployment.path("ready_replicas").asInt(-1)) {
                    ready++;
                }
            }
            log.info("  Deployments: {}/{} ready", ready, deployments.size());
        } catch (McpClientException | RetryExhaustedException e) {
            log.error(FailureReport.describe("Deployment check", e));
        }
    }

    public HealthState getLastState() {
        return lastState;
    }

    public Instant getLastCheckAt() {
        return lastCheckAt;
    }

    public long getIterations() {
        return iterations.get();
    }

    public record HealthState(String status, int nodesReady, int podsFailed) {}
}
