package com.example.clustermonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cluster Monitor
 *
 * Talks to a locally spawned MCP cluster-monitoring server over line-delimited
 * JSON-RPC on its stdin/stdout.
 *
 * Architecture:
 * - MCP client → stdio transport, request/response exchange, tool cache
 * - Retry engine → exponential/linear/constant backoff with jitter
 * - Tool bridge → exposes the server's tools to the agent layer
 * - Cluster monitor → scheduled health/pod/deployment checks
 * - REST API → /api/cluster
 */
@SpringBootApplication
@EnableScheduling
public class ClusterMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClusterMonitorApplication.class, args);
    }
}
