package com.example.clustermonitor.agent;

import java.util.Map;

/**
 * Interface for all agent tools.
 * Every tool follows the same contract:
 * - name: Tool identifier
 * - description: LLM guidance for when/how to use the tool
 * - parameters: JSON schema for tool parameters
 * - execute: Execution returning a result
 */
public interface AgentTool {

    /**
     * Unique tool name (e.g., "list_pods", "get_cluster_health").
     */
    String getName();

    /**
     * Human-readable description for the LLM.
     */
    String getDescription();

    /**
     * Category of this tool (cluster, diagnostics, etc.)
     */
    String getCategory();

    /**
     * JSON Schema describing the parameters this tool accepts.
     */
    Map<String, Object> getParameterSchema();

    /**
     * Execute the tool with the given parameters.
     *
     * @param parameters The tool parameters as a map
     * @return Tool execution result; failures are reported in the result, not thrown
     */
    ToolResult execute(Map<String, Object> parameters);
}
