package com.example.clustermonitor.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outcome of one agent tool invocation.
 * A successful call carries the server's JSON result; a failed one carries the failure
 * message and a structured report of the step that failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResult {

    private String toolName;
    private boolean success;
    private JsonNode data;
    private String error;
    private Map<String, Object> failure;
    private long durationMs;

    public static ToolResult ok(String toolName, JsonNode data, long durationMs) {
        return ToolResult.builder()
                .toolName(toolName)
                .success(true)
                .data(data)
                .durationMs(durationMs)
                .build();
    }

    public static ToolResult failed(String toolName, String error, Map<String, Object> failure, long durationMs) {
        return ToolResult.builder()
                .toolName(toolName)
                .success(false)
                .error(error)
                .failure(failure)
                .durationMs(durationMs)
                .build();
    }

    /**
     * Text form for logs and chat transcripts.
     */
    public String summary() {
        if (success) {
            return toolName + ": " + (data != null ? data.toString() : "null");
        }
        return toolName + ": Error: " + error;
    }
}
