package com.example.clustermonitor.mcp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool advertised by the MCP server through {@code tools/list}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class McpTool {
    private String name;
    private String description;
    @Builder.Default
    private Map<String, Object> inputSchema = new LinkedHashMap<>();
}
