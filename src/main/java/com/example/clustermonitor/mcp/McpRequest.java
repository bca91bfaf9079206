package com.example.clustermonitor.mcp;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-RPC 2.0 request sent to the MCP server.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"jsonrpc", "method", "params", "id"})
public class McpRequest {

    public static final String PROTOCOL_VERSION = "2.0";

    @Builder.Default
    private String jsonrpc = PROTOCOL_VERSION;
    private String method;
    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();
    private long id;

    public static McpRequest of(String method, Map<String, ?> params, long id) {
        return McpRequest.builder()
                .method(method)
                .params(params != null ? new LinkedHashMap<>(params) : new LinkedHashMap<>())
                .id(id)
                .build();
    }
}
