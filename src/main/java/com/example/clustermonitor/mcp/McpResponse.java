package com.example.clustermonitor.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Decoded response envelope. Exactly one of {@code result} and {@code error} is set.
 * {@code id} is null when the server sent no usable id.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class McpResponse {

    private final Long id;
    private final JsonNode result;
    private final McpError error;

    public static McpResponse success(Long id, JsonNode result) {
        return new McpResponse(id, result, null);
    }

    public static McpResponse error(Long id, McpError error) {
        return new McpResponse(id, null, error);
    }

    public boolean isError() {
        return error != null;
    }
}
