package com.example.clustermonitor.mcp;

import lombok.Getter;

/**
 * Failure of an exchange with the MCP server. The {@link Kind} is a closed set;
 * {@link McpFailureClassifier} decides which kinds are worth retrying.
 */
@Getter
public class McpClientException extends RuntimeException {

    public enum Kind {
        /** The server process is not running, or was never started. */
        NOT_CONNECTED,
        /** No response frame arrived before the deadline. */
        TIMEOUT,
        /** A malformed frame, a frame without result or error, or a mismatched id. */
        PROTOCOL,
        /** A well-formed error envelope sent by the server. */
        REMOTE
    }

    private final Kind kind;
    private final Integer remoteCode;
    private final Object remoteData;

    private McpClientException(Kind kind, String message, Integer remoteCode, Object remoteData, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.remoteCode = remoteCode;
        this.remoteData = remoteData;
    }

    public static McpClientException notConnected(String message) {
        return new McpClientException(Kind.NOT_CONNECTED, message, null, null, null);
    }

    public static McpClientException notConnected(String message, Throwable cause) {
        return new McpClientException(Kind.NOT_CONNECTED, message, null, null, cause);
    }

    public static McpClientException timeout(String message) {
        return new McpClientException(Kind.TIMEOUT, message, null, null, null);
    }

    public static McpClientException protocol(String message) {
        return new McpClientException(Kind.PROTOCOL, message, null, null, null);
    }

    public static McpClientException protocol(String message, Throwable cause) {
        return new McpClientException(Kind.PROTOCOL, message, null, null, cause);
    }

    public static McpClientException remote(McpError error) {
        return new McpClientException(Kind.REMOTE,
                "Server error " + error.getCode() + ": " + error.getMessage(),
                error.getCode(), error.getData(), null);
    }
}
