package com.example.clustermonitor.mcp;

import lombok.Getter;

/**
 * A response frame that cannot be turned into an {@link McpResponse}.
 */
@Getter
public class MalformedFrameException extends RuntimeException {

    public enum Reason {
        EMPTY,
        UNPARSEABLE,
        MISSING_RESULT_AND_ERROR,
        BOTH_RESULT_AND_ERROR
    }

    private final Reason reason;

    public MalformedFrameException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public MalformedFrameException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
