package com.example.clustermonitor.agent;

import com.example.clustermonitor.mcp.McpClientException;
import com.example.clustermonitor.retry.RetryExhaustedException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns client failures into messages naming the failed step and its last cause.
 */
public final class FailureReport {

    private FailureReport() {
    }

    public static String describe(String step, Throwable failure) {
        if (failure instanceof RetryExhaustedException exhausted) {
            return String.format("%s failed after %d attempts. Last cause: %s",
                    step, exhausted.getAttemptsMade(), cause(exhausted.getCause()));
        }
        return String.format("%s failed. Cause: %s", step, cause(failure));
    }

    public static Map<String, Object> details(String step, Throwable failure) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("step", step);
        Throwable last = failure;
        if (failure instanceof RetryExhaustedException exhausted) {
            details.put("attempts", exhausted.getAttemptsMade());
            details.put("retriesExhausted", true);
            last = exhausted.getCause();
        }
        if (last instanceof McpClientException mcp) {
            details.put("kind", mcp.getKind().name());
            if (mcp.getRemoteCode() != null) {
                details.put("remoteCode", mcp.getRemoteCode());
            }
        }
        details.put("message", last != null ? last.getMessage() : null);
        return details;
    }

    private static String cause(Throwable failure) {
        if (failure == null) {
            return "unknown";
        }
        if (failure instanceof McpClientException mcp) {
            return mcp.getKind() + " - " + mcp.getMessage();
        }
        return failure.getClass().getSimpleName() + " - " + failure.getMessage();
    }
}
