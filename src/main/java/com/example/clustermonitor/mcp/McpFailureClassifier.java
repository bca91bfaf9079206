package com.example.clustermonitor.mcp;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Decides which failures are worth retrying.
 *
 * <ul>
 *   <li>TIMEOUT: retryable</li>
 *   <li>REMOTE: retryable iff the server's error code is in the transient set</li>
 *   <li>PROTOCOL, NOT_CONNECTED: never (a corrupted channel or a dead process will not heal)</li>
 *   <li>anything else: never</li>
 * </ul>
 */
public class McpFailureClassifier implements Predicate<Throwable> {

    /** Server busy and internal error. */
    public static final Set<Integer> DEFAULT_TRANSIENT_CODES = Set.of(-32000, -32603);

    private final Set<Integer> transientCodes;

    public static McpFailureClassifier withDefaultCodes() {
        return new McpFailureClassifier(DEFAULT_TRANSIENT_CODES);
    }

    public McpFailureClassifier(Set<Integer> transientCodes) {
        this.transientCodes = Set.copyOf(transientCodes);
    }

    @Override
    public boolean test(Throwable failure) {
        if (!(failure instanceof McpClientException mcpFailure)) {
            return false;
        }
        return switch (mcpFailure.getKind()) {
            case TIMEOUT -> true;
            case REMOTE -> mcpFailure.getRemoteCode() != null && transientCodes.contains(mcpFailure.getRemoteCode());
            case PROTOCOL, NOT_CONNECTED -> false;
        };
    }

    public Set<Integer> getTransientCodes() {
        return transientCodes;
    }
}
