package com.example.clustermonitor.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One blocking request/response round trip over a {@link FrameChannel}.
 *
 * <p>Only one request is outstanding at a time, so responses are matched by checking
 * that the id equals the id just sent; there is no correlation table. Replies to
 * earlier, timed-out requests are dropped whenever they turn up. Calls from
 * several threads are serialized. The exchange never retries on its own.
 */
@Slf4j
public class McpExchange {

    private final FrameChannel channel;
    private final McpMessageCodec codec;
    private final AtomicLong requestIds = new AtomicLong();

    public McpExchange(FrameChannel channel, McpMessageCodec codec) {
        this.channel = channel;
        this.codec = codec;
    }

    /**
     * Send {@code method} with {@code params} and wait up to {@code timeout} for the result.
     *
     * @return the {@code result} member of the response
     * @throws McpClientException NOT_CONNECTED, TIMEOUT, PROTOCOL or REMOTE
     */
    public synchronized JsonNode call(String method, Map<String, ?> params, Duration timeout) {
        if (!channel.isAlive()) {
            throw McpClientException.notConnected("Not connected to MCP server");
        }
        discardStaleFrames();

        long id = requestIds.incrementAndGet();
        String frame = codec.encode(method, params, id);
        log.debug("-> {}", frame.strip());
        channel.writeLine(frame);

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            Optional<String> line = remaining > 0 ? channel.readLine(Duration.ofNanos(remaining)) : Optional.empty();
            if (line.isEmpty()) {
                throw McpClientException.timeout(String.format(
                        "No response from MCP server within %d ms (method %s, id %d)", timeout.toMillis(), method, id));
            }
            log.debug("<- {}", line.get());

            McpResponse response;
            try {
                response = codec.decode(line.get());
            } catch (MalformedFrameException e) {
                throw McpClientException.protocol(e.getMessage(), e);
            }
            Long responseId = response.getId();
            // ids only grow, so a lower one answers a request whose caller already timed out
            if (responseId != null && responseId < id) {
                log.warn("Discarding late response id {} while waiting for id {} (method {})", responseId, id, method);
                continue;
            }
            if (responseId == null || responseId != id) {
                throw McpClientException.protocol(String.format(
                        "Response id %s does not match request id %d (method %s)", responseId, id, method));
            }
            if (response.isError()) {
                throw McpClientException.remote(response.getError());
            }
            return response.getResult();
        }
    }

    /**
     * The id the next request will carry.
     */
    public long peekNextId() {
        return requestIds.get() + 1;
    }

    private void discardStaleFrames() {
        List<String> stale = channel.drainPending();
        if (!stale.isEmpty()) {
            log.warn("Discarding {} stale frame(s) left by an earlier exchange", stale.size());
        }
    }
}
