package com.example.clustermonitor.mcp;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Frame channel backed by queues. A responder, when set, turns each written frame
 * into zero or more response frames.
 */
class InMemoryFrameChannel implements FrameChannel {

    private final BlockingQueue<String> inbound = new LinkedBlockingQueue<>();
    final List<String> written = new ArrayList<>();
    private Function<String, List<String>> responder = frame -> List.of();
    private boolean alive = true;

    void respondWith(Function<String, List<String>> responder) {
        this.responder = responder;
    }

    void offer(String frame) {
        inbound.add(frame);
    }

    void kill() {
        alive = false;
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public void writeLine(String frame) {
        if (!alive) {
            throw McpClientException.notConnected("Not connected to MCP server");
        }
        written.add(frame);
        inbound.addAll(responder.apply(frame));
    }

    @Override
    public Optional<String> readLine(Duration timeout) {
        if (!alive) {
            throw McpClientException.notConnected("Not connected to MCP server");
        }
        try {
            return Optional.ofNullable(inbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public List<String> drainPending() {
        List<String> pending = new ArrayList<>();
        inbound.drainTo(pending);
        return pending;
    }
}
