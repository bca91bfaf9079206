package com.example.clustermonitor.mcp;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Owns the lifetime of one MCP server child process and frames its stdin/stdout.
 *
 * <p>At most one live process per transport. {@link #disconnect()} is the single
 * release point: it terminates the process (gracefully, then forcibly after the grace
 * period) and is safe to call repeatedly. A read that times out leaves the process
 * running.
 */
@Slf4j
public class ProcessTransport implements FrameChannel, AutoCloseable {

    private final Duration pollInterval;
    private final Duration shutdownGrace;
    private volatile ServerProcess process;

    public ProcessTransport(Duration pollInterval, Duration shutdownGrace) {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.pollInterval = pollInterval;
        this.shutdownGrace = shutdownGrace;
    }

    /**
     * Spawn the server process.
     *
     * @throws IllegalStateException if a live process is already attached
     * @throws McpClientException    of kind NOT_CONNECTED if the process cannot be started
     */
    public synchronized void connect(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("MCP server command must not be empty");
        }
        if (process != null) {
            if (process.isAlive()) {
                throw new IllegalStateException("Already connected to MCP server (pid " + process.pid() + ")");
            }
            release();
        }
        try {
            process = ServerProcess.start(command);
            log.info("Connected to MCP server: {} (pid {})", String.join(" ", command), process.pid());
        } catch (IOException e) {
            throw McpClientException.notConnected("Failed to connect to MCP server: " + e.getMessage(), e);
        }
    }

    /**
     * Spawn the server process unless a live one is already attached.
     *
     * @return true if a process was started
     */
    public synchronized boolean connectIfDisconnected(List<String> command) {
        if (isAlive()) {
            return false;
        }
        connect(command);
        return true;
    }

    @Override
    public boolean isAlive() {
        ServerProcess current = process;
        return current != null && current.isAlive();
    }

    public synchronized void disconnect() {
        if (process == null) {
            return;
        }
        release();
        log.info("Disconnected from MCP server");
    }

    @Override
    public void close() {
        disconnect();
    }

    @Override
    public void writeLine(String frame) {
        ServerProcess current = requireAlive();
        try {
            current.write(frame.endsWith("\n") ? frame : frame + "\n");
        } catch (IOException e) {
            throw McpClientException.notConnected("Failed to write to MCP server: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> readLine(Duration timeout) {
        ServerProcess current = requireAlive();
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return Optional.empty();
                }
                Duration wait = Duration.ofNanos(Math.min(remaining, pollInterval.toNanos()));
                String line = current.poll(wait);
                if (line != null) {
                    return Optional.of(line);
                }
                if (current.isOutputClosed()) {
                    throw McpClientException.notConnected("MCP server closed its output stream");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public List<String> drainPending() {
        ServerProcess current = process;
        return current != null ? current.drain() : List.of();
    }

    private ServerProcess requireAlive() {
        ServerProcess current = process;
        if (current == null || !current.isAlive()) {
            throw McpClientException.notConnected("Not connected to MCP server");
        }
        return current;
    }

    private void release() {
        ServerProcess current = process;
        process = null;
        current.terminate(shutdownGrace);
    }
}
