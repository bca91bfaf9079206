package com.example.clustermonitor.mcp;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A bidirectional line-oriented channel carrying one frame per line.
 */
public interface FrameChannel {

    boolean isAlive();

    /**
     * Write one newline-terminated frame and flush it.
     *
     * @throws McpClientException of kind NOT_CONNECTED if the channel is not alive or the write fails
     */
    void writeLine(String frame);

    /**
     * Wait up to {@code timeout} for the next complete frame.
     *
     * @return the frame without its line terminator, or empty if the deadline passed
     * @throws McpClientException of kind NOT_CONNECTED if the channel is not alive
     */
    Optional<String> readLine(Duration timeout);

    /**
     * Remove and return frames that are already buffered but were never read.
     */
    List<String> drainPending();
}
