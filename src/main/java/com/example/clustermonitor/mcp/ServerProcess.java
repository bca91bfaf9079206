package com.example.clustermonitor.mcp;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * A running MCP server child process and its three streams.
 *
 * <p>Stdout is pumped line by line into a queue by a daemon thread so reads can be
 * bounded by a deadline; stderr is pumped into the debug log. Owned by exactly one
 * {@link ProcessTransport} and released through {@link #terminate(Duration)}.
 */
@Slf4j
final class ServerProcess {

    private final Process process;
    private final Writer stdin;
    private final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
    private final Thread stdoutPump;
    private final Thread stderrPump;
    private volatile boolean outputClosed;

    private ServerProcess(Process process) {
        this.process = process;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        String name = "mcp-" + process.pid();
        this.stdoutPump = pump(name + "-stdout", process.getInputStream(), frames::add, () -> outputClosed = true);
        this.stderrPump = pump(name + "-stderr", process.getErrorStream(),
                line -> log.debug("[mcp-server stderr] {}", line), () -> { });
    }

    static ServerProcess start(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(false);
        return new ServerProcess(pb.start());
    }

    long pid() {
        return process.pid();
    }

    boolean isAlive() {
        return process.isAlive();
    }

    boolean isOutputClosed() {
        return outputClosed && frames.isEmpty();
    }

    void write(String frame) throws IOException {
        synchronized (stdin) {
            stdin.write(frame);
            stdin.flush();
        }
    }

    /**
     * Next buffered line, waiting at most {@code wait}; null if none arrived.
     */
    String poll(Duration wait) throws InterruptedException {
        return frames.poll(wait.toNanos(), TimeUnit.NANOSECONDS);
    }

    List<String> drain() {
        List<String> pending = new ArrayList<>();
        frames.drainTo(pending);
        return pending;
    }

    /**
     * Ask the process to stop, force it after {@code grace}, then release the streams.
     */
    void terminate(Duration grace) {
        try {
            stdin.close();
        } catch (IOException e) {
            log.debug("Closing MCP server stdin failed: {}", e.getMessage());
        }
        process.destroy();
        try {
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("MCP server (pid {}) did not stop within {}s, killing it", pid(), grace.toSeconds());
                process.destroyForcibly();
                process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        stdoutPump.interrupt();
        stderrPump.interrupt();
    }

    private static Thread pump(String name, InputStream in, Consumer<String> sink, Runnable onEnd) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.accept(line);
                }
            } catch (IOException e) {
                log.debug("{} closed: {}", name, e.getMessage());
            } finally {
                onEnd.run();
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
