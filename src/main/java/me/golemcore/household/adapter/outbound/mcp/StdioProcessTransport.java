/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.household.adapter.outbound.mcp;

import me.golemcore.household.domain.exception.ReadTimeoutException;
import me.golemcore.household.domain.exception.SpawnException;
import me.golemcore.household.domain.exception.TransportException;
import me.golemcore.household.domain.exception.UnexpectedExitException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link McpTransport} over a local subprocess.
 *
 * <p>
 * A reader thread moves stdout lines into a queue so that
 * {@link #readLine(Duration)} can honour a timeout. A second thread drains
 * stderr to the DEBUG log and keeps the last lines for exit diagnostics.
 */
@Slf4j
public class StdioProcessTransport implements McpTransport {

    private static final int STDERR_TAIL_LINES = 20;
    private static final long STDERR_DRAIN_WAIT_MS = 200;

    private final String serverId;
    private final BlockingQueue<Line> lines = new LinkedBlockingQueue<>();
    private final Deque<String> stderrTail = new ArrayDeque<>();
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    private Process process;
    private BufferedWriter writer;
    private Thread readerThread;
    private Thread stderrThread;
    private volatile boolean eofReached;

    public StdioProcessTransport(String serverId) {
        this.serverId = serverId;
    }

    private record Line(String text, boolean eof) {
    }

    @Override
    public void start(List<String> command, Path workingDirectory, Map<String, String> env) throws SpawnException {
        if (process != null) {
            throw new IllegalStateException("Transport already started for " + serverId);
        }
        if (command == null || command.isEmpty() || command.get(0).isBlank()) {
            throw new SpawnException(serverId, "Tool server command is empty");
        }
        if (workingDirectory != null && !Files.isDirectory(workingDirectory)) {
            throw new SpawnException(serverId, "Working directory does not exist: " + workingDirectory);
        }

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(false);
        if (workingDirectory != null) {
            pb.directory(workingDirectory.toFile());
        }
        if (env != null) {
            pb.environment().putAll(env);
        }

        try {
            process = pb.start();
        } catch (IOException e) {
            throw new SpawnException(serverId, "Cannot execute '" + command.get(0) + "': " + e.getMessage(), e);
        }
        log.debug("[MCP:{}] Spawned pid {}: {}", serverId, process.pid(), command);

        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        readerThread = new Thread(this::readLoop, "mcp-reader-" + serverId);
        readerThread.setDaemon(true);
        readerThread.start();

        stderrThread = new Thread(this::stderrDrain, "mcp-stderr-" + serverId);
        stderrThread.setDaemon(true);
        stderrThread.start();
    }

    @Override
    public void writeLine(String text) throws TransportException {
        if (process == null) {
            throw new TransportException(serverId, "Transport not started");
        }
        if (!process.isAlive()) {
            throw new TransportException(serverId, "Process has exited (code " + process.exitValue() + ")");
        }
        try {
            synchronized (writer) {
                writer.write(text);
                writer.newLine();
                writer.flush();
            }
        } catch (IOException e) {
            throw new TransportException(serverId, "Failed to write to stdin: " + e.getMessage(), e);
        }
    }

    @Override
    public String readLine(Duration timeout) throws TransportException, UnexpectedExitException {
        if (process == null) {
            throw new TransportException(serverId, "Transport not started");
        }
        if (eofReached) {
            throw unexpectedExit();
        }
        Line line;
        try {
            line = lines.poll(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(serverId, "Interrupted while waiting for output", e);
        }
        if (line == null) {
            throw new ReadTimeoutException(serverId, timeout);
        }
        if (line.eof()) {
            eofReached = true;
            throw unexpectedExit();
        }
        return line.text();
    }

    private UnexpectedExitException unexpectedExit() {
        // Best effort: give the stderr drain a moment to catch the last words.
        Integer exitCode = null;
        try {
            if (stderrThread != null) {
                stderrThread.join(STDERR_DRAIN_WAIT_MS);
            }
            if (process.waitFor(STDERR_DRAIN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                exitCode = process.exitValue();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return new UnexpectedExitException(serverId, exitCode, getStderrTail());
    }

    @Override
    public void terminate(Duration graceTimeout) {
        if (process == null || !terminated.compareAndSet(false, true)) {
            return;
        }
        log.debug("[MCP:{}] Terminating pid {}", serverId, process.pid());

        // Closing stdin is the polite way to ask a stdio server to exit
        try {
            synchronized (writer) {
                writer.close();
            }
        } catch (IOException e) {
            log.debug("[MCP:{}] Error closing stdin: {}", serverId, e.getMessage());
        }

        if (process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(graceTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("[MCP:{}] Process did not exit within {}ms, killing", serverId, graceTimeout.toMillis());
                    process.destroyForcibly();
                    process.waitFor(graceTimeout.toMillis(), TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    @Override
    public boolean isAlive() {
        return process != null && process.isAlive();
    }

    public String getStderrTail() {
        synchronized (stderrTail) {
            return String.join("\n", stderrTail);
        }
    }

    long pid() {
        return process != null ? process.pid() : -1;
    }

    private void readLoop() {
        Process p = this.process;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(new Line(line, false));
            }
        } catch (IOException e) {
            if (!terminated.get()) {
                log.warn("[MCP:{}] Reader thread error: {}", serverId, e.getMessage());
            }
        } finally {
            lines.add(new Line(null, true));
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", serverId, line);
                synchronized (stderrTail) {
                    if (stderrTail.size() == STDERR_TAIL_LINES) {
                        stderrTail.removeFirst();
                    }
                    stderrTail.addLast(line);
                }
            }
        } catch (IOException e) {
            if (!terminated.get()) {
                log.debug("[MCP:{}] Stderr drain ended: {}", serverId, e.getMessage());
            }
        }
    }
}
