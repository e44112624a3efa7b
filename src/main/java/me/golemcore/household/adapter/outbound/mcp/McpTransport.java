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

import me.golemcore.household.domain.exception.SpawnException;
import me.golemcore.household.domain.exception.TransportException;
import me.golemcore.household.domain.exception.UnexpectedExitException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Owns one child process and its three standard pipes.
 *
 * <p>
 * Line-oriented: every message is one line on stdin or stdout. Implementations
 * are single-use; after {@link #terminate(Duration)} a new instance is needed.
 *
 * @see StdioProcessTransport
 */
public interface McpTransport {

    /**
     * Launches the process. Returns once it is running; never waits for output.
     *
     * @throws SpawnException
     *             if the command is empty, the working directory does not exist,
     *             or the binary cannot be executed
     */
    void start(List<String> command, Path workingDirectory, Map<String, String> env) throws SpawnException;

    /**
     * Writes {@code text} followed by a newline and flushes.
     */
    void writeLine(String text) throws TransportException;

    /**
     * Blocks until one line is available.
     *
     * @throws UnexpectedExitException
     *             on EOF, with whatever stderr the process left behind
     * @throws me.golemcore.household.domain.exception.ReadTimeoutException
     *             if nothing arrives within {@code timeout}
     */
    String readLine(Duration timeout) throws TransportException, UnexpectedExitException;

    /**
     * Asks the process to stop, waits up to {@code graceTimeout}, then kills it.
     * Safe to call any number of times.
     */
    void terminate(Duration graceTimeout);

    boolean isAlive();
}
