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

import me.golemcore.household.domain.exception.HandshakeException;
import me.golemcore.household.domain.exception.ProtocolException;
import me.golemcore.household.domain.exception.ReadTimeoutException;
import me.golemcore.household.domain.exception.SpawnException;
import me.golemcore.household.domain.exception.ToolServerStartException;
import me.golemcore.household.domain.exception.TransportException;
import me.golemcore.household.domain.exception.UnexpectedExitException;
import me.golemcore.household.domain.model.ToolCallResult;
import me.golemcore.household.domain.model.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * JSON-RPC 2.0 client for a single tool server over stdio.
 *
 * <p>
 * This client manages the lifecycle of a tool server process:
 * <ol>
 * <li>Start the process through an {@link McpTransport}
 * <li>Send {@code initialize}, falling back through the configured protocol
 * versions until one is accepted
 * <li>Send the {@code notifications/initialized} notification
 * <li>Call tools ({@code tools/call}) and list them ({@code tools/list})
 * <li>Stop the process
 * </ol>
 *
 * <p>
 * Exactly one request is in flight at a time; a fair lock serializes callers.
 * Responses are matched by id only. Non-JSON lines, server notifications, server
 * requests and responses carrying another id are logged and discarded.
 *
 * <p>
 * Not a Spring bean, created per server by {@link McpClientFactory}.
 *
 * @see McpSessionScope
 */
public class McpClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final String JSONRPC_VERSION = "2.0";
    private static final String CLIENT_NAME = "household-assistant";
    private static final String CLIENT_VERSION = "1.0.0";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String serverId;
    private final McpServerLaunch launch;
    private final McpClientSettings settings;
    private final ObjectMapper objectMapper;
    private final Function<String, McpTransport> transportFactory;
    private final McpResultParser resultParser;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final AtomicInteger nextId = new AtomicInteger(1);

    private volatile McpClientState state = McpClientState.UNINITIALIZED;
    private McpTransport transport;
    private volatile String negotiatedProtocolVersion;
    private volatile String startupError;

    public McpClient(String serverId, McpServerLaunch launch, McpClientSettings settings,
            ObjectMapper objectMapper, Function<String, McpTransport> transportFactory) {
        this.serverId = serverId;
        this.launch = launch;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.transportFactory = transportFactory;
        this.resultParser = new McpResultParser(objectMapper);
    }

    /**
     * Spawns the process and runs the handshake. A no-op when already
     * {@code READY}.
     *
     * @throws SpawnException
     *             if the process cannot be launched
     * @throws HandshakeException
     *             if every offered protocol version is rejected or the process
     *             dies during the handshake
     * @throws IllegalStateException
     *             if the client is {@code FAILED}; call {@link #stop()} first
     */
    public void start() throws ToolServerStartException {
        lock.lock();
        try {
            if (state == McpClientState.READY) {
                return;
            }
            if (state == McpClientState.FAILED) {
                throw new IllegalStateException("Tool server '" + serverId + "' failed earlier ("
                        + startupError + "); stop() it before starting again");
            }

            state = McpClientState.INITIALIZING;
            startupError = null;
            negotiatedProtocolVersion = null;
            log.info("[MCP:{}] Starting server: {}", serverId, launch.command());

            transport = transportFactory.apply(serverId);
            try {
                transport.start(launch.command(), launch.workingDirectory(), launch.env());
            } catch (SpawnException e) {
                log.error("[MCP:{}] Spawn failed: {}", serverId, e.getMessage());
                markFailed(e.getMessage());
                throw e;
            }

            handshake();
            state = McpClientState.READY;
        } finally {
            lock.unlock();
        }
    }

    private void handshake() throws HandshakeException {
        List<String> attempted = new ArrayList<>();
        for (String version : settings.protocolVersions()) {
            attempted.add(version);
            try {
                JsonNode result = exchange("initialize", initializeParams(version), settings.startupTimeout());
                negotiatedProtocolVersion = version;
                log.info("[MCP:{}] Initialized with protocol {}: {}", serverId, version, result.path("serverInfo"));
                sendNotification("notifications/initialized");
                return;
            } catch (ProtocolException e) {
                log.info("[MCP:{}] Protocol version {} rejected: {}", serverId, version, e.getMessage());
            } catch (UnexpectedExitException | TransportException e) {
                log.error("[MCP:{}] Initialization failed, cleaning up: {}", serverId, e.getMessage());
                markFailed(e.getMessage());
                throw new HandshakeException(serverId, "Tool server '" + serverId + "' failed during initialize: "
                        + e.getMessage(), attempted, e);
            }
        }

        String message = "Tool server '" + serverId + "' rejected every protocol version " + attempted;
        log.error("[MCP:{}] {}", serverId, message);
        markFailed(message);
        throw new HandshakeException(serverId, message, attempted);
    }

    private Map<String, Object> initializeParams(String protocolVersion) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("protocolVersion", protocolVersion);
        params.put("capabilities", Map.of());
        params.put("clientInfo", Map.of("name", CLIENT_NAME, "version", CLIENT_VERSION));
        return params;
    }

    /**
     * Calls a tool and waits for the matching response.
     *
     * <p>
     * A result flagged {@code isError} comes back as a failed
     * {@link ToolCallResult}; the client stays usable. A JSON-RPC error throws
     * {@link ProtocolException}; the client stays usable too. Exit, pipe
     * failure and timeout mark the client {@code FAILED}.
     *
     * @throws IllegalStateException
     *             if the client is not {@code READY}
     */
    public ToolCallResult callTool(String toolName, Map<String, Object> arguments)
            throws ProtocolException, TransportException, UnexpectedExitException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", toolName);
        params.put("arguments", arguments != null ? arguments : Map.of());

        JsonNode result = request("tools/call", params, settings.requestTimeout());
        return resultParser.parse(toolName, result);
    }

    /**
     * Lists the tools the server advertises.
     */
    public List<ToolDefinition> listTools() throws ProtocolException, TransportException, UnexpectedExitException {
        JsonNode result = request("tools/list", Map.of(), settings.requestTimeout());
        return parseToolDefinitions(result);
    }

    private JsonNode request(String method, Map<String, Object> params, Duration timeout)
            throws ProtocolException, TransportException, UnexpectedExitException {
        lock.lock();
        try {
            if (state != McpClientState.READY) {
                throw new IllegalStateException("Tool server '" + serverId + "' is not ready (state " + state + ")");
            }
            try {
                return exchange(method, params, timeout);
            } catch (UnexpectedExitException | TransportException e) {
                log.warn("[MCP:{}] {} failed, marking client failed: {}", serverId, method, e.getMessage());
                markFailed(e.getMessage());
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes one request and reads lines until the response with the same id
     * arrives. The deadline covers every discarded line too.
     */
    private JsonNode exchange(String method, Map<String, Object> params, Duration timeout)
            throws ProtocolException, TransportException, UnexpectedExitException {
        int id = nextId.getAndIncrement();

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        String json = toJson(request);
        log.debug("[MCP:{}] → {}", serverId, json);
        transport.writeLine(json);

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new ReadTimeoutException(serverId, timeout);
            }
            String line;
            try {
                line = transport.readLine(Duration.ofNanos(remaining));
            } catch (ReadTimeoutException e) {
                throw new ReadTimeoutException(serverId, timeout);
            }

            JsonNode message = parseLine(line);
            if (message == null) {
                continue;
            }
            if (message.has("method")) {
                log.debug("[MCP:{}] Ignoring server message: {}", serverId, message.get("method").asText());
                continue;
            }
            JsonNode idNode = message.get("id");
            if (idNode == null || !idNode.isIntegralNumber() || idNode.asLong() != id) {
                log.debug("[MCP:{}] Discarding response for id {} while waiting for {}", serverId, idNode, id);
                continue;
            }

            JsonNode error = message.get("error");
            if (error != null && !error.isNull()) {
                throw new ProtocolException(serverId,
                        error.has("code") ? error.get("code").asInt() : -1,
                        error.has("message") ? error.get("message").asText() : "Unknown tool server error",
                        error.toString());
            }
            JsonNode result = message.get("result");
            return result != null ? result : objectMapper.createObjectNode();
        }
    }

    private JsonNode parseLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        log.debug("[MCP:{}] ← {}", serverId, trimmed);
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("[MCP:{}] Skipping non-JSON line: {}", serverId, e.getOriginalMessage());
            return null;
        }
    }

    private void sendNotification(String method) throws TransportException {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);

        String json = toJson(notification);
        log.debug("[MCP:{}] → (notification) {}", serverId, json);
        transport.writeLine(json);
    }

    private String toJson(Map<String, Object> message) throws TransportException {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new TransportException(serverId, "Cannot serialize request: " + e.getOriginalMessage(), e);
        }
    }

    private List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.has("name") ? toolNode.get("name").asText() : null;
            if (name == null) {
                continue;
            }
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            JsonNode schemaNode = toolNode.get("inputSchema");
            if (schemaNode != null && schemaNode.isObject()) {
                inputSchema = objectMapper.convertValue(schemaNode, MAP_TYPE_REF);
            }

            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build());
        }
        return tools;
    }

    private void markFailed(String error) {
        state = McpClientState.FAILED;
        startupError = error;
        terminateTransport();
    }

    private void terminateTransport() {
        if (transport != null) {
            transport.terminate(settings.shutdownGrace());
        }
    }

    /**
     * Terminates the process in any state and resets the client so that
     * {@link #start()} can run again. Idempotent.
     */
    public void stop() {
        lock.lock();
        try {
            if (transport != null) {
                log.info("[MCP:{}] Stopping server", serverId);
                terminateTransport();
                transport = null;
            }
            nextId.set(1);
            negotiatedProtocolVersion = null;
            startupError = null;
            state = McpClientState.STOPPED;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public String getServerId() {
        return serverId;
    }

    public McpClientState getState() {
        return state;
    }

    public boolean isReady() {
        return state == McpClientState.READY;
    }

    /**
     * Version accepted by the server, or {@code null} before a successful
     * handshake.
     */
    public String getNegotiatedProtocolVersion() {
        return negotiatedProtocolVersion;
    }

    public String getStartupError() {
        return startupError;
    }
}
