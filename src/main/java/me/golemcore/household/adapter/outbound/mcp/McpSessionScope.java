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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.household.domain.exception.ProtocolException;
import me.golemcore.household.domain.exception.ReadTimeoutException;
import me.golemcore.household.domain.exception.ToolServerStartException;
import me.golemcore.household.domain.exception.TransportException;
import me.golemcore.household.domain.exception.UnexpectedExitException;
import me.golemcore.household.domain.model.ToolCallResult;
import me.golemcore.household.domain.model.ToolFailureKind;
import me.golemcore.household.domain.model.ToolServerDefinition;
import me.golemcore.household.domain.tools.ToolServerRegistry;
import me.golemcore.household.domain.tools.args.ToolArguments;
import me.golemcore.household.port.outbound.ToolSession;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the tool server processes of one request.
 *
 * <p>
 * Clients are created and started on first use and reused for later calls to
 * the same server. A client that is no longer {@code READY} is stopped and
 * started again. {@link #close()} stops every client; it runs on every exit
 * path of the caller.
 */
@Slf4j
public class McpSessionScope implements ToolSession {

    private final McpClientFactory clientFactory;
    private final ToolServerRegistry registry;
    private final Map<String, McpClient> clients = new LinkedHashMap<>();
    private boolean closed;

    public McpSessionScope(McpClientFactory clientFactory, ToolServerRegistry registry) {
        this.clientFactory = clientFactory;
        this.registry = registry;
    }

    @Override
    public synchronized ToolCallResult callTool(String serverId, String toolName, ToolArguments arguments)
            throws ToolServerStartException {
        if (closed) {
            throw new IllegalStateException("Tool session already closed");
        }
        Optional<ToolServerDefinition> definition = registry.resolve(serverId);
        if (definition.isEmpty()) {
            return ToolCallResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Unknown tool server: " + serverId);
        }

        McpClient client = readyClient(definition.get());
        try {
            return client.callTool(toolName, arguments.toWireMap());
        } catch (ProtocolException e) {
            log.warn("[McpSession] {} on {} returned error {}: {}", toolName, serverId, e.getCode(), e.getMessage());
            return ToolCallResult.failure(ToolFailureKind.PROTOCOL_ERROR,
                    "Tool server error " + e.getCode() + ": " + e.getMessage() + " " + e.getErrorPayload());
        } catch (UnexpectedExitException e) {
            log.warn("[McpSession] {} exited during {}: {}", serverId, toolName, e.getMessage());
            return ToolCallResult.failure(ToolFailureKind.UNEXPECTED_EXIT, e.getMessage());
        } catch (ReadTimeoutException e) {
            log.warn("[McpSession] {} timed out during {}", serverId, toolName);
            return ToolCallResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool server '" + serverId + "' did not answer in time");
        } catch (TransportException e) {
            log.warn("[McpSession] Transport failure talking to {}: {}", serverId, e.getMessage());
            return ToolCallResult.failure(ToolFailureKind.EXECUTION_FAILED, e.getMessage());
        }
    }

    private McpClient readyClient(ToolServerDefinition definition) throws ToolServerStartException {
        McpClient client = clients.get(definition.getId());
        if (client == null) {
            client = clientFactory.create(definition);
            clients.put(definition.getId(), client);
        } else if (!client.isReady()) {
            log.info("[McpSession] Restarting {} (state {})", definition.getId(), client.getState());
            client.stop();
        }
        client.start();
        return client;
    }

    /**
     * Number of servers started (or attempted) in this scope.
     */
    public synchronized int getClientCount() {
        return clients.size();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (McpClient client : clients.values()) {
            try {
                client.stop();
            } catch (RuntimeException e) {
                log.warn("[McpSession] Failed to stop {}: {}", client.getServerId(), e.getMessage());
            }
        }
        clients.clear();
    }
}
