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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.household.domain.exception.McpException;
import me.golemcore.household.domain.exception.ToolServerStartException;
import me.golemcore.household.domain.model.ToolDefinition;
import me.golemcore.household.domain.model.ToolServerDefinition;
import me.golemcore.household.domain.tools.ToolServerRegistry;
import me.golemcore.household.port.outbound.ToolServerPort;
import me.golemcore.household.port.outbound.ToolSession;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link ToolServerPort} backed by stdio subprocesses.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class McpToolServerAdapter implements ToolServerPort {

    private final McpClientFactory clientFactory;
    private final ToolServerRegistry registry;

    @Override
    public ToolSession openSession() {
        return new McpSessionScope(clientFactory, registry);
    }

    @Override
    public List<ToolDefinition> listTools(String serverId) throws ToolServerStartException {
        ToolServerDefinition definition = registry.resolve(serverId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown tool server: " + serverId));
        try (McpClient client = clientFactory.create(definition)) {
            client.start();
            List<ToolDefinition> tools = client.listTools();
            log.info("[McpManager] {} advertises tools: {}", serverId,
                    tools.stream().map(ToolDefinition::getName).toList());
            return tools;
        } catch (ToolServerStartException e) {
            throw e;
        } catch (McpException e) {
            log.warn("[McpManager] tools/list failed for {}: {}", serverId, e.getMessage());
            return List.of();
        }
    }
}
