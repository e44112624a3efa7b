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

import me.golemcore.household.infrastructure.config.AssistantProperties;

import java.time.Duration;
import java.util.List;

/**
 * Protocol knobs shared by every client.
 *
 * @param protocolVersions
 *            versions offered in {@code initialize}, newest first
 * @param startupTimeout
 *            wait for each handshake response
 * @param requestTimeout
 *            total wait for a tool call response, stray lines included
 * @param shutdownGrace
 *            time between terminate and force-kill
 */
public record McpClientSettings(List<String> protocolVersions, Duration startupTimeout, Duration requestTimeout,
        Duration shutdownGrace) {

    public McpClientSettings {
        protocolVersions = List.copyOf(protocolVersions);
        if (protocolVersions.isEmpty()) {
            throw new IllegalArgumentException("At least one protocol version is required");
        }
    }

    public static McpClientSettings from(AssistantProperties.McpProperties properties) {
        return new McpClientSettings(
                properties.getProtocolVersions(),
                properties.getStartupTimeout(),
                properties.getRequestTimeout(),
                properties.getShutdownGrace());
    }
}
