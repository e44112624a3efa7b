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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.household.domain.model.ToolServerDefinition;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds {@link McpClient}s from server definitions: resolves the command,
 * working directory and environment from configuration.
 */
@Component
public class McpClientFactory {

    private final AssistantProperties.McpProperties properties;
    private final McpClientSettings settings;
    private final ObjectMapper objectMapper;
    private final Function<String, McpTransport> transportFactory;

    @Autowired
    public McpClientFactory(AssistantProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, StdioProcessTransport::new);
    }

    McpClientFactory(AssistantProperties properties, ObjectMapper objectMapper,
            Function<String, McpTransport> transportFactory) {
        this.properties = properties.getMcp();
        this.settings = McpClientSettings.from(this.properties);
        this.objectMapper = objectMapper;
        this.transportFactory = transportFactory;
    }

    public McpClient create(ToolServerDefinition definition) {
        return new McpClient(definition.getId(), launchFor(definition), settings, objectMapper, transportFactory);
    }

    McpServerLaunch launchFor(ToolServerDefinition definition) {
        List<String> command = properties.getCommands().getOrDefault(definition.getId(), definition.getCommand());
        Map<String, String> env = new HashMap<>(properties.getEnv());
        env.put("HOUSEHOLD_TOOL_SERVER_ID", definition.getId());
        return new McpServerLaunch(command, resolveWorkingDirectory(definition.getWorkingDirectoryHint()), env);
    }

    /**
     * Absolute hints are used as-is, relative ones resolve against the server
     * base path, and a blank hint means the system temp directory.
     */
    Path resolveWorkingDirectory(String hint) {
        if (hint == null || hint.isBlank()) {
            return Path.of(System.getProperty("java.io.tmpdir"));
        }
        Path path = Path.of(hint);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(properties.getServerBasePath()).resolve(path).normalize();
    }
}
