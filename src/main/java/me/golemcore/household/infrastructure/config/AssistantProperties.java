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

package me.golemcore.household.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Main configuration properties for the household assistant.
 *
 * <p>
 * All configuration is organized under the {@code assistant.*} prefix:
 * <ul>
 * <li>{@link McpProperties} - tool server processes and the stdio
 * protocol</li>
 * <li>{@link ToolLoopProperties} - orchestration loop budget</li>
 * <li>{@link RoutingProperties} - deterministic router and follow-ups</li>
 * <li>{@link LlmProperties} - language model provider</li>
 * <li>{@link SessionProperties} - in-memory chat sessions</li>
 * <li>{@link ConsoleProperties} - interactive console</li>
 * </ul>
 *
 * <p>
 * An instance is built once at startup and handed to the router and the loop
 * through their constructors; nothing reads it through static state.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "assistant")
@Data
public class AssistantProperties {

    private McpProperties mcp = new McpProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private RoutingProperties routing = new RoutingProperties();
    private LlmProperties llm = new LlmProperties();
    private SessionProperties session = new SessionProperties();
    private ConsoleProperties console = new ConsoleProperties();

    // ==================== TOOL SERVERS ====================

    @Data
    public static class McpProperties {
        /**
         * Protocol versions offered during the initialize handshake, newest first.
         */
        private List<String> protocolVersions = new ArrayList<>(
                List.of("2025-06-18", "2025-03-26", "2024-11-05"));

        /** Max wait for each handshake response. */
        private Duration startupTimeout = Duration.ofSeconds(30);

        /** Max total wait for a tools/call response, stray lines included. */
        private Duration requestTimeout = Duration.ofSeconds(60);

        /** Grace period between terminate and force-kill. */
        private Duration shutdownGrace = Duration.ofSeconds(5);

        /**
         * Base directory for resolving each server's working directory hint.
         */
        private String serverBasePath = "/opt/household/tool-servers";

        /**
         * Comma-separated server ids enabled when a request does not specify any.
         * Blank means "every server marked default-enabled".
         */
        private String defaultEnabledServers = "";

        /** Optional JSON array of additional server definitions. */
        private String customServersJson = "";

        /** Per-server command overrides, keyed by server id. */
        private Map<String, List<String>> commands = new HashMap<>();

        /** Extra environment passed to every tool server process. */
        private Map<String, String> env = new HashMap<>();
    }

    // ==================== TOOL LOOP ====================

    @Data
    public static class ToolLoopProperties {
        /** Max model rounds per orchestration run. */
        private int maxRounds = 4;

        private String limitMessage = "I reached the tool-calling limit for this request. "
                + "Please try again, maybe with a more specific question.";
    }

    // ==================== ROUTING ====================

    @Data
    public static class RoutingProperties {
        private boolean enabled = true;

        /** How long a previous result counts as recent for follow-ups. */
        private Duration followUpWindow = Duration.ofMinutes(30);
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String apiKey = "";
        private String model = "openai/gpt-4o-mini";
        private double temperature = 0.3;
        private Duration timeout = Duration.ofSeconds(60);
        private String systemPrompt = "You are a household finance assistant. "
                + "Use the available tools to answer questions about HSA expenses and charitable donations.";
    }

    // ==================== SESSIONS ====================

    @Data
    public static class SessionProperties {
        private int maxHistory = 100;

        /** Threads used to run chat requests. */
        private int workerThreads = 8;
    }

    // ==================== CONSOLE ====================

    @Data
    public static class ConsoleProperties {
        /** Read chat messages from stdin when the application starts. */
        private boolean enabled = false;

        private String sessionId = "console";
    }
}
