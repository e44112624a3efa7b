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

package me.golemcore.household.adapter.inbound.command;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.household.domain.exception.ToolServerStartException;
import me.golemcore.household.domain.model.ChatSession;
import me.golemcore.household.domain.model.ConversationContext;
import me.golemcore.household.domain.model.ToolDefinition;
import me.golemcore.household.domain.model.ToolServerDefinition;
import me.golemcore.household.domain.routing.BalanceIntentDetector;
import me.golemcore.household.domain.routing.DeterministicRouter;
import me.golemcore.household.domain.routing.RouteResult;
import me.golemcore.household.domain.tools.ToolServerRegistry;
import me.golemcore.household.port.inbound.CommandPort;
import me.golemcore.household.port.outbound.ConversationHistoryPort;
import me.golemcore.household.port.outbound.ToolServerPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes slash commands to their handlers.
 *
 * <ul>
 * <li>/new, /reset - forget history and remembered results
 * <li>/balance - unreimbursed HSA balance, same as asking for it
 * <li>/tools [server] - list tool servers, or the live tools of one server
 * <li>/help - show available commands
 * </ul>
 *
 * <p>
 * Commands run in the caller's turn of the session and never reach the language
 * model.
 */
@Component
@Slf4j
public class ChatCommandRouter implements CommandPort {

    private static final String CMD_NEW = "new";
    private static final String CMD_RESET = "reset";
    private static final String CMD_BALANCE = "balance";
    private static final String CMD_TOOLS = "tools";
    private static final String CMD_HELP = "help";

    private static final List<CommandDefinition> COMMANDS = List.of(
            new CommandDefinition(CMD_NEW, "Start a new conversation", "/new"),
            new CommandDefinition(CMD_RESET, "Same as /new", "/reset"),
            new CommandDefinition(CMD_BALANCE, "Show your unreimbursed HSA balance", "/balance"),
            new CommandDefinition(CMD_TOOLS, "List tool servers, or the tools of one server", "/tools [server]"),
            new CommandDefinition(CMD_HELP, "Show available commands", "/help"));

    private final ConversationHistoryPort historyPort;
    private final ToolServerRegistry registry;
    private final ToolServerPort toolServerPort;
    private final DeterministicRouter router;
    private final BalanceIntentDetector balanceDetector;

    public ChatCommandRouter(ConversationHistoryPort historyPort, ToolServerRegistry registry,
            ToolServerPort toolServerPort, DeterministicRouter router, BalanceIntentDetector balanceDetector) {
        this.historyPort = historyPort;
        this.registry = registry;
        this.toolServerPort = toolServerPort;
        this.router = router;
        this.balanceDetector = balanceDetector;
        log.info("ChatCommandRouter initialized with commands: {}",
                COMMANDS.stream().map(CommandDefinition::name).toList());
    }

    @Override
    public CommandResult execute(String command, List<String> args, String sessionId) {
        log.debug("Executing command: /{} {}", command, args);
        return switch (command) {
        case CMD_NEW, CMD_RESET -> handleReset(sessionId);
        case CMD_BALANCE -> handleBalance(sessionId);
        case CMD_TOOLS -> args.isEmpty() ? handleToolServers(sessionId) : handleServerTools(args.get(0));
        case CMD_HELP -> handleHelp();
        default -> CommandResult.failure("Unknown command: /" + command + ". Try /help.");
        };
    }

    private CommandResult handleReset(String sessionId) {
        ChatSession session = historyPort.getOrCreate(sessionId);
        session.reset();
        historyPort.save(session);
        log.info("Session reset: {}", sessionId);
        return CommandResult.success("Started a new conversation.");
    }

    private CommandResult handleBalance(String sessionId) {
        ChatSession session = historyPort.getOrCreate(sessionId);
        RouteResult result = router.resolveWith(balanceDetector, "balance", session.getContext());
        historyPort.save(session);
        return result.isResolved() ? CommandResult.success(result.text()) : CommandResult.failure(result.text());
    }

    private CommandResult handleToolServers(String sessionId) {
        ConversationContext context = historyPort.getOrCreate(sessionId).getContext();
        StringBuilder sb = new StringBuilder("Tool servers:\n");
        for (ToolServerDefinition definition : registry.definitions()) {
            boolean enabled = context.isServerEnabled(definition.getId());
            sb.append(enabled ? "[on]  " : "[off] ")
                    .append(definition.getId())
                    .append(" - ")
                    .append(definition.getDisplayName());
            if (!definition.getToolNames().isEmpty()) {
                sb.append(" (").append(String.join(", ", definition.getToolNames())).append(')');
            }
            sb.append('\n');
        }
        return CommandResult.success(sb.toString().stripTrailing());
    }

    private CommandResult handleServerTools(String serverId) {
        Optional<ToolServerDefinition> definition = registry.resolve(serverId);
        if (definition.isEmpty()) {
            return CommandResult.failure("Unknown tool server: " + serverId);
        }
        List<ToolDefinition> tools;
        try {
            tools = toolServerPort.listTools(serverId);
        } catch (ToolServerStartException e) {
            log.warn("Cannot list tools of {}: {}", serverId, e.getMessage());
            return CommandResult.failure("Could not start " + definition.get().getDisplayName() + ": "
                    + e.getMessage());
        }
        StringBuilder sb = new StringBuilder(definition.get().getDisplayName());
        if (tools.isEmpty()) {
            sb.append(" reports no tools.\n");
        } else {
            sb.append(" tools:\n");
        }
        for (ToolDefinition tool : tools) {
            sb.append("- ").append(tool.getName());
            if (tool.getDescription() != null && !tool.getDescription().isBlank()) {
                sb.append(": ").append(tool.getDescription());
            }
            sb.append('\n');
        }
        appendSettings(sb, definition.get().getSettingsSchema());
        return CommandResult.success(sb.toString().stripTrailing());
    }

    private static void appendSettings(StringBuilder sb, List<Map<String, Object>> schema) {
        if (schema.isEmpty()) {
            return;
        }
        sb.append("Settings:\n");
        for (Map<String, Object> field : schema) {
            sb.append("- ").append(field.get("key"));
            Object label = field.get("label");
            if (label != null) {
                sb.append(" (").append(label).append(')');
            }
            if (Boolean.TRUE.equals(field.get("required"))) {
                sb.append(", required");
            }
            Object defaultValue = field.get("default");
            if (defaultValue != null) {
                sb.append(", default ").append(defaultValue);
            }
            sb.append('\n');
        }
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder("Available commands:\n");
        for (CommandDefinition definition : COMMANDS) {
            sb.append(definition.usage()).append(" - ").append(definition.description()).append('\n');
        }
        return CommandResult.success(sb.toString().stripTrailing());
    }

    private record CommandDefinition(String name, String description, String usage) {
    }
}
