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

package me.golemcore.household.domain.loop;

import me.golemcore.household.domain.exception.ToolServerStartException;
import me.golemcore.household.domain.model.ConversationContext;
import me.golemcore.household.domain.model.Intent;
import me.golemcore.household.domain.model.LlmRequest;
import me.golemcore.household.domain.model.LlmResponse;
import me.golemcore.household.domain.model.Message;
import me.golemcore.household.domain.model.ToolCallRecord;
import me.golemcore.household.domain.model.ToolCallResult;
import me.golemcore.household.domain.model.ToolContract;
import me.golemcore.household.domain.model.ToolDefinition;
import me.golemcore.household.domain.model.ToolFailureKind;
import me.golemcore.household.domain.tools.ToolArgumentNormalizer;
import me.golemcore.household.domain.tools.ToolCallRecorder;
import me.golemcore.household.domain.tools.ToolCatalog;
import me.golemcore.household.domain.tools.args.PassthroughArgs;
import me.golemcore.household.domain.tools.args.ToolArguments;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import me.golemcore.household.port.outbound.LlmPort;
import me.golemcore.household.port.outbound.ToolServerPort;
import me.golemcore.household.port.outbound.ToolSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded model/tool loop used when the deterministic router does not match.
 *
 * <p>
 * Each round asks the model with the conversation and the enabled tool schema.
 * Plain text ends the run. Tool calls are executed through one
 * {@link ToolSession} per run and their results appended as tool messages.
 * After the configured number of rounds the fixed limit message is returned.
 *
 * <p>
 * Every server process started during a run is stopped before {@link #run}
 * returns or throws.
 */
@Service
public class ToolOrchestrationLoop {

    private static final Logger log = LoggerFactory.getLogger(ToolOrchestrationLoop.class);
    private static final String UNKNOWN_SERVER = "unknown";

    private static final Map<String, Intent> INTENT_BY_TOOL = Map.of(
            "get_unreimbursed_balance", Intent.BALANCE_QUERY,
            "read_ledger_entries", Intent.BALANCE_DETAILS,
            "get_charitable_summary", Intent.CHARITABLE_SUMMARY,
            "read_charitable_ledger_entries", Intent.CHARITABLE_DETAILS,
            "add_numbers", Intent.ARITHMETIC);

    private final LlmPort llmPort;
    private final ToolServerPort toolServerPort;
    private final ToolCatalog catalog;
    private final ToolArgumentNormalizer normalizer;
    private final ToolCallRecorder recorder;
    private final AssistantProperties.ToolLoopProperties loopSettings;
    private final AssistantProperties.LlmProperties llmSettings;
    private final Clock clock;

    public ToolOrchestrationLoop(LlmPort llmPort, ToolServerPort toolServerPort, ToolCatalog catalog,
            ToolArgumentNormalizer normalizer, ToolCallRecorder recorder, AssistantProperties properties,
            Clock clock) {
        this.llmPort = llmPort;
        this.toolServerPort = toolServerPort;
        this.catalog = catalog;
        this.normalizer = normalizer;
        this.recorder = recorder;
        this.loopSettings = properties.getToolLoop();
        this.llmSettings = properties.getLlm();
        this.clock = clock;
    }

    /**
     * Runs the loop for one request.
     *
     * @param sessionId
     *            session the request belongs to
     * @param history
     *            conversation so far, ending with the user's message
     * @param context
     *            session context; updated after each successful tool call
     * @throws ToolServerStartException
     *             if a tool server cannot be started at all
     */
    public OrchestrationResult run(String sessionId, List<Message> history, ConversationContext context)
            throws ToolServerStartException {
        List<Message> messages = new ArrayList<>(history);
        List<ToolDefinition> tools = catalog.modelToolDefinitions(context.getEnabledToolServerIds());
        List<ToolCallRecord> records = new ArrayList<>();
        int maxRounds = loopSettings.getMaxRounds();
        int rounds = 0;

        try (ToolSession session = toolServerPort.openSession()) {
            while (rounds < maxRounds) {
                LlmResponse response = llmPort.chat(buildRequest(sessionId, messages, tools)).join();
                rounds++;

                if (response == null || !response.hasToolCalls()) {
                    String text = response != null && response.getContent() != null ? response.getContent() : "";
                    log.debug("[ToolLoop] Final answer after {} round(s)", rounds);
                    return new OrchestrationResult(text, rounds, records, false);
                }

                messages.add(Message.builder()
                        .role(Message.ROLE_ASSISTANT)
                        .content(response.getContent())
                        .toolCalls(response.getToolCalls())
                        .timestamp(clock.instant())
                        .build());

                for (Message.ToolCall toolCall : response.getToolCalls()) {
                    ToolCallResult result = execute(session, toolCall, context, records);
                    messages.add(Message.builder()
                            .role(Message.ROLE_TOOL)
                            .content(result.toModelContent())
                            .toolCallId(toolCall.getId())
                            .toolName(toolCall.getName())
                            .timestamp(clock.instant())
                            .build());
                }
            }
        }

        log.warn("[ToolLoop] Reached max rounds ({}) for session {}", maxRounds, sessionId);
        return new OrchestrationResult(loopSettings.getLimitMessage(), rounds, records, true);
    }

    private ToolCallResult execute(ToolSession session, Message.ToolCall toolCall, ConversationContext context,
            List<ToolCallRecord> records) throws ToolServerStartException {
        String toolName = toolCall.getName();
        Optional<ToolContract> contract = catalog.resolve(toolName);
        if (contract.isEmpty()) {
            log.warn("[ToolLoop] Model requested unknown tool '{}'", toolName);
            ToolCallResult result = ToolCallResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Unknown tool: " + toolName);
            records.add(recorder.record(UNKNOWN_SERVER, toolName, new PassthroughArgs(toolCall.getArguments()),
                    result));
            return result;
        }

        String serverId = contract.get().serverId();
        ToolArguments arguments = normalizer.normalize(toolName, toolCall.getArguments());
        ToolCallResult result;
        if (!context.isServerEnabled(serverId)) {
            log.info("[ToolLoop] Tool '{}' requested but server {} is disabled", toolName, serverId);
            result = ToolCallResult.failure(ToolFailureKind.SERVER_DISABLED,
                    "Tool server '" + serverId + "' is disabled for this chat");
        } else {
            log.debug("[ToolLoop] Calling {} on {}", toolName, serverId);
            result = session.callTool(serverId, toolName, arguments);
            if (result.isSuccess()) {
                rememberResult(context, toolName, result);
            }
        }
        records.add(recorder.record(serverId, toolName, arguments, result));
        return result;
    }

    private void rememberResult(ConversationContext context, String toolName, ToolCallResult result) {
        Intent intent = INTENT_BY_TOOL.get(toolName);
        if (intent == null) {
            return;
        }
        Map<String, Object> payload = result.hasStructuredPayload() ? result.getStructuredPayload() : Map.of();
        if (Boolean.FALSE.equals(payload.get("success"))) {
            return;
        }
        context.recordResult(intent, payload, clock.instant());
    }

    private LlmRequest buildRequest(String sessionId, List<Message> messages, List<ToolDefinition> tools) {
        return LlmRequest.builder()
                .model(llmSettings.getModel())
                .systemPrompt(llmSettings.getSystemPrompt())
                .messages(new ArrayList<>(messages))
                .tools(tools)
                .temperature(llmSettings.getTemperature())
                .sessionId(sessionId)
                .build();
    }
}
