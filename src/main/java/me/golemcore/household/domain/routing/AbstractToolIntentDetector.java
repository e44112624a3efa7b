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

package me.golemcore.household.domain.routing;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.household.domain.exception.ToolServerStartException;
import me.golemcore.household.domain.model.ConversationContext;
import me.golemcore.household.domain.model.Intent;
import me.golemcore.household.domain.model.ToolCallRecord;
import me.golemcore.household.domain.model.ToolCallResult;
import me.golemcore.household.domain.model.ToolFailureKind;
import me.golemcore.household.domain.model.ToolServerDefinition;
import me.golemcore.household.domain.tools.ToolCallRecorder;
import me.golemcore.household.domain.tools.ToolServerRegistry;
import me.golemcore.household.domain.tools.args.ToolArguments;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import me.golemcore.household.port.outbound.ToolSession;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Shared plumbing for detectors: enabled-server checks, tool invocation with
 * failure folding, and context updates.
 */
@Slf4j
public abstract class AbstractToolIntentDetector implements IntentDetector {

    protected static final Pattern HSA_CUE = Pattern.compile(
            "\\b(hsa|unreimbursed|reimburs\\w*|medical|balance)\\b", Pattern.CASE_INSENSITIVE);
    protected static final Pattern CHARITABLE_CUE = Pattern.compile(
            "\\b(charit\\w*|donat\\w*|giving|gave)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DETAILS_CUE = Pattern.compile(
            "\\b(details?|breakdown|itemi[sz]\\w*|entries|line items|which ones|list (them|those|it)"
                    + "|show (me )?(them|those|more))\\b",
            Pattern.CASE_INSENSITIVE);
    private static final int MAX_FOLLOW_UP_WORDS = 8;

    protected final ToolServerRegistry registry;
    protected final ToolCallRecorder recorder;
    protected final Clock clock;
    protected final Duration followUpWindow;

    protected AbstractToolIntentDetector(ToolServerRegistry registry, ToolCallRecorder recorder,
            AssistantProperties properties, Clock clock) {
        this.registry = registry;
        this.recorder = recorder;
        this.clock = clock;
        this.followUpWindow = properties.getRouting().getFollowUpWindow();
    }

    @Override
    public String getName() {
        return getClass().getSimpleName();
    }

    protected boolean isEnabled(ConversationContext context, String serverId) {
        return context.isServerEnabled(serverId) && registry.resolve(serverId).isPresent();
    }

    protected boolean isRecent(ConversationContext context, Intent intent) {
        return context.isRecentLastIntent(intent, clock.instant(), followUpWindow);
    }

    /**
     * A short message asking for more detail about the previous answer.
     */
    protected static boolean isDetailsRequest(String message) {
        String trimmed = message.strip();
        if (trimmed.isEmpty() || trimmed.split("\\s+").length > MAX_FOLLOW_UP_WORDS) {
            return false;
        }
        return DETAILS_CUE.matcher(trimmed).find();
    }

    protected String disabledReply(String serverId, String what) {
        String name = registry.resolve(serverId).map(ToolServerDefinition::getDisplayName).orElse(serverId);
        return "I can't look up " + what + " because the " + name
                + " tool server is turned off for this chat. Enable it and ask again.";
    }

    /**
     * Calls one tool and appends the call to {@code records}.
     */
    protected ToolCallResult invoke(ToolSession tools, String serverId, String toolName, ToolArguments arguments,
            List<ToolCallRecord> records) {
        ToolCallResult result = call(tools, serverId, toolName, arguments);
        records.add(recorder.record(serverId, toolName, arguments, result));
        return result;
    }

    /**
     * Calls one tool. Start failures and results reporting {@code success:false}
     * come back as failed results.
     */
    protected ToolCallResult call(ToolSession tools, String serverId, String toolName, ToolArguments arguments) {
        ToolCallResult result;
        try {
            result = tools.callTool(serverId, toolName, arguments);
        } catch (ToolServerStartException e) {
            log.warn("[Router] Could not start {} for {}: {}", serverId, toolName, e.getMessage());
            return ToolCallResult.failure(ToolFailureKind.EXECUTION_FAILED, e.getMessage());
        }
        if (result.isSuccess() && reportsFailure(result.getStructuredPayload())) {
            Object error = result.getStructuredPayload().get("error");
            return ToolCallResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    error != null ? String.valueOf(error) : "the tool reported a failure");
        }
        return result;
    }

    private static boolean reportsFailure(Map<String, Object> payload) {
        return payload != null && Boolean.FALSE.equals(payload.get("success"));
    }

    protected void remember(ConversationContext context, Intent intent, Map<String, Object> payload) {
        context.recordResult(intent, payload, clock.instant());
    }

    protected static Map<String, Object> payloadOf(ToolCallResult result) {
        return result.getStructuredPayload() != null ? result.getStructuredPayload() : Map.of();
    }
}
