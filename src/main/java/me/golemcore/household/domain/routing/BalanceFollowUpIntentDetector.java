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

import me.golemcore.household.domain.model.ConversationContext;
import me.golemcore.household.domain.model.Intent;
import me.golemcore.household.domain.model.ToolCallRecord;
import me.golemcore.household.domain.model.ToolCallResult;
import me.golemcore.household.domain.tools.ToolCallRecorder;
import me.golemcore.household.domain.tools.ToolServerRegistry;
import me.golemcore.household.domain.tools.args.ReadLedgerEntriesArgs;
import me.golemcore.household.domain.tools.args.ReimbursementStatus;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import me.golemcore.household.port.outbound.ToolSession;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * "Show details" right after a balance answer: lists the unreimbursed
 * expenses behind it.
 */
@Component
public class BalanceFollowUpIntentDetector extends AbstractToolIntentDetector {

    static final int MAX_LISTED = 10;

    public BalanceFollowUpIntentDetector(ToolServerRegistry registry, ToolCallRecorder recorder,
            AssistantProperties properties, Clock clock) {
        super(registry, recorder, properties, clock);
    }

    @Override
    public int getOrder() {
        return 20;
    }

    @Override
    public boolean matches(String message, ConversationContext context) {
        if (!isDetailsRequest(message)) {
            return false;
        }
        if (isRecent(context, Intent.BALANCE_QUERY)) {
            return true;
        }
        return isRecent(context, Intent.DUAL_SUMMARY) && !CHARITABLE_CUE.matcher(message).find();
    }

    @Override
    public RouteResult resolve(String message, ConversationContext context, ToolSession tools) {
        if (!isEnabled(context, ToolServerRegistry.HSA_LEDGER)) {
            return RouteResult.explanation(disabledReply(ToolServerRegistry.HSA_LEDGER, "your HSA expenses"));
        }
        List<ToolCallRecord> records = new ArrayList<>();
        ReadLedgerEntriesArgs args = new ReadLedgerEntriesArgs(null, ReimbursementStatus.UNREIMBURSED, null, null);
        ToolCallResult result = invoke(tools, ToolServerRegistry.HSA_LEDGER, "read_ledger_entries", args, records);
        if (!result.isSuccess()) {
            return new RouteResult("I couldn't load your unreimbursed expenses right now: " + result.getError(),
                    null, records);
        }

        Map<String, Object> payload = payloadOf(result);
        remember(context, Intent.BALANCE_DETAILS, payload);
        return new RouteResult(formatEntries(payload), Intent.BALANCE_DETAILS, records);
    }

    private static String formatEntries(Map<String, Object> payload) {
        if (!(payload.get("entries") instanceof List<?> entries) || entries.isEmpty()) {
            return "You have no unreimbursed HSA expenses.";
        }
        StringBuilder sb = new StringBuilder("Your unreimbursed HSA expenses:");
        int listed = 0;
        for (Object item : entries) {
            if (listed == MAX_LISTED) {
                break;
            }
            if (item instanceof Map<?, ?> entry) {
                sb.append("\n- ").append(text(entry.get("service_date"))).append(' ')
                        .append(text(entry.get("provider"))).append(": ")
                        .append(ReplyFormat.money(entry.get("amount")));
                listed++;
            }
        }
        if (entries.size() > listed) {
            sb.append("\n...and ").append(entries.size() - listed).append(" more.");
        }
        return sb.toString();
    }

    private static String text(Object value) {
        return value != null ? String.valueOf(value) : "?";
    }
}
