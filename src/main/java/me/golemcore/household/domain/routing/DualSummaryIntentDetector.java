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
import me.golemcore.household.domain.tools.args.CharitableSummaryArgs;
import me.golemcore.household.domain.tools.args.UnreimbursedBalanceArgs;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import me.golemcore.household.port.outbound.ToolSession;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Questions about both ledgers at once ("HSA balance and donations", "summary
 * of both"). Runs before the single-ledger detectors so neither swallows it.
 *
 * <p>
 * When only one ledger is enabled, that one is answered and the reply says
 * the other is turned off.
 */
@Component
public class DualSummaryIntentDetector extends AbstractToolIntentDetector {

    private static final Pattern BOTH_CUE = Pattern.compile(
            "\\b(both|everything|all my (finances|ledgers))\\b.{0,40}\\b(summar\\w*|totals?|balances?|ledgers?"
                    + "|numbers|overview)\\b"
                    + "|\\b(summar\\w*|totals?|balances?|ledgers?|overview)\\b.{0,40}\\b(both|everything)\\b",
            Pattern.CASE_INSENSITIVE);

    public DualSummaryIntentDetector(ToolServerRegistry registry, ToolCallRecorder recorder,
            AssistantProperties properties, Clock clock) {
        super(registry, recorder, properties, clock);
    }

    @Override
    public int getOrder() {
        return 10;
    }

    @Override
    public boolean matches(String message, ConversationContext context) {
        if (BOTH_CUE.matcher(message).find()) {
            return true;
        }
        return HSA_CUE.matcher(message).find() && CHARITABLE_CUE.matcher(message).find();
    }

    @Override
    public RouteResult resolve(String message, ConversationContext context, ToolSession tools) {
        boolean hsaEnabled = isEnabled(context, ToolServerRegistry.HSA_LEDGER);
        boolean charitableEnabled = isEnabled(context, ToolServerRegistry.CHARITABLE_LEDGER);
        if (!hsaEnabled && !charitableEnabled) {
            return RouteResult.explanation("I can't summarize your HSA expenses or charitable donations because "
                    + "both ledger tool servers are turned off for this chat. Enable them and ask again.");
        }

        List<ToolCallRecord> records = new ArrayList<>();
        List<String> lines = new ArrayList<>();
        Map<String, Object> combined = new LinkedHashMap<>();

        if (hsaEnabled) {
            ToolCallResult balance = invoke(tools, ToolServerRegistry.HSA_LEDGER, "get_unreimbursed_balance",
                    new UnreimbursedBalanceArgs(), records);
            if (balance.isSuccess()) {
                Map<String, Object> payload = payloadOf(balance);
                remember(context, Intent.BALANCE_QUERY, payload);
                combined.put("hsa", payload);
                lines.add("HSA: " + BalanceIntentDetector.formatBalance(payload));
            } else {
                lines.add("HSA: I couldn't get your balance: " + balance.getError());
            }
        } else {
            lines.add("HSA: " + disabledReply(ToolServerRegistry.HSA_LEDGER, "your HSA balance"));
        }

        if (charitableEnabled) {
            ToolCallResult summary = invoke(tools, ToolServerRegistry.CHARITABLE_LEDGER, "get_charitable_summary",
                    CharitableSummaryArgs.forYear(null), records);
            if (summary.isSuccess()) {
                Map<String, Object> payload = payloadOf(summary);
                remember(context, Intent.CHARITABLE_SUMMARY, payload);
                combined.put("charitable", payload);
                lines.add("Charitable: " + CharitableSummaryIntentDetector.formatSummary(payload, null));
            } else {
                lines.add("Charitable: I couldn't get your donation summary: " + summary.getError());
            }
        } else {
            lines.add("Charitable: "
                    + disabledReply(ToolServerRegistry.CHARITABLE_LEDGER, "your charitable donations"));
        }

        String text = String.join("\n", lines);
        if (combined.isEmpty()) {
            return new RouteResult(text, null, records);
        }
        remember(context, Intent.DUAL_SUMMARY, combined);
        return new RouteResult(text, Intent.DUAL_SUMMARY, records);
    }
}
