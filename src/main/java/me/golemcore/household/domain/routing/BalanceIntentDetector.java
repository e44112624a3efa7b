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
import me.golemcore.household.domain.tools.args.UnreimbursedBalanceArgs;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import me.golemcore.household.port.outbound.ToolSession;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * "What's my balance?": one {@code get_unreimbursed_balance} call.
 */
@Component
public class BalanceIntentDetector extends AbstractToolIntentDetector {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\b(balance|unreimbursed)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bhow much\\b.{0,40}\\b(hsa|reimburs\\w*|owed?)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bhsa\\b.{0,20}\\b(money|amount|total)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bwaiting\\b.{0,20}\\breimburs\\w*", Pattern.CASE_INSENSITIVE));

    public BalanceIntentDetector(ToolServerRegistry registry, ToolCallRecorder recorder,
            AssistantProperties properties, Clock clock) {
        super(registry, recorder, properties, clock);
    }

    @Override
    public int getOrder() {
        return 50;
    }

    @Override
    public boolean matches(String message, ConversationContext context) {
        if (CHARITABLE_CUE.matcher(message).find()) {
            return false;
        }
        return PATTERNS.stream().anyMatch(pattern -> pattern.matcher(message).find());
    }

    @Override
    public RouteResult resolve(String message, ConversationContext context, ToolSession tools) {
        if (!isEnabled(context, ToolServerRegistry.HSA_LEDGER)) {
            return RouteResult.explanation(disabledReply(ToolServerRegistry.HSA_LEDGER, "your HSA balance"));
        }
        List<ToolCallRecord> records = new ArrayList<>();
        ToolCallResult result = invoke(tools, ToolServerRegistry.HSA_LEDGER, "get_unreimbursed_balance",
                new UnreimbursedBalanceArgs(), records);
        if (!result.isSuccess()) {
            return new RouteResult("I couldn't get your HSA balance right now: " + result.getError(), null, records);
        }

        Map<String, Object> payload = payloadOf(result);
        remember(context, Intent.BALANCE_QUERY, payload);
        return new RouteResult(formatBalance(payload), Intent.BALANCE_QUERY, records);
    }

    static String formatBalance(Map<String, Object> payload) {
        long count = ReplyFormat.toLong(payload.get("count"));
        return "Your unreimbursed HSA balance is " + ReplyFormat.money(payload.get("total_unreimbursed"))
                + " across " + ReplyFormat.plural(count, "expense", "expenses") + ".";
    }
}
