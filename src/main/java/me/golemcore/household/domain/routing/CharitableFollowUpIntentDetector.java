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
import me.golemcore.household.domain.tools.ToolArgumentNormalizer;
import me.golemcore.household.domain.tools.ToolCallRecorder;
import me.golemcore.household.domain.tools.ToolServerRegistry;
import me.golemcore.household.domain.tools.args.ReadCharitableLedgerEntriesArgs;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import me.golemcore.household.port.outbound.ToolSession;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * "Show details" after a charitable summary, or after a dual summary when the
 * message mentions donations. Keeps the tax year of the summary.
 */
@Component
public class CharitableFollowUpIntentDetector extends AbstractToolIntentDetector {

    private final ToolArgumentNormalizer normalizer;

    public CharitableFollowUpIntentDetector(ToolServerRegistry registry, ToolCallRecorder recorder,
            AssistantProperties properties, Clock clock, ToolArgumentNormalizer normalizer) {
        super(registry, recorder, properties, clock);
        this.normalizer = normalizer;
    }

    @Override
    public int getOrder() {
        return 30;
    }

    @Override
    public boolean matches(String message, ConversationContext context) {
        if (!isDetailsRequest(message)) {
            return false;
        }
        if (isRecent(context, Intent.CHARITABLE_SUMMARY)) {
            return true;
        }
        return isRecent(context, Intent.DUAL_SUMMARY) && CHARITABLE_CUE.matcher(message).find();
    }

    @Override
    public RouteResult resolve(String message, ConversationContext context, ToolSession tools) {
        if (!isEnabled(context, ToolServerRegistry.CHARITABLE_LEDGER)) {
            return RouteResult.explanation(
                    disabledReply(ToolServerRegistry.CHARITABLE_LEDGER, "your charitable donations"));
        }
        Integer taxYear = context.getLastResult(Intent.CHARITABLE_SUMMARY)
                .map(result -> result.payload().get("tax_year"))
                .map(year -> (ReadCharitableLedgerEntriesArgs) normalizer.normalize(
                        "read_charitable_ledger_entries", Map.of("tax_year", year)))
                .map(ReadCharitableLedgerEntriesArgs::taxYear)
                .orElse(null);

        List<ToolCallRecord> records = new ArrayList<>();
        ReadCharitableLedgerEntriesArgs args = new ReadCharitableLedgerEntriesArgs(taxYear, null, null, null, null);
        ToolCallResult result = invoke(tools, ToolServerRegistry.CHARITABLE_LEDGER,
                "read_charitable_ledger_entries", args, records);
        if (!result.isSuccess()) {
            return new RouteResult("I couldn't load your donations right now: " + result.getError(), null,
                    records);
        }

        Map<String, Object> payload = payloadOf(result);
        remember(context, Intent.CHARITABLE_DETAILS, payload);
        return new RouteResult(formatEntries(payload), Intent.CHARITABLE_DETAILS, records);
    }

    private static String formatEntries(Map<String, Object> payload) {
        if (!(payload.get("entries") instanceof List<?> entries) || entries.isEmpty()) {
            return "I didn't find any charitable donations for that period.";
        }
        StringBuilder sb = new StringBuilder("Your charitable donations:");
        int listed = 0;
        for (Object item : entries) {
            if (listed == BalanceFollowUpIntentDetector.MAX_LISTED) {
                break;
            }
            if (item instanceof Map<?, ?> entry) {
                sb.append("\n- ").append(entry.get("donation_date") != null ? entry.get("donation_date") : "?")
                        .append(' ')
                        .append(entry.get("organization_name") != null ? entry.get("organization_name") : "?")
                        .append(": ").append(ReplyFormat.money(entry.get("amount")));
                if (Boolean.FALSE.equals(entry.get("tax_deductible"))) {
                    sb.append(" (not deductible)");
                }
                listed++;
            }
        }
        if (entries.size() > listed) {
            sb.append("\n...and ").append(entries.size() - listed).append(" more.");
        }
        return sb.toString();
    }
}
