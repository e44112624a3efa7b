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
import me.golemcore.household.infrastructure.config.AssistantProperties;
import me.golemcore.household.port.outbound.ToolSession;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "How much did we donate in 2025?": one {@code get_charitable_summary} call,
 * for the named tax year when there is one.
 */
@Component
public class CharitableSummaryIntentDetector extends AbstractToolIntentDetector {

    private static final Pattern SUMMARY_CUE = Pattern.compile(
            "\\b(how much|total|totals|summary|summari[sz]e|overview|so far|this year|last year|20\\d{2}"
                    + "|did (i|we) (give|donate))\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR = Pattern.compile("\\b(20\\d{2})\\b");
    private static final Pattern THIS_YEAR = Pattern.compile("\\bthis year\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LAST_YEAR = Pattern.compile("\\blast year\\b", Pattern.CASE_INSENSITIVE);

    public CharitableSummaryIntentDetector(ToolServerRegistry registry, ToolCallRecorder recorder,
            AssistantProperties properties, Clock clock) {
        super(registry, recorder, properties, clock);
    }

    @Override
    public int getOrder() {
        return 40;
    }

    @Override
    public boolean matches(String message, ConversationContext context) {
        return CHARITABLE_CUE.matcher(message).find() && SUMMARY_CUE.matcher(message).find();
    }

    @Override
    public RouteResult resolve(String message, ConversationContext context, ToolSession tools) {
        if (!isEnabled(context, ToolServerRegistry.CHARITABLE_LEDGER)) {
            return RouteResult.explanation(
                    disabledReply(ToolServerRegistry.CHARITABLE_LEDGER, "your charitable donations"));
        }
        Integer taxYear = taxYear(message);
        List<ToolCallRecord> records = new ArrayList<>();
        ToolCallResult result = invoke(tools, ToolServerRegistry.CHARITABLE_LEDGER, "get_charitable_summary",
                CharitableSummaryArgs.forYear(taxYear), records);
        if (!result.isSuccess()) {
            return new RouteResult("I couldn't get your charitable summary right now: " + result.getError(), null,
                    records);
        }

        // Follow-ups list entries for the same year
        Map<String, Object> payload = new LinkedHashMap<>(payloadOf(result));
        if (taxYear != null) {
            payload.putIfAbsent("tax_year", taxYear);
        }
        remember(context, Intent.CHARITABLE_SUMMARY, payload);
        return new RouteResult(formatSummary(payload, taxYear), Intent.CHARITABLE_SUMMARY, records);
    }

    Integer taxYear(String message) {
        Matcher year = YEAR.matcher(message);
        if (year.find()) {
            return Integer.parseInt(year.group(1));
        }
        int current = LocalDate.now(clock).getYear();
        if (THIS_YEAR.matcher(message).find()) {
            return current;
        }
        if (LAST_YEAR.matcher(message).find()) {
            return current - 1;
        }
        return null;
    }

    static String formatSummary(Map<String, Object> payload, Integer taxYear) {
        String period = taxYear != null ? " in " + taxYear : "";
        StringBuilder sb = new StringBuilder("Your charitable donations").append(period).append(" total ")
                .append(ReplyFormat.money(payload.get("total")));
        if (payload.get("by_organization") instanceof Map<?, ?> byOrganization && !byOrganization.isEmpty()) {
            sb.append(" across ").append(ReplyFormat.plural(byOrganization.size(), "organization", "organizations"));
        }
        sb.append('.');
        if (payload.containsKey("tax_deductible_total")) {
            sb.append(' ').append(ReplyFormat.money(payload.get("tax_deductible_total")))
                    .append(" of that is tax-deductible.");
        }
        return sb.toString();
    }
}
