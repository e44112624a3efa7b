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
import me.golemcore.household.domain.tools.args.AddNumbersArgs;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import me.golemcore.household.port.outbound.ToolSession;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "2+2" or "add 3 and 4", answered by the test addition server. Active when
 * that server is enabled or the message asks for the tool by name.
 */
@Component
public class ArithmeticIntentDetector extends AbstractToolIntentDetector {

    private static final String NUMBER = "(-?\\d+(?:\\.\\d+)?)";
    private static final Pattern PLUS = Pattern.compile(NUMBER + "\\s*\\+\\s*" + NUMBER);
    private static final Pattern ADD = Pattern.compile("\\badd\\s+" + NUMBER + "\\s+(?:and|to)\\s+" + NUMBER + "\\b",
            Pattern.CASE_INSENSITIVE);
    private static final List<String> EXPLICIT_TOOL_CUES = List.of("addition tool", "add_numbers", "mcp server",
            "mcp-server");

    private final ToolArgumentNormalizer normalizer;

    public ArithmeticIntentDetector(ToolServerRegistry registry, ToolCallRecorder recorder,
            AssistantProperties properties, Clock clock, ToolArgumentNormalizer normalizer) {
        super(registry, recorder, properties, clock);
        this.normalizer = normalizer;
    }

    record Operands(String a, String b) {
    }

    @Override
    public int getOrder() {
        return 60;
    }

    @Override
    public boolean matches(String message, ConversationContext context) {
        boolean active = context.isServerEnabled(ToolServerRegistry.TEST_ADDITION) || namesTheTool(message);
        return active && operands(message).isPresent();
    }

    @Override
    public RouteResult resolve(String message, ConversationContext context, ToolSession tools) {
        Operands operands = operands(message).orElseThrow();
        if (registry.resolve(ToolServerRegistry.TEST_ADDITION).isEmpty()) {
            return RouteResult.explanation("The addition tool server is not installed.");
        }
        if (!context.isServerEnabled(ToolServerRegistry.TEST_ADDITION)) {
            return RouteResult.explanation(disabledReply(ToolServerRegistry.TEST_ADDITION, "that sum"));
        }

        AddNumbersArgs args = (AddNumbersArgs) normalizer.normalize("add_numbers",
                Map.of("a", operands.a(), "b", operands.b()));
        double a = args.a().doubleValue();
        double b = args.b().doubleValue();
        String input = ReplyFormat.number(a) + " + " + ReplyFormat.number(b);

        ToolCallResult result = call(tools, ToolServerRegistry.TEST_ADDITION, "add_numbers", args);
        if (!result.isSuccess()) {
            ToolCallRecord failed = recorder.record(ToolServerRegistry.TEST_ADDITION, "add_numbers", input, result);
            return new RouteResult("I tried the addition tool, but it failed: " + result.getError(), null,
                    List.of(failed));
        }

        String display = ReplyFormat.number(sumOf(result, a + b));
        ToolCallRecord toolCall = new ToolCallRecord(ToolServerRegistry.TEST_ADDITION, "add_numbers", input,
                display);
        remember(context, Intent.ARITHMETIC, payloadOf(result));
        return new RouteResult("Using your addition tool: " + input + " = " + display, Intent.ARITHMETIC,
                List.of(toolCall));
    }

    private static boolean namesTheTool(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return EXPLICIT_TOOL_CUES.stream().anyMatch(lower::contains);
    }

    static Optional<Operands> operands(String message) {
        Matcher plus = PLUS.matcher(message);
        if (plus.find()) {
            return Optional.of(new Operands(plus.group(1), plus.group(2)));
        }
        Matcher add = ADD.matcher(message);
        if (add.find()) {
            return Optional.of(new Operands(add.group(1), add.group(2)));
        }
        return Optional.empty();
    }

    /**
     * Prefers the server's {@code sum}, then a numeric text reply, then the
     * local sum.
     */
    private static double sumOf(ToolCallResult result, double fallback) {
        Map<String, Object> payload = result.getStructuredPayload();
        if (payload != null && payload.get("sum") != null) {
            return ReplyFormat.toDouble(payload.get("sum"));
        }
        String raw = result.getRawText();
        if (raw != null) {
            try {
                return Double.parseDouble(raw.strip());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
