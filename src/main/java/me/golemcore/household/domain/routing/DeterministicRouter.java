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
import me.golemcore.household.domain.model.ConversationContext;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import me.golemcore.household.port.outbound.ToolServerPort;
import me.golemcore.household.port.outbound.ToolSession;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Answers common queries without the language model.
 *
 * <p>
 * Detectors are tried in ascending order: dual summary, balance follow-up,
 * charitable follow-up, charitable summary, balance, addition. The first match
 * resolves the message inside its own tool session, closed before returning.
 */
@Service
@Slf4j
public class DeterministicRouter {

    private final List<IntentDetector> detectors;
    private final ToolServerPort toolServerPort;
    private final boolean enabled;

    public DeterministicRouter(List<IntentDetector> detectors, ToolServerPort toolServerPort,
            AssistantProperties properties) {
        this.detectors = detectors.stream()
                .sorted(Comparator.comparingInt(IntentDetector::getOrder))
                .toList();
        this.toolServerPort = toolServerPort;
        this.enabled = properties.getRouting().isEnabled();
        log.debug("[Router] Detectors: {}", this.detectors.stream().map(IntentDetector::getName).toList());
    }

    /**
     * Finds the first matching detector and resolves the message with it.
     *
     * @return empty when routing is disabled or nothing matches
     */
    public Optional<RouteResult> route(String message, ConversationContext context) {
        if (!enabled || message == null || message.isBlank()) {
            return Optional.empty();
        }
        Optional<IntentDetector> detector = findMatch(message, context);
        if (detector.isEmpty()) {
            return Optional.empty();
        }

        log.info("[Router] {} matched", detector.get().getName());
        return Optional.of(resolveWith(detector.get(), message, context));
    }

    /**
     * Resolves the message with the given detector, skipping matching. Used by
     * commands that map straight to one query.
     */
    public RouteResult resolveWith(IntentDetector detector, String message, ConversationContext context) {
        try (ToolSession tools = toolServerPort.openSession()) {
            RouteResult result = detector.resolve(message, context, tools);
            log.debug("[Router] {} resolved={} with {} tool call(s)", detector.getName(),
                    result.isResolved(), result.toolCalls().size());
            return result;
        }
    }

    public Optional<IntentDetector> findMatch(String message, ConversationContext context) {
        return detectors.stream()
                .filter(detector -> detector.matches(message, context))
                .findFirst();
    }
}
